package nasa.nccs.regrid;

/**
 * An invalid or ambiguous method, axis specification or parameter combination.
 */
public class ConfigurationException extends RegridException {
    public ConfigurationException( String message ) { super( message ); }
}
