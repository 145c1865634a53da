package nasa.nccs.regrid;

/**
 * Base class of every failure raised while building, checking or applying a regrid operator.
 */
public class RegridException extends Exception {
    public RegridException( String message ) { super( message ); }

    public RegridException( String message, Throwable cause ) { super( message, cause ); }
}
