package nasa.nccs.regrid;

/**
 * The source mask changes across non-regrid dimensions but the weights were derived for a
 * single fixed mask.
 */
public class UnsupportedMaskVariationException extends RegridException {
    public UnsupportedMaskVariationException( String message ) { super( message ); }
}
