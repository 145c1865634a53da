package nasa.nccs.regrid;

/**
 * The source and destination grids can not be regridded with the requested method: unit
 * mismatch, non-contiguous bounds, a size 1 axis, or a coordinate system mismatch.
 */
public class GridIncompatibilityException extends RegridException {
    public GridIncompatibilityException( String message ) { super( message ); }
}
