package nasa.nccs.regrid.operator;

import ucar.ma2.Array;
import ucar.ma2.Index;

import java.util.Arrays;

/**
 * Tests whether cell bounds describe contiguous, non-overlapping cells. Bounds are either (n, 2) for
 * 1-d cells or (nx, ny, 4) for 2-d quadrilateral cells with vertices ordered lower-left,
 * lower-right, upper-right, upper-left.
 */
public final class BoundsContiguity {

    private BoundsContiguity() { }

    /**
     * @param cyclic whether differences are only significant modulo {@code period}, and whether the
     *               last cells along the first index must also wrap round onto the first ones
     */
    public static boolean isContiguous( Array bounds, boolean cyclic, double period ) {
        int ndim = bounds.getRank() - 1;
        int[] shape = bounds.getShape();
        Index ima = bounds.getIndex();
        if( ndim == 1 ) {
            int n = shape[0];
            for( int i = 0; i < n - 1; i++ ) {
                if( differ( value( bounds, ima, i, 1 ), value( bounds, ima, i + 1, 0 ), cyclic, period ) ) { return false; }
            }
            if( cyclic && differ( value( bounds, ima, n - 1, 1 ), value( bounds, ima, 0, 0 ), true, period ) ) { return false; }
            return true;
        }
        if( ndim == 2 ) {
            if( shape[2] != 4 ) {
                throw new IllegalArgumentException( String.format( "Can't tell if 2-d cells with %d vertices are contiguous", shape[2] ) );
            }
            int nx = shape[0];
            int ny = shape[1];
            for( int i = 0; i < nx; i++ ) {
                for( int j = 0; j < ny; j++ ) {
                    // Cells (i, j) and (i+1, j) share the right hand edge
                    if( i < nx - 1 ) {
                        if( differ( value( bounds, ima, i, j, 1 ), value( bounds, ima, i + 1, j, 0 ), cyclic, period ) ) { return false; }
                        if( differ( value( bounds, ima, i, j, 2 ), value( bounds, ima, i + 1, j, 3 ), cyclic, period ) ) { return false; }
                    }
                    // The last cell of a cyclic row shares its right hand edge with the first
                    if( cyclic && i == nx - 1 ) {
                        if( differ( value( bounds, ima, i, j, 1 ), value( bounds, ima, 0, j, 0 ), true, period ) ) { return false; }
                        if( differ( value( bounds, ima, i, j, 2 ), value( bounds, ima, 0, j, 3 ), true, period ) ) { return false; }
                    }
                    // Cells (i, j) and (i, j+1) share the upper edge
                    if( j < ny - 1 ) {
                        if( differ( value( bounds, ima, i, j, 3 ), value( bounds, ima, i, j + 1, 0 ), cyclic, period ) ) { return false; }
                        if( differ( value( bounds, ima, i, j, 2 ), value( bounds, ima, i, j + 1, 1 ), cyclic, period ) ) { return false; }
                    }
                }
            }
            return true;
        }
        throw new IllegalArgumentException( "Can't tell if cells with bounds of shape " + Arrays.toString( shape ) + " are contiguous" );
    }

    private static double value( Array bounds, Index ima, int... index ) { return bounds.getDouble( ima.set( index ) ); }

    private static boolean differ( double a, double b, boolean cyclic, double period ) {
        double diff = a - b;
        if( cyclic ) { diff = diff % period; }
        return diff != 0.0;
    }
}
