package nasa.nccs.regrid.operator;

import nasa.nccs.regrid.GridIncompatibilityException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.engine.EngineGrid;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.grid.GridDescriptor;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;
import ucar.ma2.Index;
import ucar.ma2.IndexIterator;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a grid descriptor into the grid handed to the weight engine: cell centres, cell corners
 * derived from contiguous bounds, and an integer mask.
 */
public class GridDiscretizer {
    public static final double LONGITUDE_PERIOD = 360.0;

    private static final Logger logger = RegridLogManager.getLogger( GridDiscretizer.class );

    /**
     * @param mask the mask to give the engine, in the grid's shape and axis order; may be null
     */
    public EngineGrid discretize( GridDescriptor grid, RegridMethod method, ArrayBoolean mask ) throws GridIncompatibilityException {
        List<Array> coords = grid.getCoords();
        boolean coords1d = coords.get( 0 ).getRank() == 1;
        int[] shape;
        if( coords1d ) {
            shape = new int[ coords.size() ];
            for( int dim = 0; dim < shape.length; dim++ ) { shape[dim] = (int) coords.get( dim ).getSize(); }
        } else {
            shape = coords.get( 0 ).getShape();
        }

        boolean spherical = grid.getCoordSystem() == CoordSystem.SPHERICAL;
        boolean periodic = spherical && grid.isCyclic();

        List<Array> corners = new ArrayList<Array>();
        if( grid.hasBounds() ) {
            List<Array> bounds = new ArrayList<Array>( grid.getBounds() );
            if( spherical ) { bounds.set( 1, clip( bounds.get( 1 ), -90.0, 90.0 ) ); }
            for( int dim = 0; dim < bounds.size(); dim++ ) {
                // Bounds are (longitude, latitude); only longitude is periodic
                boolean cyclic = periodic && dim == 0;
                if( !BoundsContiguity.isContiguous( bounds.get( dim ), cyclic, LONGITUDE_PERIOD ) ) {
                    throw new GridIncompatibilityException( String.format( "The %s coordinates must have contiguous, non-overlapping bounds for '%s' regridding",
                            grid.getRole(), method ) );
                }
            }
            for( int dim = 0; dim < bounds.size(); dim++ ) {
                corners.add( coords1d ? corners1d( bounds.get( dim ), periodic && dim == 0 ) : corners2d( bounds.get( dim ) ) );
            }
        }

        int[] engineMask = encodeMask( mask, shape );
        EngineGrid engineGrid = new EngineGrid( grid.getRole(), grid.getCoordSystem(), shape, periodic, coords, corners, engineMask );
        logger.debug( "Discretized " + engineGrid );
        return engineGrid;
    }

    /** Lower bounds then the last upper bound; just the lower bounds for a periodic axis. */
    static Array corners1d( Array bounds, boolean periodic ) {
        int n = bounds.getShape()[0];
        Index ima = bounds.getIndex();
        double[] values = new double[ periodic ? n : n + 1 ];
        for( int i = 0; i < n; i++ ) { values[i] = bounds.getDouble( ima.set( i, 0 ) ); }
        if( !periodic ) { values[n] = bounds.getDouble( ima.set( n - 1, 1 ) ); }
        return ArrayHelper.fromDoubles( values, values.length );
    }

    /** The (nx+1, ny+1) vertex array shared by contiguous quadrilateral cells. */
    static Array corners2d( Array bounds ) {
        int nx = bounds.getShape()[0];
        int ny = bounds.getShape()[1];
        Index ima = bounds.getIndex();
        double[] values = new double[ ( nx + 1 ) * ( ny + 1 ) ];
        for( int i = 0; i <= nx; i++ ) {
            for( int j = 0; j <= ny; j++ ) {
                double v;
                if( i < nx && j < ny ) { v = bounds.getDouble( ima.set( i, j, 0 ) ); }
                else if( j < ny ) { v = bounds.getDouble( ima.set( nx - 1, j, 1 ) ); }
                else if( i < nx ) { v = bounds.getDouble( ima.set( i, ny - 1, 3 ) ); }
                else { v = bounds.getDouble( ima.set( nx - 1, ny - 1, 2 ) ); }
                values[ i * ( ny + 1 ) + j ] = v;
            }
        }
        return ArrayHelper.fromDoubles( values, nx + 1, ny + 1 );
    }

    static Array clip( Array values, double min, double max ) {
        Array result = ArrayHelper.toDoubleArray( values );
        IndexIterator iter = result.getIndexIterator();
        while( iter.hasNext() ) {
            double v = iter.getDoubleNext();
            if( v < min ) { iter.setDoubleCurrent( min ); }
            else if( v > max ) { iter.setDoubleCurrent( max ); }
        }
        return result;
    }

    /**
     * Engine mask values, 1 for valid and 0 for masked, or null when nothing is masked. The grid's
     * mask flattens in the same order as the engine grid; a synthetic engine axis repeats it.
     */
    static int[] encodeMask( ArrayBoolean mask, int[] engineShape ) {
        if( mask == null || !ArrayHelper.any( mask ) ) { return null; }
        boolean[] masked = ArrayHelper.toBooleans( mask );
        int[] values = new int[ (int) ArrayHelper.product( engineShape ) ];
        for( int k = 0; k < values.length; k++ ) { values[k] = masked[ k % masked.length ] ? 0 : 1; }
        return values;
    }
}
