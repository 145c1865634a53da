package nasa.nccs.regrid.operator;

import nasa.nccs.regrid.GridIncompatibilityException;
import nasa.nccs.regrid.OperatorReuseException;
import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.grid.GridDescriptor;
import ucar.ma2.Array;

import java.util.Arrays;
import java.util.List;

/**
 * Checks that a regrid operator was built for the grid of a new source field.
 */
public final class OperatorCheck {

    private OperatorCheck() { }

    /**
     * @param source       names the source in error messages
     * @param coordinates  whether to also require identical source coordinates and bounds
     */
    public static void check( CoordSystem coordSystem, Object source, GridDescriptor srcGrid, RegridOperator operator,
                              boolean coordinates ) throws RegridException {
        String prefix = String.format( "Can't regrid %s with %s: ", source, operator );
        if( coordSystem != operator.getCoordSystem() ) {
            throw new GridIncompatibilityException( prefix + "Coordinate system mismatch" );
        }
        if( srcGrid.isCyclic() != operator.isSrcCyclic() ) {
            throw new OperatorReuseException( prefix + "Source grid cyclicity mismatch" );
        }
        if( !Arrays.equals( srcGrid.getShape(), operator.getSrcShape() ) ) {
            throw new OperatorReuseException( prefix + String.format( "Source grid shape mismatch: %s != %s",
                    ArrayHelper.shapeString( srcGrid.getShape() ), ArrayHelper.shapeString( operator.getSrcShape() ) ) );
        }
        if( !coordinates ) { return; }
        if( !allEqual( srcGrid.getCoords(), operator.getSrcCoords() ) ) {
            throw new OperatorReuseException( prefix + "Source grid coordinates mismatch" );
        }
        if( !allEqual( srcGrid.getBounds(), operator.getSrcBounds() ) ) {
            throw new OperatorReuseException( prefix + "Source grid coordinate bounds mismatch" );
        }
    }

    private static boolean allEqual( List<Array> a, List<Array> b ) {
        if( a.size() != b.size() ) { return false; }
        for( int i = 0; i < a.size(); i++ ) {
            if( !ArrayHelper.equal( a.get( i ), b.get( i ) ) ) { return false; }
        }
        return true;
    }
}
