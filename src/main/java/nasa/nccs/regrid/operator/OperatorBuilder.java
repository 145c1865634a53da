package nasa.nccs.regrid.operator;

import nasa.nccs.regrid.GridIncompatibilityException;
import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.Units;
import nasa.nccs.regrid.engine.EngineGrid;
import nasa.nccs.regrid.engine.EngineSession;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.engine.UnmappedAction;
import nasa.nccs.regrid.engine.WeightEngine;
import nasa.nccs.regrid.engine.WeightEngineException;
import nasa.nccs.regrid.engine.Weights;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.grid.GridDescriptor;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the weights between two grids with the weight engine and packages them as a
 * {@link RegridOperator}.
 */
public class OperatorBuilder {
    private static final Logger logger = RegridLogManager.getLogger( OperatorBuilder.class );

    private final WeightEngine engine;
    private final RegridMethod method;
    private final UnmappedAction unmappedAction;
    private final boolean ignoreDegenerate;
    private final GridDiscretizer discretizer = new GridDiscretizer();

    public OperatorBuilder( WeightEngine engine, RegridMethod method, UnmappedAction unmappedAction, boolean ignoreDegenerate ) {
        this.engine = engine;
        this.method = method;
        this.unmappedAction = unmappedAction;
        this.ignoreDegenerate = ignoreDegenerate;
    }

    /**
     * Source grid coordinates converted to the units of the destination grid's. Spherical units were
     * already checked when the grids were built, so only Cartesian grids are changed. Coordinates
     * without units are left alone.
     */
    public static GridDescriptor conformUnits( GridDescriptor src, GridDescriptor dst ) throws GridIncompatibilityException {
        if( src.getCoordSystem() == CoordSystem.SPHERICAL ) { return src; }
        List<Array> coords = new ArrayList<Array>( src.getCoords() );
        List<Array> bounds = new ArrayList<Array>( src.getBounds() );
        List<String> units = new ArrayList<String>( src.getUnits() );
        boolean changed = false;
        int n = Math.min( coords.size(), dst.getCoords().size() );
        for( int dim = 0; dim < n; dim++ ) {
            String s = units.get( dim );
            String d = dst.getUnits().get( dim );
            if( Units.isUnset( s ) || Units.isUnset( d ) || s.trim().equals( d.trim() ) ) { continue; }
            if( !Units.equivalent( s, d ) ) {
                throw new GridIncompatibilityException( String.format( "Units of source and destination coordinates are not equivalent: '%s', '%s'", s, d ) );
            }
            coords.set( dim, Units.convert( coords.get( dim ), s, d ) );
            if( dim < bounds.size() ) { bounds.set( dim, Units.convert( bounds.get( dim ), s, d ) ); }
            units.set( dim, d );
            changed = true;
            logger.debug( String.format( "Converted source coordinates from '%s' to '%s'", s, d ) );
        }
        return changed ? src.withCoordinates( coords, bounds, units ) : src;
    }

    /**
     * @param srcMask     the source grid mask, in the source grid's shape; may be null
     * @param dstMask     the destination grid mask when it is to be used, otherwise null
     * @param useSrcMask  whether masked source cells mask the result; may only be false for nearest_stod
     * @param dstDomain   the destination domain, kept by the operator for metadata updates
     */
    public RegridOperator build( GridDescriptor src, GridDescriptor dst, ArrayBoolean srcMask, ArrayBoolean dstMask,
                                 boolean useSrcMask, Domain dstDomain ) throws RegridException {
        if( src.getCoordSystem() != dst.getCoordSystem() ) {
            throw new GridIncompatibilityException( String.format( "Source and destination coordinate systems differ: %s, %s", src.getCoordSystem(), dst.getCoordSystem() ) );
        }
        logger.info( String.format( "Building '%s' regrid operator: %s %s -> %s", method, src.getCoordSystem(),
                ArrayHelper.shapeString( src.getShape() ), ArrayHelper.shapeString( dst.getShape() ) ) );

        MaskPolicy policy = MaskPolicy.forMethod( method );
        boolean bakeSrc = policy.bakesSourceMask( method, useSrcMask );
        ArrayBoolean engineSrcMask = bakeSrc ? srcMask : null;
        ArrayBoolean engineDstMask = null;
        ArrayBoolean operatorDstMask = null;
        if( dstMask != null && ArrayHelper.any( dstMask ) ) {
            if( policy.bakesDestinationMask() ) { engineDstMask = dstMask; }
            else { operatorDstMask = dstMask; }
        }
        logger.debug( String.format( "%s: source mask %s, destination mask %s", policy, bakeSrc ? "baked" : "retrospective",
                ( engineDstMask != null ) ? "baked" : ( operatorDstMask != null ) ? "retrospective" : "none" ) );

        EngineGrid dstGrid = discretizer.discretize( dst, method, engineDstMask );
        EngineGrid srcGrid = discretizer.discretize( src, method, engineSrcMask );

        Weights weights;
        EngineSession session = engine.open();
        try {
            weights = session.computeWeights( srcGrid, dstGrid, method, unmappedAction, ignoreDegenerate );
        } finally {
            session.destroy();
        }

        if( src.hasSyntheticAxis() && !src.hasBounds() ) {
            // Keep the weights between cells of the real axes, which come first in both flattened grids
            int n = weights.size();
            weights = weights.restrict( dstGrid.getSize() / 2, srcGrid.getSize() / 2 );
            logger.debug( String.format( "Quarter truncation kept %d of %d weights", weights.size(), n ) );
        }

        // A baked mask with nothing masked is stored as no mask at all
        ArrayBoolean operatorSrcMask = ( bakeSrc && ArrayHelper.any( srcMask ) ) ? srcMask : null;

        RegridOperator operator;
        try {
            operator = new RegridOperator( weights, method, src.getCoordSystem(), src.getShape(), dst.getShape(),
                    src.isCyclic(), dst.isCyclic(), src.getCoords(), src.getBounds(), operatorSrcMask, bakeSrc, operatorDstMask,
                    dstDomain, dst.getAxisKeys() );
        } catch ( IllegalArgumentException ex ) {
            throw new WeightEngineException( "Invalid weights from the weight engine: " + ex.getMessage(), ex );
        }
        logger.info( "Built " + operator );
        return operator;
    }
}
