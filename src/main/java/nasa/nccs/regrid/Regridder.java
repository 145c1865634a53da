package nasa.nccs.regrid;

import nasa.nccs.regrid.apply.OperatorApplier;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.cdm.MaskedArray;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.engine.WeightEngine;
import nasa.nccs.regrid.engine.worker.WorkerWeightEngine;
import nasa.nccs.regrid.grid.AxisMapping;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.grid.GridBuilder;
import nasa.nccs.regrid.grid.GridDescriptor;
import nasa.nccs.regrid.grid.GridSpec;
import nasa.nccs.regrid.grid.MaskExtractor;
import nasa.nccs.regrid.metadata.AncillaryRegridder;
import nasa.nccs.regrid.metadata.MetadataPropagator;
import nasa.nccs.regrid.operator.OperatorBuilder;
import nasa.nccs.regrid.operator.OperatorCheck;
import nasa.nccs.regrid.operator.RegridOperator;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;
import ucar.ma2.ArrayBoolean;

import java.util.List;

/**
 * Regrids fields onto the grid of another field, a domain, an explicit {@link GridSpec}, or with a
 * previously built {@link RegridOperator}.
 * <p>
 * The source field is never modified: the result is a regridded copy whose metadata describes the
 * destination grid.
 */
public class Regridder implements AncillaryRegridder {
    private static final Logger logger = RegridLogManager.getLogger( Regridder.class );

    private final WeightEngine engine;
    private final GridBuilder gridBuilder = new GridBuilder();
    private final MaskExtractor maskExtractor = new MaskExtractor();
    private final OperatorApplier applier = new OperatorApplier();
    private final MetadataPropagator propagator = new MetadataPropagator( this );

    public Regridder() { this( WorkerWeightEngine.getInstance() ); }

    public Regridder( WeightEngine engine ) { this.engine = engine; }

    public Field regrid( Field src, Domain dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options.toBuilder().returnOperator( false ).build() ).getField();
    }

    public Field regrid( Field src, GridSpec dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options.toBuilder().returnOperator( false ).build() ).getField();
    }

    public Field regrid( Field src, RegridOperator operator, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( operator ), options ).getField();
    }

    public RegridOperator buildOperator( Field src, Domain dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options.toBuilder().returnOperator( true ).build() ).getOperator();
    }

    public RegridOperator buildOperator( Field src, GridSpec dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options.toBuilder().returnOperator( true ).build() ).getOperator();
    }

    public RegridResult execute( Field src, Domain dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options );
    }

    public RegridResult execute( Field src, GridSpec dst, RegridOptions options ) throws RegridException {
        return execute( src, Destination.of( dst, options ), options );
    }

    /** Regrids a domain ancillary, already converted to a field, with its parent's operator. */
    public Field regrid( Field ancillary, RegridOperator operator, List<String> srcAxisKeys ) throws RegridException {
        RegridOptions.Builder options = RegridOptions.builder().coordSystem( operator.getCoordSystem() ).srcCyclic( operator.isSrcCyclic() );
        if( operator.getCoordSystem() == CoordSystem.SPHERICAL ) {
            options.srcAxes( AxisMapping.ofAxes( srcAxisKeys.get( 1 ), srcAxisKeys.get( 0 ) ) );
        } else {
            options.axes( srcAxisKeys );
        }
        return regrid( ancillary, operator, options.build() );
    }

    private RegridResult execute( Field src, Destination dst, RegridOptions options ) throws RegridException {
        if( src.getData() == null ) {
            throw new ConfigurationException( String.format( "Can't regrid %s: it has no data", src ) );
        }
        CoordSystem coordSystem = options.getCoordSystem();
        RegridOperator operator = dst.operator;
        RegridMethod method;
        if( operator != null ) {
            method = operator.getMethod();
            if( operator.getCoordSystem() != coordSystem ) {
                throw new GridIncompatibilityException( String.format( "Can't regrid %s with %s: Coordinate system mismatch", src, operator ) );
            }
        } else {
            method = RegridMethod.parse( options.getMethod() );
            if( !options.isUseSrcMask() && method != RegridMethod.NEAREST_STOD ) {
                throw new ConfigurationException( String.format( "The 'useSrcMask' parameter can only be false when using the 'nearest_stod' regridding method, not '%s'", method ) );
            }
        }

        List<String> srcAxes = null;
        List<String> dstAxes = dst.axes;
        if( coordSystem == CoordSystem.CARTESIAN ) {
            srcAxes = options.getAxes();
            if( srcAxes == null ) {
                throw new ConfigurationException( "Must set the 'axes' parameter for Cartesian regridding" );
            }
            if( srcAxes.isEmpty() || srcAxes.size() > 3 ) {
                throw new ConfigurationException( "Between 1 and 3 axes must be individually specified for Cartesian regridding" );
            }
            if( method == RegridMethod.PATCH && srcAxes.size() != 2 ) {
                throw new ConfigurationException( "The patch recovery method is only available for 2-d regridding" );
            }
            if( dstAxes == null ) { dstAxes = srcAxes; }
        }

        logger.info( String.format( "Regridding %s onto %s with method '%s'", src, dst.domain, method ) );
        Field result = src.copy();
        GridDescriptor dstGrid = gridBuilder.build( coordSystem, dst.domain, "destination", method, dst.cyclic, dst.axisMapping, dstAxes );
        GridDescriptor srcGrid = gridBuilder.build( coordSystem, result, "source", method, options.getSrcCyclic(), options.getSrcAxes(), srcAxes );
        srcGrid = OperatorBuilder.conformUnits( srcGrid, dstGrid );

        if( operator == null ) {
            ArrayBoolean srcMask = maskExtractor.extract( result, srcGrid );
            ArrayBoolean dstMask = dst.useMask ? maskExtractor.extract( dst.domain, dstGrid ) : null;
            OperatorBuilder builder = new OperatorBuilder( engine, method, options.getUnmappedAction(), options.isIgnoreDegenerate() );
            operator = builder.build( srcGrid, dstGrid, srcMask, dstMask, options.isUseSrcMask(), dst.domain );
            if( options.isReturnOperator() ) { return RegridResult.ofOperator( operator ); }
        } else {
            OperatorCheck.check( coordSystem, src, srcGrid, operator, options.isCheckCoordinates() );
        }

        MaskedArray data = applier.apply( result.getData(), operator, srcGrid.getAxisIndexArray() );
        propagator.propagate( result, srcGrid.getAxisKeys(), dst.domain, dstGrid.getAxisKeys(), operator );
        result.setData( data, result.getDataAxes() );
        return RegridResult.ofField( result, operator );
    }

    /** A destination grid resolved to a domain, whatever form it was given in. */
    private static final class Destination {
        private Domain domain;
        private AxisMapping axisMapping;
        private List<String> axes;
        private Boolean cyclic;
        private boolean useMask;
        private RegridOperator operator;

        static Destination of( Domain dst, RegridOptions options ) {
            Destination d = new Destination();
            // The destination may get size 1 dimensions inserted into its data
            d.domain = dst.copy();
            d.axisMapping = options.getDstAxes();
            d.cyclic = options.getDstCyclic();
            d.useMask = ( dst instanceof Field ) && options.isUseDstMask();
            return d;
        }

        static Destination of( GridSpec dst, RegridOptions options ) throws ConfigurationException {
            if( dst.getCoordSystem() != options.getCoordSystem() ) {
                throw new ConfigurationException( String.format( "A %s grid specification can't be used for %s regridding", dst.getCoordSystem(), options.getCoordSystem() ) );
            }
            GridSpec.Resolved resolved = dst.toDomain( options.getDstCyclic() );
            Destination d = new Destination();
            d.domain = resolved.getDomain();
            d.axisMapping = resolved.getAxisMapping();
            d.cyclic = ( options.getDstCyclic() != null ) ? options.getDstCyclic() : dst.getCyclic();
            if( dst.getCoordSystem() == CoordSystem.CARTESIAN ) { d.axes = resolved.getAxisKeys(); }
            return d;
        }

        static Destination of( RegridOperator operator ) {
            Destination d = new Destination();
            d.operator = operator;
            d.domain = operator.getDst();
            List<String> keys = operator.getDstAxisKeys();
            if( operator.getCoordSystem() == CoordSystem.SPHERICAL ) {
                d.axisMapping = AxisMapping.ofAxes( keys.get( 1 ), keys.get( 0 ) );
            } else {
                d.axes = keys;
            }
            d.cyclic = operator.isDstCyclic();
            return d;
        }
    }
}
