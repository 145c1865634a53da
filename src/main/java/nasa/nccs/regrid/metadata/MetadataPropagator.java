package nasa.nccs.regrid.metadata;

import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.Coordinate;
import nasa.nccs.regrid.cdm.CoordinateReference;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.DomainAncillary;
import nasa.nccs.regrid.cdm.DomainAxis;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.operator.GridDiscretizer;
import nasa.nccs.regrid.operator.RegridOperator;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Updates the metadata of a regridded field so that it describes the destination grid.
 * <p>
 * Source and destination regrid axes are matched by position in {@code srcAxisKeys} and
 * {@code dstAxisKeys}. Call this before the regridded data is set on the field.
 */
public class MetadataPropagator {
    private static final Logger logger = RegridLogManager.getLogger( MetadataPropagator.class );

    private final AncillaryRegridder ancillaryRegridder;

    public MetadataPropagator( AncillaryRegridder ancillaryRegridder ) {
        this.ancillaryRegridder = ancillaryRegridder;
    }

    public void propagate( Field src, List<String> srcAxisKeys, Domain dst, List<String> dstAxisKeys, RegridOperator operator ) throws RegridException {
        deleteCoordinateReferences( src, srcAxisKeys );
        deleteCellMeasuresAndFieldAncillaries( src, srcAxisKeys );
        Map<String, DomainAncillary> regridded = regridDomainAncillaries( src, srcAxisKeys, operator );
        deleteCoordinates( src, srcAxisKeys );
        resizeAxes( src, srcAxisKeys, dst, dstAxisKeys );
        for( Map.Entry<String, DomainAncillary> entry: regridded.entrySet() ) {
            src.setDomainAncillary( entry.getKey(), entry.getValue(), src.getConstructAxes( entry.getKey() ) );
        }
        Map<String, String> coordinateKeys = copyCoordinates( src, srcAxisKeys, dst, dstAxisKeys );
        copyCoordinateReferences( src, dst, dstAxisKeys, coordinateKeys );
        if( operator.getCoordSystem() == CoordSystem.SPHERICAL ) {
            String xAxis = srcAxisKeys.get( 1 );
            src.setCyclic( xAxis, operator.isDstCyclic() && hasLongitudeDimension( src, xAxis ), GridDiscretizer.LONGITUDE_PERIOD );
        }
    }

    /** Cyclicity is only carried by an X axis with a longitude dimension coordinate. */
    static boolean hasLongitudeDimension( Domain domain, String axisKey ) {
        String key = domain.dimensionCoordinateKeyForAxis( axisKey );
        return key != null && domain.getCoordinate( key ).isLongitude();
    }

    /** Coordinate references, and their domain ancillaries, whose coordinates span a regrid axis. */
    void deleteCoordinateReferences( Field src, List<String> srcAxisKeys ) {
        for( String refKey: new ArrayList<String>( src.getCoordinateReferences().keySet() ) ) {
            if( !Collections.disjoint( referenceAxes( src, src.getCoordinateReferences().get( refKey ) ), srcAxisKeys ) ) {
                logger.debug( "Deleting coordinate reference " + refKey );
                src.delCoordinateReference( refKey );
            }
        }
    }

    void deleteCellMeasuresAndFieldAncillaries( Field src, List<String> srcAxisKeys ) {
        for( String key: src.constructKeys( srcAxisKeys, Domain.AxisMode.OR, Domain.ConstructType.CELL_MEASURE, Domain.ConstructType.FIELD_ANCILLARY ) ) {
            logger.debug( "Deleting " + key );
            src.delConstruct( key );
        }
    }

    /**
     * Regrids the domain ancillaries that span every regrid axis and deletes those that span only some.
     * The regridded ancillaries are returned, keyed as they are in {@code src}.
     */
    Map<String, DomainAncillary> regridDomainAncillaries( Field src, List<String> srcAxisKeys, RegridOperator operator ) throws RegridException {
        Map<String, DomainAncillary> regridded = new LinkedHashMap<String, DomainAncillary>();
        for( String key: new ArrayList<String>( src.getDomainAncillaries().keySet() ) ) {
            List<String> axes = src.getConstructAxes( key );
            if( Collections.disjoint( axes, srcAxisKeys ) ) { continue; }
            if( !axes.containsAll( srcAxisKeys ) ) {
                logger.debug( "Deleting domain ancillary " + key + " that spans only some regrid axes" );
                src.delConstruct( key );
                continue;
            }

            // Strip the ancillary field's own references, ancillaries and measures, so regridding it can't recurse
            Field field = src.convertDomainAncillary( key );
            for( String refKey: new ArrayList<String>( field.getCoordinateReferences().keySet() ) ) { field.delCoordinateReference( refKey ); }
            for( String daKey: new ArrayList<String>( field.getDomainAncillaries().keySet() ) ) { field.delConstruct( daKey ); }
            for( String cmKey: new ArrayList<String>( field.getCellMeasures().keySet() ) ) { field.delConstruct( cmKey ); }

            logger.debug( "Regridding domain ancillary " + key );
            Field result = ancillaryRegridder.regrid( field, operator, srcAxisKeys );
            DomainAncillary original = src.getDomainAncillaries().get( key );
            regridded.put( key, new DomainAncillary( original.getStandardName(), original.getUnits(), result.getData().getData(), null ) );
        }
        return regridded;
    }

    void deleteCoordinates( Field src, List<String> srcAxisKeys ) {
        for( String key: src.coordinateKeys( srcAxisKeys, Domain.AxisMode.OR ) ) {
            logger.debug( "Deleting coordinate " + key );
            src.delConstruct( key );
        }
    }

    void resizeAxes( Field src, List<String> srcAxisKeys, Domain dst, List<String> dstAxisKeys ) {
        for( int i = 0; i < srcAxisKeys.size(); i++ ) {
            DomainAxis srcAxis = src.getDomainAxis( srcAxisKeys.get( i ) );
            DomainAxis dstAxis = dst.getDomainAxis( dstAxisKeys.get( i ) );
            srcAxis.setSize( dstAxis.getSize() );
            if( dstAxis.getNcDimension() != null ) { srcAxis.setNcDimension( dstAxis.getNcDimension() ); }
        }
    }

    /**
     * Copies the destination coordinates that span only destination regrid axes onto the matching
     * source axes. Returns the key of each copy, keyed by its destination key.
     */
    Map<String, String> copyCoordinates( Field src, List<String> srcAxisKeys, Domain dst, List<String> dstAxisKeys ) {
        Map<String, String> axisMap = new HashMap<String, String>();
        for( int i = 0; i < dstAxisKeys.size(); i++ ) { axisMap.put( dstAxisKeys.get( i ), srcAxisKeys.get( i ) ); }
        Map<String, String> keyMap = new HashMap<String, String>();
        for( String dstKey: dst.coordinateKeys( dstAxisKeys, Domain.AxisMode.SUBSET ) ) {
            List<String> axes = new ArrayList<String>();
            for( String axis: dst.getConstructAxes( dstKey ) ) { axes.add( axisMap.get( axis ) ); }
            Coordinate c = dst.getCoordinate( dstKey ).copy();
            String key = src.setCoordinate( c, axes.toArray( new String[ axes.size() ] ) );
            keyMap.put( dstKey, key );
            logger.debug( String.format( "Copied destination coordinate %s to %s", dstKey, key ) );
        }
        return keyMap;
    }

    /**
     * Copies the destination coordinate references whose coordinates all lie within the destination
     * regrid axes. Their domain ancillary terms are not copied, so are left unset.
     */
    void copyCoordinateReferences( Field src, Domain dst, List<String> dstAxisKeys, Map<String, String> coordinateKeys ) {
        for( CoordinateReference ref: dst.getCoordinateReferences().values() ) {
            Set<String> axes = referenceAxes( dst, ref );
            if( axes.isEmpty() || !dstAxisKeys.containsAll( axes ) ) { continue; }
            CoordinateReference copy = new CoordinateReference( ref.getName() );
            for( String c: ref.getCoordinates() ) {
                String key = coordinateKeys.get( c );
                if( key != null ) { copy.addCoordinate( key ); }
            }
            for( String term: ref.getDomainAncillaries().keySet() ) { copy.setDomainAncillary( term, null ); }
            for( Map.Entry<String, String> p: ref.getParameters().entrySet() ) { copy.setParameter( p.getKey(), p.getValue() ); }
            logger.debug( "Copied destination coordinate reference " + ref.getName() );
            src.setCoordinateReference( copy );
        }
    }

    private static Set<String> referenceAxes( Domain f, CoordinateReference ref ) {
        Set<String> axes = new HashSet<String>();
        for( String c: ref.getCoordinates() ) {
            if( f.hasConstruct( c ) ) { axes.addAll( f.getConstructAxes( c ) ); }
        }
        return axes;
    }
}
