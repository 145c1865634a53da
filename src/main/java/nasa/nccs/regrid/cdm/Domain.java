package nasa.nccs.regrid.cdm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import ucar.ma2.Array;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The metadata constructs describing the locations of a field's cells: domain axes, coordinates,
 * coordinate references, domain ancillaries and cell measures. Each construct is stored under a
 * generated key and records the domain axes its array spans.
 */
public class Domain {
    public enum ConstructType {
        DIMENSION_COORDINATE( "dimensioncoordinate" ),
        AUXILIARY_COORDINATE( "auxiliarycoordinate" ),
        COORDINATE_REFERENCE( "coordinatereference" ),
        DOMAIN_ANCILLARY( "domainancillary" ),
        CELL_MEASURE( "cellmeasure" ),
        FIELD_ANCILLARY( "fieldancillary" );

        private final String prefix;
        ConstructType( String prefix ) { this.prefix = prefix; }
        public String getPrefix() { return prefix; }
    }

    /** How a construct's axes are matched against a set of domain axes. */
    public enum AxisMode {
        /** Spans at least one of the axes. */
        OR,
        /** Spans all of the axes. */
        AND,
        /** Spans only axes from the set. */
        SUBSET
    }

    private String name;
    private final Map<String, DomainAxis> domainAxes = new LinkedHashMap<String, DomainAxis>();
    private final Map<String, Coordinate> coordinates = new LinkedHashMap<String, Coordinate>();
    private final Map<String, CoordinateReference> coordinateReferences = new LinkedHashMap<String, CoordinateReference>();
    private final Map<String, DomainAncillary> domainAncillaries = new LinkedHashMap<String, DomainAncillary>();
    private final Map<String, CellMeasure> cellMeasures = new LinkedHashMap<String, CellMeasure>();
    private final Map<String, FieldAncillary> fieldAncillaries = new LinkedHashMap<String, FieldAncillary>();
    private final Map<String, List<String>> constructAxes = new HashMap<String, List<String>>();
    private final Map<String, Double> cyclicAxes = new LinkedHashMap<String, Double>();
    private final Map<String, Integer> keyCounters = new HashMap<String, Integer>();

    public Domain( String name ) { this.name = name; }

    public String getName() { return name; }

    public void setName( String name ) { this.name = name; }

    private String newKey( String prefix ) {
        int count = keyCounters.containsKey( prefix ) ? keyCounters.get( prefix ) : 0;
        String key = prefix + count;
        while( hasConstruct( key ) ) { count += 1; key = prefix + count; }
        keyCounters.put( prefix, count + 1 );
        return key;
    }

    public boolean hasConstruct( String key ) {
        return domainAxes.containsKey( key ) || coordinates.containsKey( key ) || coordinateReferences.containsKey( key )
                || domainAncillaries.containsKey( key ) || cellMeasures.containsKey( key ) || fieldAncillaries.containsKey( key );
    }

    // Domain axes

    public String setDomainAxis( DomainAxis axis ) {
        String key = newKey( "domainaxis" );
        domainAxes.put( key, axis );
        return key;
    }

    public DomainAxis getDomainAxis( String key ) {
        DomainAxis axis = domainAxes.get( key );
        if( axis == null ) { throw new IllegalArgumentException( String.format( "%s has no domain axis %s", name, key ) ); }
        return axis;
    }

    public Map<String, DomainAxis> getDomainAxes() { return Collections.unmodifiableMap( domainAxes ); }

    /**
     * Resolves an axis specifier to a unique domain axis key. The specifier may be a domain axis key,
     * a netCDF dimension name written as {@code ncdim%name}, or the identity of the coordinate that
     * defines the axis. Returns {@code null} when nothing, or more than one axis, matches.
     */
    public String domainAxisKey( String spec ) {
        if( spec == null ) { return null; }
        if( domainAxes.containsKey( spec ) ) { return spec; }
        Set<String> matches = new HashSet<String>();
        if( spec.startsWith( "ncdim%" ) ) {
            String ncdim = spec.substring( "ncdim%".length() );
            for( Map.Entry<String, DomainAxis> entry: domainAxes.entrySet() ) {
                if( ncdim.equals( entry.getValue().getNcDimension() ) ) { matches.add( entry.getKey() ); }
            }
        } else {
            for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) {
                List<String> axes = constructAxes.get( entry.getKey() );
                if( axes.size() == 1 && entry.getValue().hasIdentity( spec ) ) { matches.add( axes.get( 0 ) ); }
            }
        }
        return ( matches.size() == 1 ) ? matches.iterator().next() : null;
    }

    public boolean isCyclic( String axisKey ) { return cyclicAxes.containsKey( axisKey ); }

    public Double getPeriod( String axisKey ) { return cyclicAxes.get( axisKey ); }

    public void setCyclic( String axisKey, boolean cyclic, double period ) {
        getDomainAxis( axisKey );
        if( cyclic ) { cyclicAxes.put( axisKey, period ); }
        else { cyclicAxes.remove( axisKey ); }
    }

    // Coordinates

    public String setCoordinate( Coordinate coordinate, String... axes ) {
        String prefix = coordinate.isDimension() ? ConstructType.DIMENSION_COORDINATE.getPrefix() : ConstructType.AUXILIARY_COORDINATE.getPrefix();
        return setCoordinate( newKey( prefix ), coordinate, Arrays.asList( axes ) );
    }

    public String setCoordinate( String key, Coordinate coordinate, List<String> axes ) {
        checkSpans( key, coordinate.getData(), axes );
        coordinates.put( key, coordinate );
        constructAxes.put( key, ImmutableList.copyOf( axes ) );
        return key;
    }

    public Coordinate getCoordinate( String key ) { return coordinates.get( key ); }

    public Map<String, Coordinate> getCoordinates() { return Collections.unmodifiableMap( coordinates ); }

    /** The key of the unique dimension coordinate with the given identity, or {@code null}. */
    public String dimensionCoordinateKey( String identity ) {
        String found = null;
        for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) {
            Coordinate c = entry.getValue();
            if( c.isDimension() && ( entry.getKey().equals( identity ) || c.hasIdentity( identity ) ) ) {
                if( found != null ) { return null; }
                found = entry.getKey();
            }
        }
        return found;
    }

    /** The key of the dimension coordinate spanning {@code axisKey}, or {@code null}. */
    public String dimensionCoordinateKeyForAxis( String axisKey ) {
        for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) {
            if( entry.getValue().isDimension() && constructAxes.get( entry.getKey() ).equals( Collections.singletonList( axisKey ) ) ) {
                return entry.getKey();
            }
        }
        return null;
    }

    /** Keys of the auxiliary coordinates with the given identity and number of dimensions. */
    public List<String> auxiliaryCoordinateKeys( String identity, int ndim ) {
        List<String> keys = new ArrayList<String>();
        for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) {
            Coordinate c = entry.getValue();
            if( !c.isDimension() && c.getRank() == ndim && c.hasIdentity( identity ) ) { keys.add( entry.getKey() ); }
        }
        return keys;
    }

    // Other constructs

    public String setCoordinateReference( CoordinateReference ref ) {
        String key = newKey( ConstructType.COORDINATE_REFERENCE.getPrefix() );
        coordinateReferences.put( key, ref );
        return key;
    }

    public Map<String, CoordinateReference> getCoordinateReferences() { return Collections.unmodifiableMap( coordinateReferences ); }

    /** Deletes a coordinate reference together with the domain ancillaries that hold its terms. */
    public CoordinateReference delCoordinateReference( String key ) {
        CoordinateReference ref = coordinateReferences.remove( key );
        if( ref != null ) {
            for( String daKey: ref.getDomainAncillaries().values() ) {
                if( daKey != null ) { delConstruct( daKey ); }
            }
        }
        return ref;
    }

    public String setDomainAncillary( DomainAncillary ancillary, String... axes ) {
        return setDomainAncillary( newKey( ConstructType.DOMAIN_ANCILLARY.getPrefix() ), ancillary, Arrays.asList( axes ) );
    }

    public String setDomainAncillary( String key, DomainAncillary ancillary, List<String> axes ) {
        checkSpans( key, ancillary.getData(), axes );
        domainAncillaries.put( key, ancillary );
        constructAxes.put( key, ImmutableList.copyOf( axes ) );
        return key;
    }

    public Map<String, DomainAncillary> getDomainAncillaries() { return Collections.unmodifiableMap( domainAncillaries ); }

    public String setCellMeasure( CellMeasure measure, String... axes ) {
        String key = newKey( ConstructType.CELL_MEASURE.getPrefix() );
        checkSpans( key, measure.getData(), Arrays.asList( axes ) );
        cellMeasures.put( key, measure );
        constructAxes.put( key, ImmutableList.copyOf( axes ) );
        return key;
    }

    public Map<String, CellMeasure> getCellMeasures() { return Collections.unmodifiableMap( cellMeasures ); }

    public String setFieldAncillary( FieldAncillary ancillary, String... axes ) {
        String key = newKey( ConstructType.FIELD_ANCILLARY.getPrefix() );
        checkSpans( key, ancillary.getData().getData(), Arrays.asList( axes ) );
        fieldAncillaries.put( key, ancillary );
        constructAxes.put( key, ImmutableList.copyOf( axes ) );
        return key;
    }

    public Map<String, FieldAncillary> getFieldAncillaries() { return Collections.unmodifiableMap( fieldAncillaries ); }

    /** The domain axes spanned by a construct's array, in array dimension order. */
    public List<String> getConstructAxes( String key ) {
        List<String> axes = constructAxes.get( key );
        if( axes == null ) { throw new IllegalArgumentException( String.format( "%s has no construct %s", name, key ) ); }
        return axes;
    }

    public ConstructType getConstructType( String key ) {
        for( ConstructType type: ConstructType.values() ) {
            if( keysOf( type ).contains( key ) ) { return type; }
        }
        return null;
    }

    public void delConstruct( String key ) {
        Coordinate c = coordinates.remove( key );
        if( c != null ) {
            for( CoordinateReference ref: coordinateReferences.values() ) { ref.removeCoordinate( key ); }
        }
        if( domainAncillaries.remove( key ) != null ) {
            for( CoordinateReference ref: coordinateReferences.values() ) { ref.clearDomainAncillary( key ); }
        }
        cellMeasures.remove( key );
        fieldAncillaries.remove( key );
        coordinateReferences.remove( key );
        constructAxes.remove( key );
    }

    /**
     * Keys of constructs of the given types whose axes match {@code axes} under {@code mode}. Coordinate
     * references have no axes of their own and are never returned.
     */
    public List<String> constructKeys( Collection<String> axes, AxisMode mode, ConstructType... types ) {
        List<String> keys = new ArrayList<String>();
        for( ConstructType type: types ) {
            for( String key: keysOf( type ) ) {
                List<String> spans = constructAxes.get( key );
                if( spans != null && axisMatch( spans, axes, mode ) ) { keys.add( key ); }
            }
        }
        return keys;
    }

    public List<String> coordinateKeys( Collection<String> axes, AxisMode mode ) {
        return constructKeys( axes, mode, ConstructType.DIMENSION_COORDINATE, ConstructType.AUXILIARY_COORDINATE );
    }

    private static boolean axisMatch( List<String> spans, Collection<String> axes, AxisMode mode ) {
        switch( mode ) {
            case OR: return !Collections.disjoint( spans, axes );
            case AND: return spans.containsAll( axes );
            default: return !spans.isEmpty() && axes.containsAll( spans );
        }
    }

    private Collection<String> keysOf( ConstructType type ) {
        List<String> keys = new ArrayList<String>();
        switch( type ) {
            case DIMENSION_COORDINATE:
            case AUXILIARY_COORDINATE:
                for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) {
                    boolean dim = entry.getValue().isDimension();
                    if( dim == ( type == ConstructType.DIMENSION_COORDINATE ) ) { keys.add( entry.getKey() ); }
                }
                return keys;
            case COORDINATE_REFERENCE: return coordinateReferences.keySet();
            case DOMAIN_ANCILLARY: return domainAncillaries.keySet();
            case CELL_MEASURE: return cellMeasures.keySet();
            default: return fieldAncillaries.keySet();
        }
    }

    protected void checkSpans( String key, Array data, List<String> axes ) {
        Preconditions.checkArgument( data.getRank() == axes.size(),
                "Construct %s of %s has rank %s but spans %s axes", key, name, data.getRank(), axes.size() );
        int[] shape = data.getShape();
        for( int i = 0; i < axes.size(); i++ ) {
            int size = getDomainAxis( axes.get( i ) ).getSize();
            Preconditions.checkArgument( shape[i] == size,
                    "Construct %s of %s has size %s along axis %s, which has size %s", key, name, shape[i], axes.get( i ), size );
        }
    }

    protected void copyInto( Domain target ) {
        for( Map.Entry<String, DomainAxis> entry: domainAxes.entrySet() ) { target.domainAxes.put( entry.getKey(), entry.getValue().copy() ); }
        for( Map.Entry<String, Coordinate> entry: coordinates.entrySet() ) { target.coordinates.put( entry.getKey(), entry.getValue().copy() ); }
        for( Map.Entry<String, CoordinateReference> entry: coordinateReferences.entrySet() ) { target.coordinateReferences.put( entry.getKey(), entry.getValue().copy() ); }
        for( Map.Entry<String, DomainAncillary> entry: domainAncillaries.entrySet() ) { target.domainAncillaries.put( entry.getKey(), entry.getValue().copy() ); }
        for( Map.Entry<String, CellMeasure> entry: cellMeasures.entrySet() ) { target.cellMeasures.put( entry.getKey(), entry.getValue().copy() ); }
        for( Map.Entry<String, FieldAncillary> entry: fieldAncillaries.entrySet() ) { target.fieldAncillaries.put( entry.getKey(), entry.getValue().copy() ); }
        target.constructAxes.putAll( constructAxes );
        target.cyclicAxes.putAll( cyclicAxes );
        target.keyCounters.putAll( keyCounters );
    }

    public Domain copy() {
        Domain domain = new Domain( name );
        copyInto( domain );
        return domain;
    }

    public String toString() { return String.format( "<Domain: %s>", name ); }
}
