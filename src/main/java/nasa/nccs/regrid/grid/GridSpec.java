package nasa.nccs.regrid.grid;

import com.google.common.collect.ImmutableList;
import nasa.nccs.regrid.ConfigurationException;
import nasa.nccs.regrid.cdm.Coordinate;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.DomainAxis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A destination grid given directly by its coordinates rather than by a field or domain.
 * <p>
 * Spherical grids take latitude and longitude coordinates, both 1-d or both 2-d; 2-d coordinates
 * need an axis order of ("X", "Y") or ("Y", "X") naming the dimensions of the coordinate arrays.
 * Cartesian grids take one 1-d coordinate per named axis.
 */
public final class GridSpec {
    private final CoordSystem coordSystem;
    private final Map<String, Coordinate> coordinates;
    private final List<String> axisOrder;
    private final Boolean cyclic;

    private GridSpec( CoordSystem coordSystem, Map<String, Coordinate> coordinates, List<String> axisOrder, Boolean cyclic ) {
        this.coordSystem = coordSystem;
        this.coordinates = coordinates;
        this.axisOrder = axisOrder;
        this.cyclic = cyclic;
    }

    public static GridSpec spherical( Coordinate latitude, Coordinate longitude ) {
        Map<String, Coordinate> coords = new LinkedHashMap<String, Coordinate>();
        coords.put( "latitude", latitude );
        coords.put( "longitude", longitude );
        return new GridSpec( CoordSystem.SPHERICAL, coords, null, null );
    }

    /** Cartesian coordinates keyed by axis name, in the order the axes should be regridded. */
    public static GridSpec cartesian( Map<String, Coordinate> coordinates ) {
        return new GridSpec( CoordSystem.CARTESIAN, new LinkedHashMap<String, Coordinate>( coordinates ), null, null );
    }

    public GridSpec withAxisOrder( String... axes ) {
        return new GridSpec( coordSystem, coordinates, ImmutableList.copyOf( axes ), cyclic );
    }

    public GridSpec withCyclic( Boolean cyclic ) {
        return new GridSpec( coordSystem, coordinates, axisOrder, cyclic );
    }

    public CoordSystem getCoordSystem() { return coordSystem; }

    public Boolean getCyclic() { return cyclic; }

    /**
     * Validates the specification and builds the domain it describes.
     *
     * @param cyclicOverride longitude cyclicity to set, taking precedence over the spec's own; may be null
     */
    public Resolved toDomain( Boolean cyclicOverride ) throws ConfigurationException {
        Boolean cyc = ( cyclicOverride != null ) ? cyclicOverride : cyclic;
        return ( coordSystem == CoordSystem.SPHERICAL ) ? sphericalDomain( cyc ) : cartesianDomain();
    }

    private Resolved sphericalDomain( Boolean cyc ) throws ConfigurationException {
        Coordinate lat = coordinates.get( "latitude" );
        Coordinate lon = coordinates.get( "longitude" );
        if( lat == null || lon == null ) {
            throw new ConfigurationException( "Coordinates 'longitude' and 'latitude' must be specified for the destination grid" );
        }
        lat = lat.copy();
        lon = lon.copy();
        Domain domain = new Domain( "destination grid" );
        AxisMapping mapping = null;
        String yAxis;
        String xAxis;
        if( lat.getRank() == 1 ) {
            if( lon.getRank() != 1 ) {
                throw new ConfigurationException( "Longitude and latitude coordinates for the destination grid must have the same number of dimensions." );
            }
            yAxis = domain.setDomainAxis( new DomainAxis( lat.getShape()[0] ) );
            xAxis = domain.setDomainAxis( new DomainAxis( lon.getShape()[0] ) );
            domain.setCoordinate( dimension( lat, "latitude", "Y" ), yAxis );
            domain.setCoordinate( dimension( lon, "longitude", "X" ), xAxis );
        } else if( lat.getRank() == 2 ) {
            if( axisOrder == null ) {
                throw new ConfigurationException( "An axis order must be specified when providing 2-d latitude and longitude coordinates" );
            }
            boolean xFirst;
            if( axisOrder.equals( Arrays.asList( "X", "Y" ) ) ) { xFirst = true; }
            else if( axisOrder.equals( Arrays.asList( "Y", "X" ) ) ) { xFirst = false; }
            else {
                throw new ConfigurationException( "Axis order must either be (X, Y) or (Y, X). Got " + axisOrder );
            }
            if( !Arrays.equals( lat.getShape(), lon.getShape() ) ) {
                throw new ConfigurationException( "2-d longitude and latitude coordinates for the destination grid must have the same shape." );
            }
            int[] shape = lat.getShape();
            int ySize = xFirst ? shape[1] : shape[0];
            int xSize = xFirst ? shape[0] : shape[1];
            yAxis = domain.setDomainAxis( new DomainAxis( ySize ) );
            xAxis = domain.setDomainAxis( new DomainAxis( xSize ) );
            String[] axes = xFirst ? new String[]{ xAxis, yAxis } : new String[]{ yAxis, xAxis };
            domain.setCoordinate( auxiliary( lat, "latitude", "Y" ), axes );
            domain.setCoordinate( auxiliary( lon, "longitude", "X" ), axes );
            mapping = AxisMapping.ofAxes( xAxis, yAxis );
        } else {
            throw new ConfigurationException( "Longitude and latitude coordinates for the destination grid must be 1-d or 2-d" );
        }
        if( cyc != null ) { domain.setCyclic( xAxis, cyc, 360.0 ); }
        return new Resolved( domain, mapping, ImmutableList.of( yAxis, xAxis ) );
    }

    private Resolved cartesianDomain() throws ConfigurationException {
        List<String> names = ( axisOrder == null ) ? new ArrayList<String>( coordinates.keySet() ) : axisOrder;
        if( names.isEmpty() ) {
            throw new ConfigurationException( "At least one coordinate must be specified for a Cartesian destination grid" );
        }
        Domain domain = new Domain( "destination grid" );
        List<String> axisKeys = new ArrayList<String>();
        for( String name: names ) {
            Coordinate coord = coordinates.get( name );
            if( coord == null ) {
                throw new ConfigurationException( "No coordinate given for Cartesian destination axis '" + name + "'" );
            }
            if( coord.getRank() != 1 ) {
                throw new ConfigurationException( "Cartesian destination coordinate '" + name + "' must be 1-d" );
            }
            String key = domain.setDomainAxis( new DomainAxis( coord.getShape()[0] ) );
            Coordinate c = dimension( coord.copy(), coord.getStandardName(), coord.getAxis() );
            domain.setCoordinate( c, key );
            axisKeys.add( key );
        }
        return new Resolved( domain, null, axisKeys );
    }

    private static Coordinate dimension( Coordinate c, String name, String axis ) {
        Coordinate d = new Coordinate( Coordinate.Kind.DIMENSION, name, c.getUnits(), c.getData(), c.getBounds() );
        d.setAxis( axis );
        return d;
    }

    private static Coordinate auxiliary( Coordinate c, String name, String axis ) {
        Coordinate d = new Coordinate( Coordinate.Kind.AUXILIARY, name, c.getUnits(), c.getData(), c.getBounds() );
        d.setAxis( axis );
        return d;
    }

    /** A destination domain built from a grid specification. */
    public static final class Resolved {
        private final Domain domain;
        private final AxisMapping axisMapping;
        private final List<String> axisKeys;

        Resolved( Domain domain, AxisMapping axisMapping, List<String> axisKeys ) {
            this.domain = domain;
            this.axisMapping = axisMapping;
            this.axisKeys = ImmutableList.copyOf( axisKeys );
        }

        public Domain getDomain() { return domain; }

        /** The X/Y mapping needed for 2-d spherical coordinates, otherwise {@code null}. */
        public AxisMapping getAxisMapping() { return axisMapping; }

        /** The domain axis keys of the grid: (Y, X) for spherical grids, the named axes in order for Cartesian ones. */
        public List<String> getAxisKeys() { return axisKeys; }
    }
}
