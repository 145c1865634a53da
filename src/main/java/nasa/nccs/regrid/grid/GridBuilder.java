package nasa.nccs.regrid.grid;

import nasa.nccs.regrid.ConfigurationException;
import nasa.nccs.regrid.GridIncompatibilityException;
import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Coordinate;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;
import ucar.ma2.Array;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Builds the {@link GridDescriptor} of a field or domain.
 * <p>
 * When given a {@link Field} whose data does not span one of the regrid axes, that (size 1) axis
 * is inserted into the field's data as a trailing dimension.
 */
public class GridBuilder {
    /** Half width of the synthetic axis added to 1-d Cartesian grids. */
    static final double SYNTHETIC_HALF_WIDTH = Math.ulp( 1.0 );

    private static final Logger logger = RegridLogManager.getLogger( GridBuilder.class );

    public GridDescriptor build( CoordSystem coordSystem, Domain f, String role, RegridMethod method, Boolean cyclic,
                                 AxisMapping axisMapping, List<String> axes ) throws RegridException {
        if( coordSystem == CoordSystem.SPHERICAL ) { return spherical( f, role, method, cyclic, axisMapping ); }
        return cartesian( f, role, method, axes );
    }

    /**
     * Latitude/longitude grid information. 1-d latitude and longitude dimension coordinates are used
     * when present, otherwise 2-d auxiliary coordinates whose X and Y axes are given by
     * {@code axisMapping}.
     */
    public GridDescriptor spherical( Domain f, String role, RegridMethod method, Boolean cyclic, AxisMapping axisMapping ) throws RegridException {
        String lonKey = f.dimensionCoordinateKey( "X" );
        String latKey = f.dimensionCoordinateKey( "Y" );
        Coordinate lon = ( lonKey == null ) ? null : f.getCoordinate( lonKey );
        Coordinate lat = ( latKey == null ) ? null : f.getCoordinate( latKey );

        GridDescriptor.GridType type;
        String xAxis;
        String yAxis;
        if( lon != null && lat != null && lon.isLongitude() && lat.isLatitude() ) {
            type = GridDescriptor.GridType.SPHERICAL_1D;
            xAxis = f.getConstructAxes( lonKey ).get( 0 );
            yAxis = f.getConstructAxes( latKey ).get( 0 );
        } else {
            List<String> lonKeys = longitudeKeys( f );
            List<String> latKeys = latitudeKeys( f );
            if( lonKeys.size() > 1 || latKeys.size() > 1 ) {
                throw new ConfigurationException( String.format( "Found more than one 2-d longitude or latitude coordinate for the %s grid %s", role, f ) );
            }
            if( lonKeys.isEmpty() || latKeys.isEmpty() ) {
                if( lon != null && lat != null ) {
                    throw new GridIncompatibilityException( String.format( "The X and Y coordinates of the %s grid %s do not have longitude and latitude units: '%s', '%s'",
                            role, f, lon.getUnits(), lat.getUnits() ) );
                }
                throw new ConfigurationException( String.format( "Could not find 1-d nor 2-d latitude and longitude coordinates for the %s grid %s", role, f ) );
            }
            type = GridDescriptor.GridType.SPHERICAL_2D;
            lonKey = lonKeys.get( 0 );
            latKey = latKeys.get( 0 );
            lon = f.getCoordinate( lonKey );
            lat = f.getCoordinate( latKey );
            List<String> lonAxes = f.getConstructAxes( lonKey );
            List<String> latAxes = f.getConstructAxes( latKey );
            if( axisMapping == null ) {
                throw new ConfigurationException( String.format( "The X and Y axes must be specified for the 2-d latitude and longitude coordinates of the %s grid %s", role, f ) );
            }
            if( axisMapping.isPositional() ) {
                if( !new HashSet<Integer>( Arrays.asList( axisMapping.getXDim(), axisMapping.getYDim() ) ).equals( new HashSet<Integer>( Arrays.asList( 0, 1 ) ) ) ) {
                    throw new ConfigurationException( "Positional X and Y axes must be 0 and 1, got " + axisMapping );
                }
                if( !lonAxes.equals( latAxes ) ) {
                    throw new ConfigurationException( String.format( "The 2-d longitude and latitude coordinates of the %s grid %s must span their axes in the same order when X and Y are given by position",
                            role, f ) );
                }
                xAxis = lonAxes.get( axisMapping.getXDim() );
                yAxis = lonAxes.get( axisMapping.getYDim() );
            } else {
                xAxis = f.domainAxisKey( axisMapping.getX() );
                yAxis = f.domainAxisKey( axisMapping.getY() );
                if( xAxis == null || yAxis == null ) {
                    throw new ConfigurationException( String.format( "Axes %s do not identify unique domain axes of the %s grid %s", axisMapping, role, f ) );
                }
                HashSet<String> xy = new HashSet<String>( Arrays.asList( xAxis, yAxis ) );
                if( !xy.equals( new HashSet<String>( lonAxes ) ) || !xy.equals( new HashSet<String>( latAxes ) ) ) {
                    throw new ConfigurationException( String.format( "Axes %s are not the axes of the 2-d latitude and longitude coordinates of the %s grid %s", axisMapping, role, f ) );
                }
            }
        }

        if( xAxis.equals( yAxis ) ) {
            throw new ConfigurationException( String.format( "The X and Y axes must be distinct, but they are the same for the %s grid %s", role, f ) );
        }

        int xSize = f.getDomainAxis( xAxis ).getSize();
        int ySize = f.getDomainAxis( yAxis ).getSize();
        // A size 1 dimension is only a problem for the source grid
        if( role.equals( "source" ) && method.requiresNeighbours() && ( xSize == 1 || ySize == 1 ) ) {
            throw new GridIncompatibilityException( String.format( "Neither the longitude nor latitude dimensions of the %s grid %s can be of size 1 for '%s' regridding",
                    role, f, method ) );
        }

        List<Coordinate> coordinates = Arrays.asList( lon, lat );
        List<Array> coords = new ArrayList<Array>();
        List<Array> bounds = new ArrayList<Array>();
        boolean withBounds = checkBounds( coordinates, role, method, f );
        for( int dim = 0; dim < 2; dim++ ) {
            Coordinate c = coordinates.get( dim );
            Array data = c.getData();
            Array b = c.getBounds();
            if( type == GridDescriptor.GridType.SPHERICAL_2D ) {
                // Engine axis order is (X, Y), whatever the order of the coordinate's own dimensions
                List<String> cAxes = f.getConstructAxes( ( dim == 0 ) ? lonKey : latKey );
                int[] order = { cAxes.indexOf( xAxis ), cAxes.indexOf( yAxis ) };
                data = data.permute( order );
                if( withBounds ) { b = b.permute( new int[]{ order[0], order[1], 2 } ); }
            }
            coords.add( ArrayHelper.toDoubleArray( data ) );
            if( withBounds ) { bounds.add( ArrayHelper.toDoubleArray( b ) ); }
        }

        boolean isCyclic = ( cyclic != null ) ? cyclic.booleanValue() : f.isCyclic( xAxis );
        List<String> axisKeys = Arrays.asList( yAxis, xAxis );
        List<Integer> axisIndices = axisIndices( f, axisKeys, role );
        GridDescriptor grid = new GridDescriptor( role, CoordSystem.SPHERICAL, type, axisKeys, axisIndices, new int[]{ ySize, xSize },
                coords, bounds, Arrays.asList( lon.getUnits(), lat.getUnits() ), isCyclic, false );
        logger.debug( "Built " + grid );
        return grid;
    }

    /**
     * Cartesian grid information for 1 to 3 axes, each identified by a specifier that must resolve to
     * a unique domain axis with a dimension coordinate. Axes keep the order in which they are given.
     */
    public GridDescriptor cartesian( Domain f, String role, RegridMethod method, List<String> axes ) throws RegridException {
        if( axes == null || axes.isEmpty() || axes.size() > 3 ) {
            throw new ConfigurationException( "Between 1 and 3 axes must be individually specified for Cartesian regridding, got " + axes );
        }
        List<String> axisKeys = new ArrayList<String>();
        int[] shape = new int[ axes.size() ];
        for( int i = 0; i < axes.size(); i++ ) {
            String key = f.domainAxisKey( axes.get( i ) );
            if( key == null ) {
                throw new ConfigurationException( String.format( "No unique domain axis of the %s grid %s matches '%s'", role, f, axes.get( i ) ) );
            }
            if( axisKeys.contains( key ) ) {
                throw new ConfigurationException( String.format( "Axis '%s' of the %s grid %s is specified more than once", axes.get( i ), role, f ) );
            }
            axisKeys.add( key );
            shape[i] = f.getDomainAxis( key ).getSize();
        }

        List<Coordinate> coordinates = new ArrayList<Coordinate>();
        List<String> reversed = new ArrayList<String>( axisKeys );
        Collections.reverse( reversed );
        for( String key: reversed ) {
            String coordKey = f.dimensionCoordinateKeyForAxis( key );
            if( coordKey == null ) {
                throw new ConfigurationException( String.format( "No unique dimension coordinate of the %s grid %s for domain axis %s", role, f, key ) );
            }
            Coordinate c = f.getCoordinate( coordKey );
            if( role.equals( "source" ) && method.requiresNeighbours() && c.getShape()[0] == 1 ) {
                throw new GridIncompatibilityException( String.format( "The %s axis %s of %s can not be of size 1 for '%s' regridding", role, key, f, method ) );
            }
            coordinates.add( c );
        }

        List<Array> coords = new ArrayList<Array>();
        List<Array> bounds = new ArrayList<Array>();
        List<String> units = new ArrayList<String>();
        boolean withBounds = checkBounds( coordinates, role, method, f );
        for( Coordinate c: coordinates ) {
            coords.add( ArrayHelper.toDoubleArray( c.getData() ) );
            if( withBounds ) { bounds.add( ArrayHelper.toDoubleArray( c.getBounds() ) ); }
            units.add( c.getUnits() );
        }

        boolean synthetic = ( coordinates.size() == 1 );
        if( synthetic ) {
            // The engine can't create weights for 1-d regridding, so add a second, dummy axis
            double w = SYNTHETIC_HALF_WIDTH;
            if( method.isConservative() ) {
                coords.add( ArrayHelper.fromDoubles( new double[]{ 0.0 }, 1 ) );
                bounds.add( ArrayHelper.fromDoubles( new double[]{ -w, w }, 1, 2 ) );
            } else {
                coords.add( ArrayHelper.fromDoubles( new double[]{ -w, w }, 2 ) );
            }
            units.add( null );
        }

        List<Integer> axisIndices = axisIndices( f, axisKeys, role );
        GridDescriptor grid = new GridDescriptor( role, CoordSystem.CARTESIAN, GridDescriptor.GridType.CARTESIAN, axisKeys, axisIndices, shape,
                coords, bounds, units, false, synthetic );
        logger.debug( "Built " + grid );
        return grid;
    }

    private static List<String> longitudeKeys( Domain f ) {
        List<String> keys = new ArrayList<String>();
        for( String key: f.auxiliaryCoordinateKeys( "X", 2 ) ) { if( f.getCoordinate( key ).isLongitude() ) { keys.add( key ); } }
        return keys;
    }

    private static List<String> latitudeKeys( Domain f ) {
        List<String> keys = new ArrayList<String>();
        for( String key: f.auxiliaryCoordinateKeys( "Y", 2 ) ) { if( f.getCoordinate( key ).isLatitude() ) { keys.add( key ); } }
        return keys;
    }

    /** Whether bounds are needed, failing if they are needed but missing. */
    private static boolean checkBounds( List<Coordinate> coordinates, String role, RegridMethod method, Domain f ) throws GridIncompatibilityException {
        if( !method.isConservative() ) { return false; }
        for( Coordinate c: coordinates ) {
            if( !c.hasBounds() ) {
                throw new GridIncompatibilityException( String.format( "The %s coordinate %s of %s has no bounds, which are required for '%s' regridding",
                        role, c.getStandardName(), f, method ) );
            }
        }
        return true;
    }

    /**
     * Positions of the regrid axes in the data array, in {@code axisKeys} order. A domain has no data,
     * so its axes are numbered in order.
     */
    private static List<Integer> axisIndices( Domain f, List<String> axisKeys, String role ) throws ConfigurationException {
        List<Integer> indices = new ArrayList<Integer>();
        if( !( f instanceof Field ) || ( (Field) f ).getData() == null ) {
            for( int i = 0; i < axisKeys.size(); i++ ) { indices.add( i ); }
            return indices;
        }
        Field field = (Field) f;
        for( String key: axisKeys ) {
            if( !field.getDataAxes().contains( key ) ) {
                if( field.getDomainAxis( key ).getSize() != 1 ) {
                    throw new ConfigurationException( String.format( "The data of the %s field %s does not span regrid axis %s", role, f, key ) );
                }
                field.insertDimension( key );
            }
        }
        for( String key: axisKeys ) { indices.add( field.getDataAxes().indexOf( key ) ); }
        return indices;
    }
}
