package nasa.nccs.regrid.cdm;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang.StringUtils;
import ucar.ma2.Array;
import ucar.ma2.IndexIterator;
import ucar.nc2.units.SimpleUnit;

/**
 * Unit recognition and conversion for coordinate arrays, following the CF conventions for
 * longitude and latitude units.
 */
public final class Units {
    private static final ImmutableSet<String> LONGITUDE_UNITS = ImmutableSet.of(
            "degrees_east", "degree_east", "degree_e", "degrees_e", "degreee", "degreese" );
    private static final ImmutableSet<String> LATITUDE_UNITS = ImmutableSet.of(
            "degrees_north", "degree_north", "degree_n", "degrees_n", "degreen", "degreesn" );

    private Units() { }

    public static boolean isLongitude( String units ) {
        return units != null && LONGITUDE_UNITS.contains( units.trim().toLowerCase() );
    }

    public static boolean isLatitude( String units ) {
        return units != null && LATITUDE_UNITS.contains( units.trim().toLowerCase() );
    }

    public static boolean isUnset( String units ) { return StringUtils.isBlank( units ); }

    /** True when both unit strings are set and describe dimensionally equivalent quantities. */
    public static boolean equivalent( String a, String b ) {
        if( isUnset( a ) || isUnset( b ) ) { return false; }
        if( a.trim().equals( b.trim() ) ) { return true; }
        try {
            return SimpleUnit.isCompatible( a, b );
        } catch ( RuntimeException ex ) {
            return false;
        }
    }

    /** A new array holding {@code values} converted from {@code from} units to {@code to} units. */
    public static Array convert( Array values, String from, String to ) {
        SimpleUnit fromUnit = SimpleUnit.factory( from );
        SimpleUnit toUnit = SimpleUnit.factory( to );
        if( fromUnit == null || toUnit == null ) {
            throw new IllegalArgumentException( String.format( "Can't convert from units '%s' to '%s'", from, to ) );
        }
        Array result = ArrayHelper.toDoubleArray( values );
        IndexIterator iter = result.getIndexIterator();
        while( iter.hasNext() ) {
            double value = iter.getDoubleNext();
            iter.setDoubleCurrent( fromUnit.convertTo( value, toUnit ) );
        }
        return result;
    }
}
