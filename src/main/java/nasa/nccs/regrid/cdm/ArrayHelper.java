package nasa.nccs.regrid.cdm;

import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;
import ucar.ma2.DataType;
import ucar.ma2.IndexIterator;

import java.util.Arrays;

/**
 * Small helpers over {@link ucar.ma2.Array}. All element access goes through index iterators so
 * permuted and sliced views are read in logical (row-major) order.
 */
public final class ArrayHelper {

    private ArrayHelper() { }

    public static double[] toDoubles( Array array ) {
        double[] values = new double[ (int) array.getSize() ];
        IndexIterator iter = array.getIndexIterator();
        int i = 0;
        while( iter.hasNext() ) { values[i++] = iter.getDoubleNext(); }
        return values;
    }

    public static boolean[] toBooleans( Array array ) {
        boolean[] values = new boolean[ (int) array.getSize() ];
        IndexIterator iter = array.getIndexIterator();
        int i = 0;
        while( iter.hasNext() ) { values[i++] = iter.getBooleanNext(); }
        return values;
    }

    public static Array fromDoubles( double[] values, int... shape ) {
        return Array.factory( DataType.DOUBLE, shape, values );
    }

    public static ArrayBoolean fromBooleans( boolean[] values, int... shape ) {
        return (ArrayBoolean) Array.factory( DataType.BOOLEAN, shape, values );
    }

    public static ArrayBoolean falseMask( int... shape ) {
        return (ArrayBoolean) Array.factory( DataType.BOOLEAN, shape );
    }

    public static boolean any( Array mask ) {
        if( mask == null ) { return false; }
        IndexIterator iter = mask.getIndexIterator();
        while( iter.hasNext() ) { if( iter.getBooleanNext() ) { return true; } }
        return false;
    }

    /** Element-wise equality of shape and values. Two nulls are equal. */
    public static boolean equal( Array a, Array b ) {
        if( a == null || b == null ) { return a == b; }
        if( !Arrays.equals( a.getShape(), b.getShape() ) ) { return false; }
        IndexIterator ia = a.getIndexIterator();
        IndexIterator ib = b.getIndexIterator();
        if( a.getDataType() == DataType.BOOLEAN || b.getDataType() == DataType.BOOLEAN ) {
            while( ia.hasNext() ) { if( ia.getBooleanNext() != ib.getBooleanNext() ) { return false; } }
            return true;
        }
        while( ia.hasNext() ) {
            if( Double.compare( ia.getDoubleNext(), ib.getDoubleNext() ) != 0 ) { return false; }
        }
        return true;
    }

    /** A canonical copy of {@code array} converted to doubles. */
    public static Array toDoubleArray( Array array ) {
        return fromDoubles( toDoubles( array ), array.getShape() );
    }

    public static long product( int[] shape ) {
        long size = 1;
        for( int n: shape ) { size *= n; }
        return size;
    }

    public static String shapeString( int[] shape ) {
        return Arrays.toString( shape ).replace( '[', '(' ).replace( ']', ')' );
    }
}
