package nasa.nccs.regrid.cdm;

import com.google.common.base.Preconditions;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;
import ucar.ma2.DataType;
import ucar.ma2.Index;

import java.util.Arrays;

/**
 * An n-dimensional data array paired with an optional boolean mask of the same shape. A
 * {@code true} mask element marks a missing value.
 */
public class MaskedArray {
    private final Array data;
    private final ArrayBoolean mask;

    public MaskedArray( Array data ) { this( data, null ); }

    public MaskedArray( Array data, ArrayBoolean mask ) {
        Preconditions.checkNotNull( data, "data" );
        if( mask != null ) {
            Preconditions.checkArgument( Arrays.equals( data.getShape(), mask.getShape() ),
                    "Mask shape %s does not match data shape %s", Arrays.toString( mask.getShape() ), Arrays.toString( data.getShape() ) );
        }
        this.data = data;
        this.mask = mask;
    }

    public static MaskedArray of( double[] values, int... shape ) {
        return new MaskedArray( ArrayHelper.fromDoubles( values, shape ) );
    }

    public Array getData() { return data; }

    /** The mask, or {@code null} when no mask has been set. */
    public ArrayBoolean getMask() { return mask; }

    /** The mask expanded to the data shape; all false when no mask has been set. */
    public ArrayBoolean getMaskArray() {
        return ( mask == null ) ? ArrayHelper.falseMask( data.getShape() ) : mask;
    }

    public boolean isMasked() { return ArrayHelper.any( mask ); }

    public boolean isMasked( int... index ) {
        if( mask == null ) { return false; }
        Index ima = mask.getIndex();
        return mask.getBoolean( ima.set( index ) );
    }

    public double getDouble( int... index ) {
        Index ima = data.getIndex();
        return data.getDouble( ima.set( index ) );
    }

    public int[] getShape() { return data.getShape(); }

    public int getRank() { return data.getRank(); }

    public DataType getDataType() { return data.getDataType(); }

    /** A copy with the given elements masked. */
    public MaskedArray withMasked( int[]... indices ) {
        ArrayBoolean newMask = (ArrayBoolean) getMaskArray().copy();
        Index ima = newMask.getIndex();
        for( int[] index: indices ) { newMask.setBoolean( ima.set( index ), true ); }
        return new MaskedArray( data.copy(), newMask );
    }

    public MaskedArray reshape( int[] shape ) {
        ArrayBoolean newMask = ( mask == null ) ? null : (ArrayBoolean) mask.reshape( shape );
        return new MaskedArray( data.reshape( shape ), newMask );
    }

    public MaskedArray copy() {
        return new MaskedArray( data.copy(), ( mask == null ) ? null : (ArrayBoolean) mask.copy() );
    }

    public String toString() {
        return String.format( "MaskedArray: shape=%s, dtype=%s, masked=%s", ArrayHelper.shapeString( getShape() ), data.getDataType(), isMasked() );
    }
}
