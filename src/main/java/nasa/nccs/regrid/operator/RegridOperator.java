package nasa.nccs.regrid.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.engine.Weights;
import nasa.nccs.regrid.grid.CoordSystem;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A reusable sparse map from the cells of a source grid to the cells of a destination grid, with
 * the provenance needed to check that a later source field is on the same grid.
 * <p>
 * Instances are immutable: every accessor returns a copy, so an operator can be shared between
 * threads and applied any number of times.
 */
public final class RegridOperator {
    private final Weights weights;
    private final RegridMethod method;
    private final CoordSystem coordSystem;
    private final int[] srcShape;
    private final int[] dstShape;
    private final boolean srcCyclic;
    private final boolean dstCyclic;
    private final ImmutableList<Array> srcCoords;
    private final ImmutableList<Array> srcBounds;
    private final ArrayBoolean srcMask;
    private final boolean srcMaskBaked;
    private final ArrayBoolean dstMask;
    private final Domain dst;
    private final ImmutableList<String> dstAxisKeys;

    // Weights sorted by destination cell: row r uses entries rowStart[r] until rowStart[r+1]
    private final int[] rowStart;
    private final int[] colIndex;
    private final double[] values;

    RegridOperator( Weights weights, RegridMethod method, CoordSystem coordSystem, int[] srcShape, int[] dstShape,
                    boolean srcCyclic, boolean dstCyclic, List<Array> srcCoords, List<Array> srcBounds,
                    ArrayBoolean srcMask, boolean srcMaskBaked, ArrayBoolean dstMask, Domain dst, List<String> dstAxisKeys ) {
        Preconditions.checkNotNull( weights, "weights" );
        int srcSize = (int) ArrayHelper.product( srcShape );
        int dstSize = (int) ArrayHelper.product( dstShape );
        if( srcMask != null ) {
            Preconditions.checkArgument( Arrays.equals( srcMask.getShape(), srcShape ), "Source mask shape must match the source grid" );
        }
        if( dstMask != null ) {
            Preconditions.checkArgument( Arrays.equals( dstMask.getShape(), dstShape ), "Destination mask shape must match the destination grid" );
        }
        this.weights = weights;
        this.method = method;
        this.coordSystem = coordSystem;
        this.srcShape = srcShape.clone();
        this.dstShape = dstShape.clone();
        this.srcCyclic = srcCyclic;
        this.dstCyclic = dstCyclic;
        this.srcCoords = copyOf( srcCoords );
        this.srcBounds = copyOf( srcBounds );
        this.srcMask = ( srcMask == null ) ? null : (ArrayBoolean) srcMask.copy();
        this.srcMaskBaked = srcMaskBaked;
        this.dstMask = ( dstMask == null ) ? null : (ArrayBoolean) dstMask.copy();
        this.dst = ( dst == null ) ? null : dst.copy();
        this.dstAxisKeys = ImmutableList.copyOf( dstAxisKeys );

        int n = weights.size();
        int[] counts = new int[ dstSize + 1 ];
        for( int i = 0; i < n; i++ ) {
            int row = weights.getRow( i );
            int col = weights.getCol( i );
            Preconditions.checkArgument( row >= 0 && row < dstSize, "Destination index %s out of range for %s cells", row, dstSize );
            Preconditions.checkArgument( col >= 0 && col < srcSize, "Source index %s out of range for %s cells", col, srcSize );
            counts[ row + 1 ]++;
        }
        for( int r = 0; r < dstSize; r++ ) { counts[ r + 1 ] += counts[r]; }
        rowStart = counts.clone();
        colIndex = new int[n];
        values = new double[n];
        int[] next = Arrays.copyOf( counts, dstSize );
        for( int i = 0; i < n; i++ ) {
            int k = next[ weights.getRow( i ) ]++;
            colIndex[k] = weights.getCol( i );
            values[k] = weights.getValue( i );
        }
    }

    private static ImmutableList<Array> copyOf( List<Array> arrays ) {
        List<Array> copies = new ArrayList<Array>();
        for( Array a: arrays ) { copies.add( a.copy() ); }
        return ImmutableList.copyOf( copies );
    }

    public Weights getWeights() { return weights; }

    public int getNumWeights() { return values.length; }

    public RegridMethod getMethod() { return method; }

    public CoordSystem getCoordSystem() { return coordSystem; }

    public int[] getSrcShape() { return srcShape.clone(); }

    public int[] getDstShape() { return dstShape.clone(); }

    public int getSrcSize() { return (int) ArrayHelper.product( srcShape ); }

    public int getDstSize() { return (int) ArrayHelper.product( dstShape ); }

    public boolean isSrcCyclic() { return srcCyclic; }

    public boolean isDstCyclic() { return dstCyclic; }

    public List<Array> getSrcCoords() { return copyOf( srcCoords ); }

    public List<Array> getSrcBounds() { return copyOf( srcBounds ); }

    /** The source mask the weights were derived with, or {@code null} when there was none. */
    public ArrayBoolean getSrcMask() { return ( srcMask == null ) ? null : (ArrayBoolean) srcMask.copy(); }

    /** Whether the weight engine took the source mask into account. */
    public boolean isSrcMaskBaked() { return srcMaskBaked; }

    /** A destination mask to apply to results, or {@code null}. */
    public ArrayBoolean getDstMask() { return ( dstMask == null ) ? null : (ArrayBoolean) dstMask.copy(); }

    public MaskPolicy getMaskPolicy() { return MaskPolicy.forMethod( method ); }

    /** A copy of the destination grid's domain, for updating the metadata of regridded fields. */
    public Domain getDst() { return ( dst == null ) ? null : dst.copy(); }

    /** The destination regrid axes within {@link #getDst()}: (Y, X) for spherical grids. */
    public List<String> getDstAxisKeys() { return dstAxisKeys; }

    /** The weights of destination cell {@code row} are entries {@code rowStart(row)} up to {@code rowEnd(row)}. */
    public int rowStart( int row ) { return rowStart[row]; }

    public int rowEnd( int row ) { return rowStart[ row + 1 ]; }

    public int column( int k ) { return colIndex[k]; }

    public double value( int k ) { return values[k]; }

    /** Whether {@code mask} is the source mask the weights were derived with; no mask equals an all false one. */
    public boolean srcMaskEquals( Array mask ) {
        if( srcMask == null ) { return !ArrayHelper.any( mask ); }
        return ArrayHelper.equal( srcMask, mask );
    }

    public String toString() {
        return String.format( "RegridOperator: method=%s, coord_sys=%s, src_shape=%s, dst_shape=%s, src_cyclic=%s, dst_cyclic=%s, weights=%d",
                method, coordSystem, ArrayHelper.shapeString( srcShape ), ArrayHelper.shapeString( dstShape ), srcCyclic, dstCyclic, values.length );
    }
}
