package nasa.nccs.regrid.apply;

import nasa.nccs.regrid.OperatorReuseException;
import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.UnsupportedMaskVariationException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.MaskedArray;
import nasa.nccs.regrid.operator.RegridOperator;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.commons.lang.ArrayUtils;
import org.apache.log4j.Logger;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Applies the weights of a regrid operator to data of any rank.
 * <p>
 * The regrid dimensions are replaced by the destination grid's, all other dimensions pass through
 * unchanged, and the result is always double precision. A result element is masked when no weight
 * maps to its destination cell, when every source cell contributing to it is masked, or when the
 * operator's destination mask masks it. When only some contributing cells are masked, the value is
 * formed from the rest with their weights scaled up to the full weight total. Masked result
 * elements hold {@link #MASKED_VALUE}.
 */
public class OperatorApplier {
    public static final double MASKED_VALUE = Double.NaN;

    private static final Logger logger = RegridLogManager.getLogger( OperatorApplier.class );

    /**
     * @param regridAxes the data dimensions holding the source grid, in the order of the operator's
     *                   source shape
     */
    public MaskedArray apply( MaskedArray data, RegridOperator operator, int[] regridAxes ) throws RegridException {
        int rank = data.getRank();
        int[] shape = data.getShape();
        int[] srcShape = operator.getSrcShape();
        int[] dstShape = operator.getDstShape();
        if( regridAxes.length != srcShape.length ) {
            throw new OperatorReuseException( String.format( "Operator regrids %d dimensions, but %d were given", srcShape.length, regridAxes.length ) );
        }
        for( int i = 0; i < regridAxes.length; i++ ) {
            int axis = regridAxes[i];
            if( axis < 0 || axis >= rank ) {
                throw new IllegalArgumentException( String.format( "Regrid axis %d out of range for data of rank %d", axis, rank ) );
            }
            if( shape[axis] != srcShape[i] ) {
                throw new OperatorReuseException( String.format( "Data shape %s does not match the operator's source grid shape %s along dimension %d",
                        ArrayHelper.shapeString( shape ), ArrayHelper.shapeString( srcShape ), axis ) );
            }
        }

        // Move the regrid dimensions to the end, so each slice of the data is one contiguous source grid
        List<Integer> others = new ArrayList<Integer>();
        for( int dim = 0; dim < rank; dim++ ) { if( !ArrayUtils.contains( regridAxes, dim ) ) { others.add( dim ); } }
        int[] permutation = new int[ rank ];
        int[] outShape = new int[ rank ];
        for( int i = 0; i < others.size(); i++ ) {
            permutation[i] = others.get( i );
            outShape[i] = shape[ others.get( i ) ];
        }
        for( int i = 0; i < regridAxes.length; i++ ) {
            permutation[ others.size() + i ] = regridAxes[i];
            outShape[ others.size() + i ] = dstShape[i];
        }
        double[] values = ArrayHelper.toDoubles( data.getData().permute( permutation ) );
        boolean[] mask = ArrayHelper.toBooleans( data.getMaskArray().permute( permutation ) );

        int srcSize = operator.getSrcSize();
        int dstSize = operator.getDstSize();
        int nSlices = ( srcSize == 0 ) ? 0 : values.length / srcSize;
        checkSourceMask( operator, mask, nSlices, srcSize, srcShape );

        boolean[] dstMask = ( operator.getDstMask() == null ) ? null : ArrayHelper.toBooleans( operator.getDstMask() );
        double[] result = new double[ nSlices * dstSize ];
        boolean[] resultMask = new boolean[ nSlices * dstSize ];
        for( int s = 0; s < nSlices; s++ ) {
            int srcOffset = s * srcSize;
            int dstOffset = s * dstSize;
            for( int row = 0; row < dstSize; row++ ) {
                double total = 0.0;
                double unmasked = 0.0;
                double sum = 0.0;
                boolean valid = false;
                for( int k = operator.rowStart( row ); k < operator.rowEnd( row ); k++ ) {
                    double w = operator.value( k );
                    int cell = srcOffset + operator.column( k );
                    total += w;
                    if( !mask[cell] ) {
                        sum += w * values[cell];
                        unmasked += w;
                        valid = true;
                    }
                }
                if( !valid || ( dstMask != null && dstMask[row] ) ) {
                    result[ dstOffset + row ] = MASKED_VALUE;
                    resultMask[ dstOffset + row ] = true;
                } else {
                    result[ dstOffset + row ] = ( unmasked == total || unmasked == 0.0 ) ? sum : sum * ( total / unmasked );
                }
            }
        }

        int[] inverse = new int[ rank ];
        for( int i = 0; i < rank; i++ ) { inverse[ permutation[i] ] = i; }
        Array out = ArrayHelper.fromDoubles( result, outShape ).permute( inverse );
        Array outMask = ArrayHelper.fromBooleans( resultMask, outShape ).permute( inverse );
        int[] finalShape = out.getShape();
        logger.debug( String.format( "Regridded data %s -> %s", ArrayHelper.shapeString( shape ), ArrayHelper.shapeString( finalShape ) ) );
        return new MaskedArray( ArrayHelper.toDoubleArray( out ), ArrayHelper.fromBooleans( ArrayHelper.toBooleans( outMask ), finalShape ) );
    }

    /**
     * Weights derived with a baked source mask, or for nearest source to destination, only hold for
     * data masked the same way in every slice.
     */
    private static void checkSourceMask( RegridOperator operator, boolean[] mask, int nSlices, int srcSize, int[] srcShape ) throws UnsupportedMaskVariationException {
        if( !operator.getMaskPolicy().requiresInvariantSourceMask() || nSlices == 0 ) { return; }
        for( int s = 1; s < nSlices; s++ ) {
            for( int i = 0; i < srcSize; i++ ) {
                if( mask[ s * srcSize + i ] != mask[i] ) {
                    throw new UnsupportedMaskVariationException( String.format(
                            "Can't regrid with the '%s' method: the source mask varies across non-regrid dimensions", operator.getMethod() ) );
                }
            }
        }
        if( operator.isSrcMaskBaked() ) {
            ArrayBoolean first = ArrayHelper.fromBooleans( Arrays.copyOf( mask, srcSize ), srcShape );
            if( !operator.srcMaskEquals( first ) ) {
                throw new UnsupportedMaskVariationException( String.format(
                        "Can't regrid with the '%s' method: the source mask differs from the mask the weights were derived with", operator.getMethod() ) );
            }
        }
    }
}
