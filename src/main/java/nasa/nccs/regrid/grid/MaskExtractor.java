package nasa.nccs.regrid.grid;

import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.Field;
import org.apache.commons.lang.ArrayUtils;
import ucar.ma2.Array;
import ucar.ma2.ArrayBoolean;

import java.util.Arrays;

/**
 * Derives the mask of a field over the regrid axes of a grid.
 * <p>
 * Non-regrid dimensions are collapsed by taking their first element, so the mask is only
 * representative when it does not vary along them.
 */
public class MaskExtractor {

    /** A mask with the grid's shape, in its axis order. A domain, or a field without a mask, gives all false. */
    public ArrayBoolean extract( Domain f, GridDescriptor grid ) {
        if( !( f instanceof Field ) ) { return ArrayHelper.falseMask( grid.getShape() ); }
        Field field = (Field) f;
        if( field.getData() == null || field.getData().getMask() == null ) { return ArrayHelper.falseMask( grid.getShape() ); }

        int[] indices = grid.getAxisIndexArray();
        Array mask = field.getData().getMask();
        for( int dim = mask.getRank() - 1; dim >= 0; dim-- ) {
            if( !ArrayUtils.contains( indices, dim ) ) { mask = mask.slice( dim, 0 ); }
        }

        // What remains is the regrid dimensions in data order; permute them into grid order
        int[] sorted = indices.clone();
        Arrays.sort( sorted );
        int[] permutation = new int[ indices.length ];
        for( int i = 0; i < indices.length; i++ ) { permutation[i] = Arrays.binarySearch( sorted, indices[i] ); }
        mask = mask.permute( permutation );
        return ArrayHelper.fromBooleans( ArrayHelper.toBooleans( mask ), grid.getShape() );
    }
}
