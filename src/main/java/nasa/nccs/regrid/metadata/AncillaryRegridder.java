package nasa.nccs.regrid.metadata;

import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.operator.RegridOperator;

import java.util.List;

/**
 * Regrids a domain ancillary, converted to a field, with the operator that regridded its parent.
 */
public interface AncillaryRegridder {

    /**
     * @param srcAxisKeys the regrid axes of {@code ancillary}, in operator order
     */
    Field regrid( Field ancillary, RegridOperator operator, List<String> srcAxisKeys ) throws RegridException;
}
