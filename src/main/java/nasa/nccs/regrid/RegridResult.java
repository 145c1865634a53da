package nasa.nccs.regrid;

import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.operator.RegridOperator;

/**
 * The outcome of a regrid call: the regridded field, or just the operator when one was asked for.
 */
public final class RegridResult {
    private final Field field;
    private final RegridOperator operator;

    private RegridResult( Field field, RegridOperator operator ) {
        this.field = field;
        this.operator = operator;
    }

    static RegridResult ofField( Field field, RegridOperator operator ) { return new RegridResult( field, operator ); }

    static RegridResult ofOperator( RegridOperator operator ) { return new RegridResult( null, operator ); }

    public boolean hasField() { return field != null; }

    /** The regridded field, or {@code null} when only the operator was built. */
    public Field getField() { return field; }

    /** The operator that was built or reused. */
    public RegridOperator getOperator() { return operator; }

    public String toString() { return hasField() ? "RegridResult: " + field : "RegridResult: " + operator; }
}
