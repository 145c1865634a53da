package nasa.nccs.regrid.operator;

import com.google.common.collect.ImmutableMap;
import nasa.nccs.regrid.engine.RegridMethod;

/**
 * Where each method's masks are taken into account. A baked mask is handed to the weight engine so
 * masked cells shape the weights themselves; any other mask is applied retrospectively to weights
 * derived for an unmasked grid.
 * <p>
 * <pre>
 *   method            source mask                     destination mask
 *   patch             baked                           retrospective
 *   conservative_2nd  baked                           retrospective
 *   nearest_stod      retrospective (baked if unused) baked
 *   others            retrospective                   retrospective
 * </pre>
 * Methods whose weights depend on a baked source mask, and nearest_stod, can only be applied to data
 * whose mask is the same across all non-regrid dimensions.
 */
public final class MaskPolicy {
    private static final ImmutableMap<RegridMethod, MaskPolicy> POLICIES = ImmutableMap.<RegridMethod, MaskPolicy>builder()
            .put( RegridMethod.LINEAR, new MaskPolicy( false, false, false ) )
            .put( RegridMethod.CONSERVATIVE_1ST, new MaskPolicy( false, false, false ) )
            .put( RegridMethod.NEAREST_DTOS, new MaskPolicy( false, false, false ) )
            .put( RegridMethod.PATCH, new MaskPolicy( true, false, true ) )
            .put( RegridMethod.CONSERVATIVE_2ND, new MaskPolicy( true, false, true ) )
            .put( RegridMethod.NEAREST_STOD, new MaskPolicy( false, true, true ) )
            .build();

    private final boolean bakeSource;
    private final boolean bakeDestination;
    private final boolean invariantSourceMask;

    private MaskPolicy( boolean bakeSource, boolean bakeDestination, boolean invariantSourceMask ) {
        this.bakeSource = bakeSource;
        this.bakeDestination = bakeDestination;
        this.invariantSourceMask = invariantSourceMask;
    }

    public static MaskPolicy forMethod( RegridMethod method ) { return POLICIES.get( method ); }

    /**
     * Whether the source mask goes to the weight engine. For nearest_stod the source mask is baked
     * when it is not to be used on the result, so destination cells are only mapped from unmasked
     * source cells.
     */
    public boolean bakesSourceMask( RegridMethod method, boolean useSrcMask ) {
        if( method == RegridMethod.NEAREST_STOD ) { return !useSrcMask; }
        return bakeSource;
    }

    public boolean bakesDestinationMask() { return bakeDestination; }

    /** Whether applying the weights requires one source mask for every slice of the data. */
    public boolean requiresInvariantSourceMask() { return invariantSourceMask; }

    public String toString() {
        return String.format( "MaskPolicy: bakeSource=%s, bakeDestination=%s, invariantSourceMask=%s", bakeSource, bakeDestination, invariantSourceMask );
    }
}
