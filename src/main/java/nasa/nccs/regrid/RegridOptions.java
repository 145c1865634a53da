package nasa.nccs.regrid;

import com.google.common.collect.ImmutableList;
import nasa.nccs.regrid.engine.UnmappedAction;
import nasa.nccs.regrid.grid.AxisMapping;
import nasa.nccs.regrid.grid.CoordSystem;

import java.util.Arrays;
import java.util.List;

/**
 * Per-call regridding configuration.
 * <pre>
 *   RegridOptions options = RegridOptions.builder().method( "conservative" ).dstCyclic( true ).build();
 * </pre>
 */
public final class RegridOptions {
    private final CoordSystem coordSystem;
    private final String method;
    private final List<String> axes;
    private final AxisMapping srcAxes;
    private final AxisMapping dstAxes;
    private final Boolean srcCyclic;
    private final Boolean dstCyclic;
    private final boolean useSrcMask;
    private final boolean useDstMask;
    private final boolean ignoreDegenerate;
    private final UnmappedAction unmappedAction;
    private final boolean checkCoordinates;
    private final boolean returnOperator;

    private RegridOptions( Builder b ) {
        coordSystem = b.coordSystem;
        method = b.method;
        axes = ( b.axes == null ) ? null : ImmutableList.copyOf( b.axes );
        srcAxes = b.srcAxes;
        dstAxes = b.dstAxes;
        srcCyclic = b.srcCyclic;
        dstCyclic = b.dstCyclic;
        useSrcMask = b.useSrcMask;
        useDstMask = b.useDstMask;
        ignoreDegenerate = b.ignoreDegenerate;
        unmappedAction = b.unmappedAction;
        checkCoordinates = b.checkCoordinates;
        returnOperator = b.returnOperator;
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.coordSystem = coordSystem;
        b.method = method;
        b.axes = axes;
        b.srcAxes = srcAxes;
        b.dstAxes = dstAxes;
        b.srcCyclic = srcCyclic;
        b.dstCyclic = dstCyclic;
        b.useSrcMask = useSrcMask;
        b.useDstMask = useDstMask;
        b.ignoreDegenerate = ignoreDegenerate;
        b.unmappedAction = unmappedAction;
        b.checkCoordinates = checkCoordinates;
        b.returnOperator = returnOperator;
        return b;
    }

    public CoordSystem getCoordSystem() { return coordSystem; }

    /** The method tag; ignored when regridding with an existing operator. */
    public String getMethod() { return method; }

    /** Cartesian regrid axes, or {@code null}. */
    public List<String> getAxes() { return axes; }

    /** X and Y axes of 2-d source latitude/longitude coordinates, or {@code null}. */
    public AxisMapping getSrcAxes() { return srcAxes; }

    public AxisMapping getDstAxes() { return dstAxes; }

    public Boolean getSrcCyclic() { return srcCyclic; }

    public Boolean getDstCyclic() { return dstCyclic; }

    public boolean isUseSrcMask() { return useSrcMask; }

    public boolean isUseDstMask() { return useDstMask; }

    public boolean isIgnoreDegenerate() { return ignoreDegenerate; }

    public UnmappedAction getUnmappedAction() { return unmappedAction; }

    public boolean isCheckCoordinates() { return checkCoordinates; }

    public boolean isReturnOperator() { return returnOperator; }

    public String toString() {
        return String.format( "RegridOptions: coord_sys=%s, method=%s, axes=%s, src_axes=%s, dst_axes=%s, src_cyclic=%s, dst_cyclic=%s, use_src_mask=%s, use_dst_mask=%s",
                coordSystem, method, axes, srcAxes, dstAxes, srcCyclic, dstCyclic, useSrcMask, useDstMask );
    }

    public static final class Builder {
        private CoordSystem coordSystem = CoordSystem.SPHERICAL;
        private String method;
        private List<String> axes;
        private AxisMapping srcAxes;
        private AxisMapping dstAxes;
        private Boolean srcCyclic;
        private Boolean dstCyclic;
        private boolean useSrcMask = true;
        private boolean useDstMask = false;
        private boolean ignoreDegenerate = true;
        private UnmappedAction unmappedAction = UnmappedAction.IGNORE;
        private boolean checkCoordinates = false;
        private boolean returnOperator = false;

        private Builder() { }

        public Builder coordSystem( CoordSystem coordSystem ) { this.coordSystem = coordSystem; return this; }

        public Builder method( String method ) { this.method = method; return this; }

        public Builder axes( String... axes ) { this.axes = Arrays.asList( axes ); return this; }

        public Builder axes( List<String> axes ) { this.axes = axes; return this; }

        public Builder srcAxes( AxisMapping srcAxes ) { this.srcAxes = srcAxes; return this; }

        public Builder dstAxes( AxisMapping dstAxes ) { this.dstAxes = dstAxes; return this; }

        public Builder srcCyclic( Boolean srcCyclic ) { this.srcCyclic = srcCyclic; return this; }

        public Builder dstCyclic( Boolean dstCyclic ) { this.dstCyclic = dstCyclic; return this; }

        public Builder useSrcMask( boolean useSrcMask ) { this.useSrcMask = useSrcMask; return this; }

        public Builder useDstMask( boolean useDstMask ) { this.useDstMask = useDstMask; return this; }

        public Builder ignoreDegenerate( boolean ignoreDegenerate ) { this.ignoreDegenerate = ignoreDegenerate; return this; }

        public Builder unmappedAction( UnmappedAction unmappedAction ) { this.unmappedAction = unmappedAction; return this; }

        public Builder checkCoordinates( boolean checkCoordinates ) { this.checkCoordinates = checkCoordinates; return this; }

        public Builder returnOperator( boolean returnOperator ) { this.returnOperator = returnOperator; return this; }

        public RegridOptions build() { return new RegridOptions( this ); }
    }
}
