package nasa.nccs.regrid.engine;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.grid.CoordSystem;
import ucar.ma2.Array;

import java.util.List;

/**
 * A grid discretized for the weight engine. Axes are in engine order (X first). Centres and corners
 * are either one 1-d array per axis, or for curvilinear 2-d grids one (nx, ny) array per axis, with
 * corners one larger than the centres along each non-periodic axis. Cells are flattened with the
 * first axis varying fastest.
 */
public final class EngineGrid {
    private final String name;
    private final CoordSystem coordSystem;
    private final int[] shape;
    private final boolean periodic;
    private final ImmutableList<Array> centers;
    private final ImmutableList<Array> corners;
    private final int[] mask;

    public EngineGrid( String name, CoordSystem coordSystem, int[] shape, boolean periodic, List<Array> centers, List<Array> corners, int[] mask ) {
        Preconditions.checkArgument( shape.length >= 1 && shape.length <= 3, "Engine grids have 1 to 3 axes, got %s", shape.length );
        Preconditions.checkArgument( centers.size() == shape.length, "Need one centre array per axis" );
        Preconditions.checkArgument( corners.isEmpty() || corners.size() == shape.length, "Need no corners or one corner array per axis" );
        if( mask != null ) {
            Preconditions.checkArgument( mask.length == ArrayHelper.product( shape ), "Mask size %s does not match grid size %s", mask.length, ArrayHelper.product( shape ) );
        }
        this.name = name;
        this.coordSystem = coordSystem;
        this.shape = shape.clone();
        this.periodic = periodic;
        this.centers = ImmutableList.copyOf( centers );
        this.corners = ImmutableList.copyOf( corners );
        this.mask = ( mask == null ) ? null : mask.clone();
    }

    public String getName() { return name; }

    public CoordSystem getCoordSystem() { return coordSystem; }

    public int[] getShape() { return shape.clone(); }

    public int getRank() { return shape.length; }

    public int getSize() { return (int) ArrayHelper.product( shape ); }

    /** Whether the first axis is periodic. */
    public boolean isPeriodic() { return periodic; }

    public boolean isCurvilinear() { return centers.get( 0 ).getRank() > 1; }

    public List<Array> getCenters() { return centers; }

    public List<Array> getCorners() { return corners; }

    public boolean hasCorners() { return !corners.isEmpty(); }

    /** One element per cell: 1 for a valid cell, 0 for a masked cell; {@code null} when unmasked. */
    public int[] getMask() { return ( mask == null ) ? null : mask.clone(); }

    public boolean isMasked( int cell ) { return mask != null && mask[cell] == 0; }

    public String toString() {
        return String.format( "EngineGrid: %s %s shape=%s periodic=%s corners=%s masked=%s", name, coordSystem,
                ArrayHelper.shapeString( shape ), periodic, hasCorners(), mask != null );
    }
}
