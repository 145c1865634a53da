package nasa.nccs.regrid.grid;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import nasa.nccs.regrid.cdm.ArrayHelper;
import ucar.ma2.Array;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * The canonical description of the regrid axes of a field or domain.
 * <p>
 * {@code axisKeys}, {@code axisIndices} and {@code shape} are in the order the operator flattens
 * cells (slowest varying first). {@code coords} and {@code bounds} are in engine order, which is
 * the reverse: X then Y for spherical grids. For 1-d Cartesian grids a synthetic second engine axis
 * is appended to {@code coords} (and {@code bounds}) that has no axis key.
 * <p>
 * Coordinate arrays are owned by the descriptor and must not be modified.
 */
public final class GridDescriptor {

    /** The closed set of grid variants, resolved once when the descriptor is built. */
    public enum GridType { SPHERICAL_1D, SPHERICAL_2D, CARTESIAN }

    private final String role;
    private final CoordSystem coordSystem;
    private final GridType type;
    private final ImmutableList<String> axisKeys;
    private final ImmutableList<Integer> axisIndices;
    private final int[] shape;
    private final ImmutableList<Array> coords;
    private final ImmutableList<Array> bounds;
    private final List<String> units;
    private final boolean cyclic;
    private final boolean syntheticAxis;

    GridDescriptor( String role, CoordSystem coordSystem, GridType type, List<String> axisKeys, List<Integer> axisIndices, int[] shape,
                    List<Array> coords, List<Array> bounds, List<String> units, boolean cyclic, boolean syntheticAxis ) {
        Preconditions.checkArgument( axisKeys.size() == axisIndices.size() && axisKeys.size() == shape.length,
                "Axis keys, axis indices and shape must have equal lengths" );
        Preconditions.checkArgument( bounds.isEmpty() || bounds.size() == coords.size(), "Coordinates and bounds must have equal lengths" );
        Preconditions.checkArgument( units.size() == coords.size(), "Need one units entry per coordinate" );
        Preconditions.checkArgument( axisKeys.size() == new HashSet<String>( axisKeys ).size(),
                "Regrid axes of the %s grid must be distinct: %s", role, axisKeys );
        this.role = role;
        this.coordSystem = coordSystem;
        this.type = type;
        this.axisKeys = ImmutableList.copyOf( axisKeys );
        this.axisIndices = ImmutableList.copyOf( axisIndices );
        this.shape = shape.clone();
        this.coords = ImmutableList.copyOf( coords );
        this.bounds = ImmutableList.copyOf( bounds );
        this.units = Collections.unmodifiableList( new ArrayList<String>( units ) );
        this.cyclic = cyclic;
        this.syntheticAxis = syntheticAxis;
    }

    /** A copy with replacement coordinates, bounds and units, for unit conformance. */
    public GridDescriptor withCoordinates( List<Array> newCoords, List<Array> newBounds, List<String> newUnits ) {
        return new GridDescriptor( role, coordSystem, type, axisKeys, axisIndices, shape, newCoords, newBounds, newUnits, cyclic, syntheticAxis );
    }

    /** "source" or "destination". */
    public String getRole() { return role; }

    public CoordSystem getCoordSystem() { return coordSystem; }

    public GridType getType() { return type; }

    public List<String> getAxisKeys() { return axisKeys; }

    public List<Integer> getAxisIndices() { return axisIndices; }

    public int[] getAxisIndexArray() {
        int[] indices = new int[ axisIndices.size() ];
        for( int i = 0; i < indices.length; i++ ) { indices[i] = axisIndices.get( i ); }
        return indices;
    }

    public int[] getShape() { return shape.clone(); }

    public int getSize() { return (int) ArrayHelper.product( shape ); }

    public List<Array> getCoords() { return coords; }

    public List<Array> getBounds() { return bounds; }

    public boolean hasBounds() { return !bounds.isEmpty(); }

    /** Units of each engine-order coordinate; {@code null} for the synthetic axis or when unset. */
    public List<String> getUnits() { return units; }

    public boolean isCyclic() { return cyclic; }

    /** Whether a synthetic engine axis was added to a 1-d Cartesian grid. */
    public boolean hasSyntheticAxis() { return syntheticAxis; }

    public boolean isCurvilinear() { return type == GridType.SPHERICAL_2D; }

    public String toString() {
        return String.format( "GridDescriptor: %s %s %s axes=%s indices=%s shape=%s cyclic=%s bounds=%s", role, coordSystem, type,
                axisKeys, axisIndices, Arrays.toString( shape ), cyclic, hasBounds() );
    }
}
