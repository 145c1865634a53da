package nasa.nccs.regrid.cdm;

import com.google.common.base.Preconditions;
import ucar.ma2.Array;

import java.util.Arrays;

/**
 * A dimension (1-d, one per domain axis) or auxiliary coordinate, with optional cell bounds. Bounds
 * have one more trailing dimension than the coordinate, holding the cell vertices.
 */
public class Coordinate {
    public enum Kind { DIMENSION, AUXILIARY }

    private final Kind kind;
    private String standardName;
    private String units;
    private String axis;
    private Array data;
    private Array bounds;

    public Coordinate( Kind kind, String standardName, String units, Array data, Array bounds ) {
        Preconditions.checkNotNull( kind, "kind" );
        Preconditions.checkNotNull( data, "data" );
        if( kind == Kind.DIMENSION ) {
            Preconditions.checkArgument( data.getRank() == 1, "Dimension coordinate %s must be 1-d", standardName );
        }
        this.kind = kind;
        this.standardName = standardName;
        this.units = units;
        this.data = data;
        setBounds( bounds );
    }

    public static Coordinate dimension( String standardName, String units, double[] values ) {
        return new Coordinate( Kind.DIMENSION, standardName, units, ArrayHelper.fromDoubles( values, values.length ), null );
    }

    public static Coordinate auxiliary( String standardName, String units, Array data ) {
        return new Coordinate( Kind.AUXILIARY, standardName, units, data, null );
    }

    public Kind getKind() { return kind; }

    public boolean isDimension() { return kind == Kind.DIMENSION; }

    public String getStandardName() { return standardName; }

    public void setStandardName( String standardName ) { this.standardName = standardName; }

    public String getUnits() { return units; }

    public void setUnits( String units ) { this.units = units; }

    /** The CF axis designation ("X", "Y", "Z" or "T"), or {@code null}. */
    public String getAxis() { return axis; }

    public Coordinate setAxis( String axis ) {
        this.axis = axis;
        return this;
    }

    public Array getData() { return data; }

    public void setData( Array data ) {
        Preconditions.checkArgument( data.getRank() == this.data.getRank(), "Can't change the rank of coordinate %s", standardName );
        this.data = data;
    }

    public Array getBounds() { return bounds; }

    public boolean hasBounds() { return bounds != null; }

    public Coordinate setBounds( Array bounds ) {
        if( bounds != null ) {
            Preconditions.checkArgument( bounds.getRank() == data.getRank() + 1,
                    "Bounds of %s must have rank %s, got %s", standardName, data.getRank() + 1, bounds.getRank() );
        }
        this.bounds = bounds;
        return this;
    }

    public Coordinate withBounds( double[] values ) {
        int[] shape = data.getShape();
        int[] bshape = Arrays.copyOf( shape, shape.length + 1 );
        bshape[ shape.length ] = (int) ( values.length / data.getSize() );
        return setBounds( ArrayHelper.fromDoubles( values, bshape ) );
    }

    public int getRank() { return data.getRank(); }

    public int[] getShape() { return data.getShape(); }

    public boolean isLongitude() { return Units.isLongitude( units ); }

    public boolean isLatitude() { return Units.isLatitude( units ); }

    /** The axis designation, set explicitly or implied by longitude/latitude units. */
    public String getImpliedAxis() {
        if( axis != null ) { return axis; }
        if( isLongitude() ) { return "X"; }
        if( isLatitude() ) { return "Y"; }
        return null;
    }

    /** Whether this coordinate is identified by {@code identity}: an axis designation or standard name. */
    public boolean hasIdentity( String identity ) {
        if( identity == null ) { return false; }
        if( identity.equals( getImpliedAxis() ) ) { return true; }
        return identity.equals( standardName );
    }

    public Coordinate copy() {
        Coordinate c = new Coordinate( kind, standardName, units, data.copy(), ( bounds == null ) ? null : bounds.copy() );
        c.axis = axis;
        return c;
    }

    public String toString() {
        return String.format( "%s coordinate: %s%s [%s]", ( kind == Kind.DIMENSION ) ? "Dimension" : "Auxiliary",
                standardName, ArrayHelper.shapeString( data.getShape() ), units );
    }
}
