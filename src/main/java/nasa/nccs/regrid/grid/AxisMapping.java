package nasa.nccs.regrid.grid;

/**
 * Identifies the X and Y domain axes of 2-d latitude/longitude coordinates. Either both are domain
 * axis specifiers, or both are positions (0 or 1) within the dimensions of the 2-d coordinate arrays.
 */
public final class AxisMapping {
    private final String x;
    private final String y;
    private final int xDim;
    private final int yDim;

    private AxisMapping( String x, String y, int xDim, int yDim ) {
        this.x = x;
        this.y = y;
        this.xDim = xDim;
        this.yDim = yDim;
    }

    public static AxisMapping ofAxes( String x, String y ) { return new AxisMapping( x, y, -1, -1 ); }

    public static AxisMapping ofDimensions( int xDim, int yDim ) { return new AxisMapping( null, null, xDim, yDim ); }

    public boolean isPositional() { return x == null; }

    public String getX() { return x; }

    public String getY() { return y; }

    public int getXDim() { return xDim; }

    public int getYDim() { return yDim; }

    public String toString() {
        return isPositional() ? String.format( "{X: %d, Y: %d}", xDim, yDim ) : String.format( "{X: %s, Y: %s}", x, y );
    }
}
