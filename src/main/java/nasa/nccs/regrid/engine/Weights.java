package nasa.nccs.regrid.engine;

import com.google.common.base.Preconditions;

/**
 * The weight triple: parallel arrays of weight values, destination cell indices and source cell
 * indices. Indices are 0-based into the flattened grids.
 */
public final class Weights {
    private final double[] values;
    private final int[] rows;
    private final int[] cols;

    public Weights( double[] values, int[] rows, int[] cols ) {
        Preconditions.checkArgument( values.length == rows.length && rows.length == cols.length,
                "Weight arrays must have equal lengths: %s, %s, %s", values.length, rows.length, cols.length );
        this.values = values.clone();
        this.rows = rows.clone();
        this.cols = cols.clone();
    }

    public int size() { return values.length; }

    public double[] getValues() { return values.clone(); }

    public int[] getRows() { return rows.clone(); }

    public int[] getCols() { return cols.clone(); }

    public double getValue( int i ) { return values[i]; }

    public int getRow( int i ) { return rows[i]; }

    public int getCol( int i ) { return cols[i]; }

    /** The weights whose destination index is below {@code rowLimit} and source index below {@code colLimit}. */
    public Weights restrict( int rowLimit, int colLimit ) {
        int n = 0;
        for( int i = 0; i < values.length; i++ ) { if( rows[i] < rowLimit && cols[i] < colLimit ) { n++; } }
        double[] v = new double[n];
        int[] r = new int[n];
        int[] c = new int[n];
        int j = 0;
        for( int i = 0; i < values.length; i++ ) {
            if( rows[i] < rowLimit && cols[i] < colLimit ) {
                v[j] = values[i];
                r[j] = rows[i];
                c[j] = cols[i];
                j++;
            }
        }
        return new Weights( v, r, c );
    }

    public String toString() { return String.format( "Weights: n=%d", values.length ); }
}
