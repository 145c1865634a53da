package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.grid.CoordSystem;

import java.util.ArrayList;
import java.util.List;

/**
 * An in-process weight engine for rectilinear grids, good enough to exercise the pipeline without
 * ESMF. It implements linear, first-order conservative and the two nearest neighbour methods.
 * Coordinates must increase along every axis. Longitudes of a periodic axis wrap at 360 degrees and
 * conservative latitude overlaps are measured in sin(latitude), so weights are area fractions.
 */
public class ReferenceWeightEngine implements WeightEngine {
    private int opened = 0;
    private int destroyed = 0;

    public EngineSession open() {
        opened++;
        return new Session();
    }

    public int getOpened() { return opened; }

    public int getDestroyed() { return destroyed; }

    private class Session implements EngineSession {
        private boolean closed = false;

        public Weights computeWeights( EngineGrid src, EngineGrid dst, RegridMethod method, UnmappedAction unmappedAction,
                                       boolean ignoreDegenerate ) throws WeightEngineException {
            if( closed ) { throw new WeightEngineException( "Session already destroyed" ); }
            if( src.isCurvilinear() || dst.isCurvilinear() ) {
                throw new WeightEngineException( "The reference engine only handles rectilinear grids" );
            }
            if( src.getRank() != dst.getRank() ) {
                throw new WeightEngineException( String.format( "Grid ranks differ: %d, %d", src.getRank(), dst.getRank() ) );
            }
            WeightList weights = new WeightList();
            switch( method ) {
                case LINEAR: linear( src, dst, weights ); break;
                case CONSERVATIVE_1ST: conservative( src, dst, weights ); break;
                case NEAREST_STOD: nearestStod( src, dst, weights ); break;
                case NEAREST_DTOS: nearestDtos( src, dst, weights ); break;
                default: throw new WeightEngineException( "The reference engine does not implement " + method );
            }
            if( unmappedAction == UnmappedAction.ERROR ) {
                for( int row = 0; row < dst.getSize(); row++ ) {
                    if( !dst.isMasked( row ) && !weights.hasRow( row ) ) {
                        throw new WeightEngineException( "Unmapped destination cell " + row );
                    }
                }
            }
            return weights.toWeights();
        }

        public void destroy() {
            if( !closed ) {
                closed = true;
                destroyed++;
            }
        }
    }

    static void linear( EngineGrid src, EngineGrid dst, WeightList weights ) {
        int rank = src.getRank();
        int[] srcShape = src.getShape();
        int[] dstShape = dst.getShape();
        double[][] srcAxes = centres( src );
        double[][] dstAxes = centres( dst );
        int[] strides = strides( srcShape );
        for( int row = 0; row < dst.getSize(); row++ ) {
            if( dst.isMasked( row ) ) { continue; }
            int[] idx = unravel( row, dstShape );
            double[][][] brackets = new double[ rank ][][];
            boolean mapped = true;
            for( int d = 0; d < rank; d++ ) {
                brackets[d] = bracket( dstAxes[d][ idx[d] ], srcAxes[d], d == 0 && src.isPeriodic() );
                if( brackets[d] == null ) { mapped = false; }
            }
            if( !mapped ) { continue; }
            List<int[]> cols = new ArrayList<int[]>();
            List<Double> values = new ArrayList<Double>();
            int combos = 1 << rank;
            boolean masked = false;
            for( int c = 0; c < combos; c++ ) {
                double w = 1.0;
                int col = 0;
                for( int d = 0; d < rank; d++ ) {
                    double[][] b = brackets[d];
                    int pick = ( c >> d ) & 1;
                    if( pick >= b.length ) { w = 0.0; break; }
                    w *= b[pick][1];
                    col += (int) b[pick][0] * strides[d];
                }
                if( w == 0.0 ) { continue; }
                if( src.isMasked( col ) ) { masked = true; }
                cols.add( new int[]{ col } );
                values.add( w );
            }
            if( masked ) { continue; }
            for( int i = 0; i < cols.size(); i++ ) { weights.add( values.get( i ), row, cols.get( i )[0] ); }
        }
    }

    static void conservative( EngineGrid src, EngineGrid dst, WeightList weights ) throws WeightEngineException {
        if( !src.hasCorners() || !dst.hasCorners() ) { throw new WeightEngineException( "Conservative weights need cell corners" ); }
        boolean spherical = src.getCoordSystem() == CoordSystem.SPHERICAL;
        int rank = src.getRank();
        int[] srcShape = src.getShape();
        int[] dstShape = dst.getShape();
        // fractions[d][i][j]: the part of destination cell i along axis d covered by source cell j
        double[][][] fractions = new double[ rank ][][];
        for( int d = 0; d < rank; d++ ) {
            double[][] s = cells( ArrayHelper.toDoubles( src.getCorners().get( d ) ), srcShape[d], d == 0 && src.isPeriodic() );
            double[][] t = cells( ArrayHelper.toDoubles( dst.getCorners().get( d ) ), dstShape[d], d == 0 && dst.isPeriodic() );
            boolean sine = spherical && d == 1;
            boolean wrap = spherical && d == 0;
            fractions[d] = new double[ t.length ][ s.length ];
            for( int i = 0; i < t.length; i++ ) {
                double size = measure( t[i][0], t[i][1], sine );
                if( size <= 0.0 ) { continue; }
                for( int j = 0; j < s.length; j++ ) {
                    double overlap = 0.0;
                    double[] shifts = wrap ? new double[]{ -360.0, 0.0, 360.0 } : new double[]{ 0.0 };
                    for( double shift: shifts ) {
                        double lo = Math.max( t[i][0], s[j][0] + shift );
                        double hi = Math.min( t[i][1], s[j][1] + shift );
                        if( hi > lo ) { overlap += measure( lo, hi, sine ); }
                    }
                    fractions[d][i][j] = overlap / size;
                }
            }
        }
        for( int row = 0; row < dst.getSize(); row++ ) {
            if( dst.isMasked( row ) ) { continue; }
            int[] di = unravel( row, dstShape );
            for( int col = 0; col < src.getSize(); col++ ) {
                if( src.isMasked( col ) ) { continue; }
                int[] si = unravel( col, srcShape );
                double w = 1.0;
                for( int d = 0; d < rank && w > 0.0; d++ ) { w *= fractions[d][ di[d] ][ si[d] ]; }
                if( w > 0.0 ) { weights.add( w, row, col ); }
            }
        }
    }

    static void nearestStod( EngineGrid src, EngineGrid dst, WeightList weights ) {
        for( int row = 0; row < dst.getSize(); row++ ) {
            if( dst.isMasked( row ) ) { continue; }
            int col = nearest( dst, row, src );
            if( col >= 0 ) { weights.add( 1.0, row, col ); }
        }
    }

    static void nearestDtos( EngineGrid src, EngineGrid dst, WeightList weights ) {
        for( int col = 0; col < src.getSize(); col++ ) {
            if( src.isMasked( col ) ) { continue; }
            int row = nearest( src, col, dst );
            if( row >= 0 ) { weights.add( 1.0, row, col ); }
        }
    }

    /** The unmasked cell of {@code to} closest to cell {@code cell} of {@code from}, lowest index on ties. */
    static int nearest( EngineGrid from, int cell, EngineGrid to ) {
        boolean spherical = from.getCoordSystem() == CoordSystem.SPHERICAL;
        double[][] fromAxes = centres( from );
        double[][] toAxes = centres( to );
        int[] fi = unravel( cell, from.getShape() );
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for( int c = 0; c < to.getSize(); c++ ) {
            if( to.isMasked( c ) ) { continue; }
            int[] ti = unravel( c, to.getShape() );
            double distance = 0.0;
            for( int d = 0; d < fi.length; d++ ) {
                double diff = Math.abs( fromAxes[d][ fi[d] ] - toAxes[d][ ti[d] ] );
                if( spherical && d == 0 ) { diff = Math.min( mod( diff, 360.0 ), 360.0 - mod( diff, 360.0 ) ); }
                distance += diff * diff;
            }
            if( distance < bestDistance ) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    /** The (index, weight) pairs of the source cells either side of {@code x}, or null when outside. */
    static double[][] bracket( double x, double[] c, boolean periodic ) {
        int n = c.length;
        if( n == 1 ) { return ( x == c[0] ) ? new double[][]{ { 0, 1.0 } } : null; }
        double xs = periodic ? c[0] + mod( x - c[0], 360.0 ) : x;
        for( int i = 0; i < n - 1; i++ ) {
            if( xs >= c[i] && xs <= c[ i + 1 ] ) {
                double t = ( xs - c[i] ) / ( c[ i + 1 ] - c[i] );
                return new double[][]{ { i, 1.0 - t }, { i + 1, t } };
            }
        }
        if( periodic ) {
            double t = ( xs - c[ n - 1 ] ) / ( c[0] + 360.0 - c[ n - 1 ] );
            return new double[][]{ { n - 1, 1.0 - t }, { 0, t } };
        }
        return null;
    }

    static double[][] cells( double[] corners, int n, boolean periodic ) {
        double[][] cells = new double[n][];
        for( int i = 0; i < n; i++ ) {
            double lo = corners[i];
            double hi = ( periodic && i == n - 1 ) ? corners[0] + 360.0 : corners[ i + 1 ];
            cells[i] = new double[]{ Math.min( lo, hi ), Math.max( lo, hi ) };
        }
        return cells;
    }

    static double measure( double lo, double hi, boolean sine ) {
        if( sine ) { return Math.sin( Math.toRadians( hi ) ) - Math.sin( Math.toRadians( lo ) ); }
        return hi - lo;
    }

    static double[][] centres( EngineGrid grid ) {
        double[][] axes = new double[ grid.getRank() ][];
        for( int d = 0; d < axes.length; d++ ) { axes[d] = ArrayHelper.toDoubles( grid.getCenters().get( d ) ); }
        return axes;
    }

    /** Cell index to per-axis indices, the first axis varying fastest. */
    static int[] unravel( int cell, int[] shape ) {
        int[] idx = new int[ shape.length ];
        for( int d = 0; d < shape.length; d++ ) {
            idx[d] = cell % shape[d];
            cell /= shape[d];
        }
        return idx;
    }

    static int[] strides( int[] shape ) {
        int[] strides = new int[ shape.length ];
        int s = 1;
        for( int d = 0; d < shape.length; d++ ) {
            strides[d] = s;
            s *= shape[d];
        }
        return strides;
    }

    static double mod( double a, double m ) { return ( ( a % m ) + m ) % m; }

    static class WeightList {
        private final List<Double> values = new ArrayList<Double>();
        private final List<Integer> rows = new ArrayList<Integer>();
        private final List<Integer> cols = new ArrayList<Integer>();

        void add( double value, int row, int col ) {
            values.add( value );
            rows.add( row );
            cols.add( col );
        }

        boolean hasRow( int row ) { return rows.contains( row ); }

        Weights toWeights() {
            double[] v = new double[ values.size() ];
            int[] r = new int[ v.length ];
            int[] c = new int[ v.length ];
            for( int i = 0; i < v.length; i++ ) {
                v[i] = values.get( i );
                r[i] = rows.get( i );
                c[i] = cols.get( i );
            }
            return new Weights( v, r, c );
        }
    }
}
