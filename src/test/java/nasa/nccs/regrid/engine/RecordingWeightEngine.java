package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.RegridException;

import java.util.ArrayList;
import java.util.List;

/** Records the grids and methods each session is asked for, then defers to another engine. */
public class RecordingWeightEngine implements WeightEngine {
    private final WeightEngine delegate;
    private final List<EngineGrid> sources = new ArrayList<EngineGrid>();
    private final List<EngineGrid> destinations = new ArrayList<EngineGrid>();
    private final List<RegridMethod> methods = new ArrayList<RegridMethod>();
    private int destroyed = 0;

    public RecordingWeightEngine( WeightEngine delegate ) { this.delegate = delegate; }

    /** An engine mapping cell i of the source to cell i of the destination, for equal shaped grids. */
    public static RecordingWeightEngine identity() {
        return new RecordingWeightEngine( new WeightEngine() {
            public EngineSession open() {
                return new EngineSession() {
                    public Weights computeWeights( EngineGrid src, EngineGrid dst, RegridMethod method, UnmappedAction unmappedAction, boolean ignoreDegenerate ) {
                        int n = Math.min( src.getSize(), dst.getSize() );
                        double[] values = new double[n];
                        int[] indices = new int[n];
                        for( int i = 0; i < n; i++ ) {
                            values[i] = 1.0;
                            indices[i] = i;
                        }
                        return new Weights( values, indices, indices );
                    }

                    public void destroy() { }
                };
            }
        } );
    }

    public EngineSession open() throws WeightEngineException {
        final EngineSession session = delegate.open();
        return new EngineSession() {
            public Weights computeWeights( EngineGrid src, EngineGrid dst, RegridMethod method, UnmappedAction unmappedAction,
                                           boolean ignoreDegenerate ) throws RegridException {
                sources.add( src );
                destinations.add( dst );
                methods.add( method );
                return session.computeWeights( src, dst, method, unmappedAction, ignoreDegenerate );
            }

            public void destroy() {
                destroyed++;
                session.destroy();
            }
        };
    }

    public EngineGrid lastSource() { return sources.get( sources.size() - 1 ); }

    public EngineGrid lastDestination() { return destinations.get( destinations.size() - 1 ); }

    public List<RegridMethod> getMethods() { return methods; }

    public int getCalls() { return sources.size(); }

    public int getDestroyed() { return destroyed; }
}
