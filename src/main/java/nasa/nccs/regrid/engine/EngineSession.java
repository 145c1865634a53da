package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.RegridException;

/**
 * One acquisition of the weight engine. A session computes weights once and must then be destroyed,
 * which releases every grid, field and regrid handle the engine created for it.
 */
public interface EngineSession {

    Weights computeWeights( EngineGrid src, EngineGrid dst, RegridMethod method, UnmappedAction unmappedAction,
                            boolean ignoreDegenerate ) throws RegridException;

    /** Releases engine resources. Safe to call more than once and after a failed computation. */
    void destroy();
}
