package nasa.nccs.regrid.engine.worker;

import nasa.nccs.regrid.engine.EngineSession;
import nasa.nccs.regrid.engine.WeightEngine;
import nasa.nccs.regrid.engine.WeightEngineException;

/** A weight engine backed by a pool of worker processes; each session borrows one worker. */
public class WorkerWeightEngine implements WeightEngine {
    private final RegridWorkerPortal portal;

    public WorkerWeightEngine( RegridWorkerPortal portal ) { this.portal = portal; }

    public static WorkerWeightEngine getInstance() { return new WorkerWeightEngine( RegridWorkerPortal.getInstance() ); }

    public EngineSession open() throws WeightEngineException {
        return new WorkerSession( portal, portal.checkout() );
    }

    public RegridWorkerPortal getPortal() { return portal; }
}
