package nasa.nccs.regrid.engine.worker;

import nasa.nccs.regrid.engine.WeightEngineException;
import nasa.nccs.regrid.utilities.RegridLogManager;
import nasa.nccs.regrid.utilities.RegridSettings;
import org.apache.log4j.Logger;
import org.zeromq.ZMQ;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The weight engine worker processes. A weight engine session holds one worker from
 * {@link #checkout()} to {@link #checkin(Worker, boolean)}. Only a worker whose session ended
 * cleanly has its engine objects destroyed and serves a later session; any other is quit.
 */
public class RegridWorkerPortal {
    protected final ZMQ.Context zmqContext;
    protected final Logger logger = RegridLogManager.getCurrentLogger();
    private final Deque<Worker> idleWorkers = new ArrayDeque<Worker>();
    private final Set<Worker> sessionWorkers = new HashSet<Worker>();
    private boolean closed = false;

    protected RegridWorkerPortal() { zmqContext = ZMQ.context( 1 ); }

    private static class SingletonHelper {
        private static final RegridWorkerPortal INSTANCE = newInstance();
    }

    public static RegridWorkerPortal getInstance() {
        return RegridWorkerPortal.SingletonHelper.INSTANCE;
    }

    private static RegridWorkerPortal newInstance() {
        final RegridWorkerPortal portal = new RegridWorkerPortal();
        Runtime.getRuntime().addShutdownHook( new Thread( new Runnable() {
            public void run() { portal.shutdown(); }
        } ) );
        return portal;
    }

    protected Worker newWorker() throws WeightEngineException { return new RegridWorker( zmqContext, logger, RegridSettings.getInstance() ); }

    /** The most recently used idle worker, or a new one when none is idle. */
    public Worker checkout() throws WeightEngineException {
        Worker worker;
        synchronized( this ) {
            if( closed ) { throw new WeightEngineException( "The weight engine workers have been shut down" ); }
            worker = idleWorkers.pollFirst();
        }
        if( worker == null ) {
            worker = newWorker();
            logger.info( "Started weight engine worker " + worker.id() );
        }
        synchronized( this ) { sessionWorkers.add( worker ); }
        return worker;
    }

    /**
     * Ends the session holding {@code worker}. A worker checked in twice, or after shutdown, is
     * ignored after quitting it.
     */
    public void checkin( Worker worker, boolean reusable ) {
        boolean known;
        synchronized( this ) { known = sessionWorkers.remove( worker ); }
        if( known && reusable && !worker.hasError() ) {
            worker.sendUtility( "destroy" );
            synchronized( this ) {
                if( !closed ) {
                    idleWorkers.addFirst( worker );
                    return;
                }
            }
        }
        logger.info( "Quitting weight engine worker " + worker.id() );
        worker.quit();
    }

    public synchronized int getNumWorkers() { return idleWorkers.size() + sessionWorkers.size(); }

    public synchronized int getNumBusyWorkers() { return sessionWorkers.size(); }

    public String[] getCapabilities() throws WeightEngineException {
        Worker worker = checkout();
        boolean ok = false;
        try {
            String response = worker.getCapabilities();
            logger.info( "Weight engine capabilities: " + response );
            ok = true;
            return response.split( "[|]" );
        } finally {
            checkin( worker, ok );
        }
    }

    public void shutdown() {
        List<Worker> workers;
        synchronized( this ) {
            closed = true;
            workers = new ArrayList<Worker>( idleWorkers );
            workers.addAll( sessionWorkers );
            idleWorkers.clear();
            sessionWorkers.clear();
        }
        logger.info( String.format( "Shutting down %d weight engine workers", workers.size() ) );
        for( Worker worker: workers ) { worker.quit(); }
    }
}
