package nasa.nccs.regrid.engine.worker;

import nasa.nccs.regrid.engine.EngineGrid;
import nasa.nccs.regrid.engine.EngineSession;
import nasa.nccs.regrid.engine.RegridMethod;
import nasa.nccs.regrid.engine.UnmappedAction;
import nasa.nccs.regrid.engine.WeightEngineException;
import nasa.nccs.regrid.engine.Weights;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.log4j.Logger;
import ucar.ma2.Array;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends both grids to a worker, runs a {@code regrid} task and reads back the weight triple. The
 * worker replies with three arrays, {@code weights}, {@code row} and {@code col}, with 1-based
 * indices.
 */
public class WorkerSession implements EngineSession {
    public static final String REGRID_TASK = "regrid";
    public static final String WEIGHTS = "weights";
    public static final String ROW = "row";
    public static final String COL = "col";

    private static final Logger logger = RegridLogManager.getLogger( WorkerSession.class );
    private final RegridWorkerPortal portal;
    private Worker worker;
    private boolean failed = false;

    WorkerSession( RegridWorkerPortal portal, Worker worker ) {
        this.portal = portal;
        this.worker = worker;
    }

    public Weights computeWeights( EngineGrid src, EngineGrid dst, RegridMethod method, UnmappedAction unmappedAction,
                                   boolean ignoreDegenerate ) throws WeightEngineException {
        if( worker == null ) { throw new WeightEngineException( "Weight engine session has been destroyed" ); }
        List<String> inputs = new ArrayList<String>();
        inputs.addAll( sendGrid( "src", src ) );
        inputs.addAll( sendGrid( "dst", dst ) );
        Map<String, String> metadata = new LinkedHashMap<String, String>();
        metadata.put( "method", method.getEngineCode() );
        metadata.put( "unmapped", unmappedAction.name().toLowerCase() );
        metadata.put( "ignore_degenerate", String.valueOf( ignoreDegenerate ) );
        metadata.put( "coord_sys", src.getCoordSystem().getEngineCode() );
        metadata.put( "src_periodic", String.valueOf( src.isPeriodic() ) );
        metadata.put( "dst_periodic", String.valueOf( dst.isPeriodic() ) );
        metadata.put( "src_shape", worker.ia2s( src.getShape() ).replace( ',', 'x' ) );
        metadata.put( "dst_shape", worker.ia2s( dst.getShape() ).replace( ',', 'x' ) );
        metadata.put( "debug", RegridLogManager.isEngineLogging() ? "1" : "0" );
        worker.sendRequest( REGRID_TASK, inputs.toArray( new String[ inputs.size() ] ), metadata );
        try {
            return receiveWeights();
        } catch ( WeightEngineException ex ) {
            failed = true;
            throw ex;
        }
    }

    private Weights receiveWeights() throws WeightEngineException {
        Map<String, TransVar> results = new HashMap<String, TransVar>();
        while( results.size() < 3 ) {
            TransVar result = worker.getResult();
            results.put( result.id(), result );
        }
        for( String id: new String[] { WEIGHTS, ROW, COL } ) {
            if( !results.containsKey( id ) ) { throw new WeightEngineException( "Weight engine worker did not return '" + id + "', got " + results.keySet() ); }
        }
        double[] values = results.get( WEIGHTS ).getDoubles();
        int[] rows = toZeroBased( results.get( ROW ).getInts() );
        int[] cols = toZeroBased( results.get( COL ).getInts() );
        if( rows.length != values.length || cols.length != values.length ) {
            throw new WeightEngineException( String.format( "Weight engine worker returned inconsistent weights: %d values, %d rows, %d cols", values.length, rows.length, cols.length ) );
        }
        logger.debug( String.format( "Received %d weights from worker %d", values.length, worker.id() ) );
        return new Weights( values, rows, cols );
    }

    List<String> sendGrid( String prefix, EngineGrid grid ) {
        List<String> ids = new ArrayList<String>();
        for( int i = 0; i < grid.getRank(); i++ ) {
            String id = prefix + "_center_" + i;
            sendArray( id, grid.getCenters().get( i ) );
            ids.add( id );
        }
        if( grid.hasCorners() ) {
            for( int i = 0; i < grid.getRank(); i++ ) {
                String id = prefix + "_corner_" + i;
                sendArray( id, grid.getCorners().get( i ) );
                ids.add( id );
            }
        }
        int[] mask = grid.getMask();
        if( mask != null ) {
            String id = prefix + "_mask";
            worker.sendArrayData( id, new int[] { mask.length }, mask, new HashMap<String, String>() );
            ids.add( id );
        }
        return ids;
    }

    private void sendArray( String id, Array array ) {
        worker.sendArrayData( id, array.getShape(), ArrayHelper.toDoubles( array ), new HashMap<String, String>() );
    }

    static int[] toZeroBased( int[] indices ) {
        int[] result = new int[ indices.length ];
        for( int i = 0; i < indices.length; i++ ) { result[i] = indices[i] - 1; }
        return result;
    }

    /** Hands the worker back to the portal, which quits it if this session failed. */
    public void destroy() {
        if( worker == null ) { return; }
        Worker w = worker;
        worker = null;
        if( failed ) { logger.info( "Weight engine session failed on worker " + w.id() ); }
        portal.checkin( w, !failed );
    }
}
