package nasa.nccs.regrid.engine.worker;

import nasa.nccs.regrid.engine.WeightEngineException;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;
import org.zeromq.SocketType;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * The Java end of a weight engine worker. Requests are pushed to the worker on one port; a result
 * thread pulls arrays, info and error messages back on the next port.
 */
public abstract class Worker {
    ZMQ.Socket request_socket = null;
    ConcurrentLinkedQueue<TransVar> results = null;
    ConcurrentLinkedQueue<String> messages = null;
    ResultThread resultThread = null;
    protected Logger logger = null;
    protected int result_port = -1;
    protected int request_port = -1;
    private final int pollMillis;
    private volatile String errorCondition = null;
    private boolean running = true;
    private String withData = "1";
    private long requestTime = 0;

    static int bindSocket( ZMQ.Socket socket, int init_port ) {
        int test_port = init_port;
        while( true ) {
            try {
                socket.bind( "tcp://*:" + String.valueOf( test_port ) );
                break;
            } catch ( ZMQException err ) {
                test_port = test_port + 1;
            }
        }
        return test_port;
    }

    public int id() { return request_port; }

    public int getRequestPort() { return request_port; }

    public int getResultPort() { return result_port; }

    private void postInfo( String info ) {
        logger.info( "Posting info from worker: " + info );
        messages.add( info );
    }

    private void addResult( String result_header, byte[] data ) {
        String elapsedTime = String.valueOf( ( System.currentTimeMillis() - requestTime ) / 1000.0 );
        logger.debug( "Caching result from worker: " + result_header + ", data size = " + data.length + ", Worker time = " + elapsedTime );
        results.add( new TransVar( result_header, data ) );
    }

    private void invalidateRequest( String errorMsg ) { errorCondition = errorMsg; }

    /** Whether the worker signalled an error since the last task request. */
    public boolean hasError() { return errorCondition != null; }

    /** Waits for the next array from the worker; a worker error aborts the wait. */
    public TransVar getResult() throws WeightEngineException {
        logger.debug( "Waiting for result to appear from worker" );
        while( true ) {
            if( errorCondition != null ) {
                throw new WeightEngineException( "Weight engine worker signalled error: " + errorCondition );
            }
            TransVar result = results.poll();
            if( result != null ) { return result; }
            try {
                Thread.sleep( pollMillis );
            } catch ( InterruptedException err ) {
                Thread.currentThread().interrupt();
                throw new WeightEngineException( "Interrupted waiting for the weight engine worker", err );
            }
        }
    }

    public String getMessage() throws WeightEngineException {
        logger.debug( "Waiting for message to be posted from worker" );
        while( errorCondition == null ) {
            String message = messages.poll();
            if( message != null ) { return message; }
            try {
                Thread.sleep( pollMillis );
            } catch ( InterruptedException err ) {
                Thread.currentThread().interrupt();
                throw new WeightEngineException( "Interrupted waiting for the weight engine worker", err );
            }
        }
        throw new WeightEngineException( "Weight engine worker signalled error: " + errorCondition );
    }

    public class ResultThread extends Thread {
        ZMQ.Socket result_socket = null;
        int port = -1;
        volatile boolean active = true;

        public ResultThread( int base_port, ZMQ.Context context ) {
            setDaemon( true );
            result_socket = context.socket( SocketType.PULL );
            result_socket.setReceiveTimeOut( pollMillis );
            port = bindSocket( result_socket, base_port );
        }

        public void run() {
            try {
                while( active ) {
                    byte[] message = result_socket.recv( 0 );
                    if( message == null ) { continue; }
                    String result_header = new String( message ).trim();
                    String[] parts = result_header.split( "[|]" );
                    logger.debug( "Received result header from worker: " + result_header );
                    String[] mtypes = parts[0].split( "[-]" );
                    String mtype = mtypes[0];
                    int mtlen = parts[0].length();
                    String pid = ( mtypes.length > 1 ) ? mtypes[1] : "?";
                    if( mtype.equals( "array" ) ) {
                        byte[] data = null;
                        while( active && data == null ) { data = result_socket.recv( 0 ); }
                        if( data != null ) { addResult( result_header, data ); }
                    } else if( mtype.equals( "info" ) ) {
                        postInfo( result_header.substring( mtlen + 1 ) );
                    } else if( mtype.equals( "error" ) ) {
                        String error = ( parts.length > 1 ) ? result_header.substring( mtlen + 1 ) : "unknown error";
                        logger.error( String.format( "Weight engine worker %s signaled error: %s", pid, error ) );
                        invalidateRequest( error );
                    } else {
                        logger.info( "Unknown result message type: " + parts[0] );
                    }
                }
            } catch ( ZMQException ex ) {
                logger.error( "Error in ResultThread: " + ex.toString() );
                invalidateRequest( "Result socket failed: " + ex.toString() );
            } finally {
                result_socket.close();
                logger.debug( "Result Socket closed." );
            }
        }

        public void term() { active = false; }
    }

    public Worker( ZMQ.Context context, Logger _logger, int basePort, int pollMillis ) {
        logger = _logger;
        this.pollMillis = pollMillis;
        results = new ConcurrentLinkedQueue<TransVar>();
        messages = new ConcurrentLinkedQueue<String>();
        request_socket = context.socket( SocketType.PUSH );
        request_socket.setLinger( 1000 );
        request_port = bindSocket( request_socket, basePort );
        resultThread = new ResultThread( request_port + 1, context );
        resultThread.start();
        result_port = resultThread.port;
        logger.info( String.format( "Starting Worker, ports: %d %d", request_port, result_port ) );
    }

    public void sendDataPacket( String header, byte[] data ) {
        logger.debug( "Sending header: " + header );
        request_socket.send( header.getBytes(), 0 );
        logger.debug( String.format( "Sending data, nbytes = %d", data.length ) );
        request_socket.send( data, 0 );
    }

    /** Asks the worker to exit and closes the sockets. Does nothing when already quit. */
    public synchronized void quit() {
        if( !running ) { return; }
        running = false;
        logger.debug( "Sending Quit request" );
        request_socket.send( "util|quit".getBytes(), 0 );
        resultThread.term();
        request_socket.close();
    }

    public void sendArrayData( String id, int[] shape, double[] values, Map<String, String> metadata ) {
        ByteBuffer buffer = ByteBuffer.allocate( 8 * values.length );
        for( double v: values ) { buffer.putDouble( v ); }
        metadata.put( TransVar.DTYPE, TransVar.FLOAT64 );
        _sendArrayData( id, new int[ shape.length ], shape, buffer.array(), metadata );
    }

    public void sendArrayData( String id, int[] shape, int[] values, Map<String, String> metadata ) {
        ByteBuffer buffer = ByteBuffer.allocate( 4 * values.length );
        for( int v: values ) { buffer.putInt( v ); }
        metadata.put( TransVar.DTYPE, TransVar.INT32 );
        _sendArrayData( id, new int[ shape.length ], shape, buffer.array(), metadata );
    }

    private void _sendArrayData( String id, int[] origin, int[] shape, byte[] data, Map<String, String> metadata ) {
        logger.debug( String.format( "Sending data to worker for input %s, nbytes=%d", id, data.length ) );
        List<String> slist = Arrays.asList( "array", id, ia2s( origin ), ia2s( shape ), m2s( metadata ), withData );
        String header = StringUtils.join( slist, "|" );
        sendDataPacket( header, data );
    }

    public void sendRequest( String operation, String[] opInputs, Map<String, String> metadata ) {
        List<String> slist = Arrays.asList( "task", operation, sa2s( opInputs ), m2s( metadata ) );
        String header = StringUtils.join( slist, "|" );
        logger.info( "Sending Task Request: " + header );
        requestTime = System.currentTimeMillis();
        errorCondition = null;
        results.clear();
        request_socket.send( header.getBytes(), 0 );
    }

    public void sendUtility( String request ) {
        List<String> slist = Arrays.asList( "util", request );
        String header = StringUtils.join( slist, "|" );
        logger.debug( "Sending Utility Request: " + header );
        request_socket.send( header.getBytes(), 0 );
    }

    public String getCapabilities() throws WeightEngineException {
        sendUtility( "capabilities" );
        return getMessage();
    }

    public String ia2s( int[] array ) { return Arrays.toString( array ).replaceAll( "\\[|\\]|\\s", "" ); }
    public String sa2s( String[] array ) { return StringUtils.join( array, "," ); }
    public String m2s( Map<String, String> metadata ) {
        ArrayList<String> items = new ArrayList<String>();
        for( Map.Entry<String, String> entry: metadata.entrySet() ) {
            items.add( entry.getKey() + ":" + entry.getValue() );
        }
        return StringUtils.join( items, ";" );
    }
}
