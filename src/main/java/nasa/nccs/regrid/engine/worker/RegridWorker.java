package nasa.nccs.regrid.engine.worker;

import nasa.nccs.regrid.engine.WeightEngineException;
import nasa.nccs.regrid.utilities.RegridSettings;
import org.apache.log4j.Logger;
import org.zeromq.ZMQ;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * A worker backed by an ESMF weight engine process, started with the worker script and the two
 * port numbers as arguments.
 */
public class RegridWorker extends Worker {
    Process proc;

    public RegridWorker( ZMQ.Context context, Logger logger, RegridSettings settings ) throws WeightEngineException {
        super( context, logger, settings.getWorkerBasePort(), settings.getWorkerPollMillis() );
        proc = startup( settings.getWorkerScript() );
        logger.info( " *** Started worker process: " + proc.toString() );
    }

    Process startup( Path run_script ) throws WeightEngineException {
        try {
            FileSystem fileSystems = FileSystems.getDefault();
            Path log_dir = fileSystems.getPath( System.getProperty( "user.home" ), ".cdas", "logs" );
            Files.createDirectories( log_dir );
            Path log_path = log_dir.resolve( String.format( "regrid-worker-%d.log", request_port ) );
            ProcessBuilder pb = new ProcessBuilder( run_script.toString(), String.valueOf( request_port ), String.valueOf( result_port ) );
            Map<String, String> env = pb.environment();
            env.putAll( System.getenv() );
            pb.redirectErrorStream( true );
            pb.redirectOutput( ProcessBuilder.Redirect.appendTo( log_path.toFile() ) );
            logger.info( " *** Starting Regrid Worker: " + run_script + " --> request_port = " + String.valueOf( request_port ) + ", result_port = " + String.valueOf( result_port ) );
            return pb.start();
        } catch ( IOException ex ) {
            quit();
            throw new WeightEngineException( "Error starting Regrid Worker : " + ex.toString(), ex );
        }
    }

    @Override
    public synchronized void quit() {
        super.quit();
        if( proc != null ) { proc.destroy(); }
    }
}
