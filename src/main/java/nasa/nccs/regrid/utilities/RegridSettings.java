package nasa.nccs.regrid.utilities;

import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Process-level settings. Values come from {@code regrid.properties} on the classpath and may be
 * overridden by Java system properties of the same name.
 */
public class RegridSettings {
    public static final String REGRID_LOGGING = "regrid.logging";
    public static final String WORKER_BASE_PORT = "regrid.worker.basePort";
    public static final String WORKER_SCRIPT = "regrid.worker.script";
    public static final String WORKER_POLL_MILLIS = "regrid.worker.pollMillis";
    public static final String HOME_DIR_ENV = "REGRID_HOME_DIR";

    private static final Logger logger = RegridLogManager.getLogger( RegridSettings.class );
    private final Properties properties;

    RegridSettings( Properties defaults ) {
        properties = new Properties();
        properties.putAll( defaults );
        for( String name: defaults.stringPropertyNames() ) {
            String override = System.getProperty( name );
            if( override != null ) { properties.setProperty( name, override ); }
        }
    }

    private static class SingletonHelper {
        private static final RegridSettings INSTANCE = new RegridSettings( loadDefaults() );
    }

    public static RegridSettings getInstance() { return SingletonHelper.INSTANCE; }

    static Properties loadDefaults() {
        Properties defaults = new Properties();
        defaults.setProperty( REGRID_LOGGING, "false" );
        defaults.setProperty( WORKER_BASE_PORT, "2336" );
        defaults.setProperty( WORKER_SCRIPT, "sbin/startup_regrid_worker.sh" );
        defaults.setProperty( WORKER_POLL_MILLIS, "100" );
        InputStream in = RegridSettings.class.getClassLoader().getResourceAsStream( "regrid.properties" );
        if( in != null ) {
            try {
                defaults.load( in );
            } catch ( IOException ex ) {
                logger.error( "Error reading regrid.properties: " + ex.toString() );
            } finally {
                try { in.close(); } catch ( IOException ex ) { logger.debug( "Error closing regrid.properties: " + ex.toString() ); }
            }
        }
        return defaults;
    }

    public String get( String name ) { return properties.getProperty( name ); }

    public boolean isRegridLogging() { return Boolean.parseBoolean( get( REGRID_LOGGING ) ); }

    public int getWorkerBasePort() { return getInt( WORKER_BASE_PORT ); }

    public int getWorkerPollMillis() { return getInt( WORKER_POLL_MILLIS ); }

    public Path getWorkerScript() {
        String home = System.getenv( HOME_DIR_ENV );
        if( home == null ) { return FileSystems.getDefault().getPath( System.getProperty("user.home"), ".cdas", get( WORKER_SCRIPT ) ); }
        return FileSystems.getDefault().getPath( home, get( WORKER_SCRIPT ) );
    }

    private int getInt( String name ) {
        String value = get( name );
        try {
            return Integer.parseInt( value.trim() );
        } catch ( NumberFormatException ex ) {
            throw new IllegalStateException( String.format( "Setting %s must be an integer, got '%s'", name, value ), ex );
        }
    }
}
