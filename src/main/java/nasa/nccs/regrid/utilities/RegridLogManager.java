package nasa.nccs.regrid.utilities;

import org.apache.log4j.Logger;

public class RegridLogManager {
    private static final String ROOT_LOGGER = "nasa.nccs.regrid";

    private RegridLogManager() { }

    public static Logger getCurrentLogger() { return Logger.getLogger( ROOT_LOGGER ); }

    public static Logger getLogger( Class<?> cls ) { return Logger.getLogger( cls ); }

    public static boolean isEngineLogging() { return RegridSettings.getInstance().isRegridLogging(); }
}
