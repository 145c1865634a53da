package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.ConfigurationException;

/** What the engine does with destination cells that no source cell maps to. */
public enum UnmappedAction {
    IGNORE, ERROR;

    public static UnmappedAction parse( String value ) throws ConfigurationException {
        if( value == null || value.equalsIgnoreCase( "ignore" ) ) { return IGNORE; }
        if( value.equalsIgnoreCase( "error" ) ) { return ERROR; }
        throw new ConfigurationException( "Unmapped action must be 'ignore' or 'error', got: '" + value + "'" );
    }
}
