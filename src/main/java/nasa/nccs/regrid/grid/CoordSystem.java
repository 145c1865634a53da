package nasa.nccs.regrid.grid;

import nasa.nccs.regrid.ConfigurationException;

public enum CoordSystem {
    SPHERICAL( "spherical", "SPH_DEG" ),
    CARTESIAN( "Cartesian", "CART" );

    private final String tag;
    private final String engineCode;

    CoordSystem( String tag, String engineCode ) {
        this.tag = tag;
        this.engineCode = engineCode;
    }

    public String getTag() { return tag; }

    public String getEngineCode() { return engineCode; }

    public static CoordSystem parse( String tag ) throws ConfigurationException {
        for( CoordSystem cs: values() ) {
            if( cs.tag.equalsIgnoreCase( tag ) ) { return cs; }
        }
        throw new ConfigurationException( "Coordinate system must be 'spherical' or 'Cartesian', got: '" + tag + "'" );
    }

    public String toString() { return tag; }
}
