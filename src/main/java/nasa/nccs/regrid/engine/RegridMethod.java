package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.ConfigurationException;
import nasa.nccs.regrid.utilities.RegridLogManager;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * The interpolation methods understood by the weight engine. Each constant carries the tag used on
 * the configuration surface and the method code sent to the ESMF worker.
 */
public enum RegridMethod {
    LINEAR( "linear", "BILINEAR" ),
    CONSERVATIVE_1ST( "conservative", "CONSERVE" ),
    CONSERVATIVE_2ND( "conservative_2nd", "CONSERVE_2ND" ),
    NEAREST_DTOS( "nearest_dtos", "NEAREST_DTOS" ),
    NEAREST_STOD( "nearest_stod", "NEAREST_STOD" ),
    PATCH( "patch", "PATCH" );

    private static final Logger logger = RegridLogManager.getLogger( RegridMethod.class );
    private final String tag;
    private final String engineCode;

    RegridMethod( String tag, String engineCode ) {
        this.tag = tag;
        this.engineCode = engineCode;
    }

    public String getTag() { return tag; }

    public String getEngineCode() { return engineCode; }

    public boolean isConservative() { return this == CONSERVATIVE_1ST || this == CONSERVATIVE_2ND; }

    /** Methods that interpolate between neighbouring source cells, so can't use a size 1 source axis. */
    public boolean requiresNeighbours() { return this == LINEAR || this == PATCH; }

    public static RegridMethod parse( String tag ) throws ConfigurationException {
        if( tag != null ) {
            String t = tag.trim();
            if( t.equals( "bilinear" ) ) {
                logger.info( "Note the 'bilinear' method argument has been renamed to 'linear'. " +
                        "It is still supported for now but please use 'linear' in future." );
                return LINEAR;
            }
            if( t.equals( "conservative_1st" ) ) { return CONSERVATIVE_1ST; }
            for( RegridMethod method: values() ) {
                if( method.tag.equals( t ) ) { return method; }
            }
        }
        throw new ConfigurationException( String.format( "Can't regrid: Must set a valid regridding method from (%s). Got: '%s'",
                StringUtils.join( validTags(), ", " ), tag ) );
    }

    public static List<String> validTags() {
        List<String> tags = new ArrayList<String>();
        for( RegridMethod method: values() ) { tags.add( method.tag ); }
        tags.add( "bilinear" );
        tags.add( "conservative_1st" );
        return tags;
    }

    public String toString() { return tag; }
}
