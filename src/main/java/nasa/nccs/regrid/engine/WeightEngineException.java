package nasa.nccs.regrid.engine;

import nasa.nccs.regrid.RegridException;

public class WeightEngineException extends RegridException {
    public WeightEngineException( String message ) { super( message ); }

    public WeightEngineException( String message, Throwable cause ) { super( message, cause ); }
}
