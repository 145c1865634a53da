package nasa.nccs.regrid;

public class OperatorReuseException extends RegridException {
    public OperatorReuseException( String message ) { super( message ); }
}
