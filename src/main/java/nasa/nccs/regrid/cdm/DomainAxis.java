package nasa.nccs.regrid.cdm;

import com.google.common.base.Preconditions;

public class DomainAxis {
    private int size;
    private String ncDimension;

    public DomainAxis( int size ) { this( size, null ); }

    public DomainAxis( int size, String ncDimension ) {
        setSize( size );
        this.ncDimension = ncDimension;
    }

    public int getSize() { return size; }

    public void setSize( int size ) {
        Preconditions.checkArgument( size > 0, "Domain axis size must be positive, got %s", size );
        this.size = size;
    }

    /** The netCDF dimension name, or {@code null}. */
    public String getNcDimension() { return ncDimension; }

    public void setNcDimension( String ncDimension ) { this.ncDimension = ncDimension; }

    public DomainAxis copy() { return new DomainAxis( size, ncDimension ); }

    public String toString() { return String.format( "DomainAxis: size=%d%s", size, ( ncDimension == null ) ? "" : ", ncdim=" + ncDimension ); }
}
