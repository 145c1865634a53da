package nasa.nccs.regrid.cdm;

import com.google.common.base.Preconditions;
import ucar.ma2.Array;

public class DomainAncillary {
    private final String standardName;
    private final String units;
    private final Array data;
    private final Array bounds;

    public DomainAncillary( String standardName, String units, Array data, Array bounds ) {
        Preconditions.checkNotNull( data, "data" );
        this.standardName = standardName;
        this.units = units;
        this.data = data;
        this.bounds = bounds;
    }

    public String getStandardName() { return standardName; }

    public String getUnits() { return units; }

    public Array getData() { return data; }

    public Array getBounds() { return bounds; }

    public DomainAncillary copy() {
        return new DomainAncillary( standardName, units, data.copy(), ( bounds == null ) ? null : bounds.copy() );
    }

    public String toString() { return String.format( "Domain ancillary: %s%s", standardName, ArrayHelper.shapeString( data.getShape() ) ); }
}
