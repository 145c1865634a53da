package nasa.nccs.regrid.cdm;

import ucar.ma2.Array;

public class CellMeasure {
    private final String measure;
    private final String units;
    private final Array data;

    public CellMeasure( String measure, String units, Array data ) {
        this.measure = measure;
        this.units = units;
        this.data = data;
    }

    public String getMeasure() { return measure; }

    public String getUnits() { return units; }

    public Array getData() { return data; }

    public CellMeasure copy() { return new CellMeasure( measure, units, data.copy() ); }

    public String toString() { return "Cell measure: " + measure; }
}
