package nasa.nccs.regrid.cdm;

public class FieldAncillary {
    private final String standardName;
    private final MaskedArray data;

    public FieldAncillary( String standardName, MaskedArray data ) {
        this.standardName = standardName;
        this.data = data;
    }

    public String getStandardName() { return standardName; }

    public MaskedArray getData() { return data; }

    public FieldAncillary copy() { return new FieldAncillary( standardName, data.copy() ); }

    public String toString() { return "Field ancillary: " + standardName; }
}
