package nasa.nccs.regrid.cdm;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A domain together with a masked data array whose dimensions span an ordered list of its domain
 * axes.
 */
public class Field extends Domain {
    private MaskedArray data;
    private List<String> dataAxes = ImmutableList.of();

    public Field( String name ) { super( name ); }

    public MaskedArray getData() { return data; }

    public List<String> getDataAxes() { return dataAxes; }

    public int getNdim() { return dataAxes.size(); }

    public void setData( MaskedArray data, String... axes ) { setData( data, Arrays.asList( axes ) ); }

    public void setData( MaskedArray data, List<String> axes ) {
        checkSpans( "data", data.getData(), axes );
        this.data = data;
        this.dataAxes = ImmutableList.copyOf( axes );
    }

    /** Appends a size 1 domain axis that the data does not yet span as a trailing data dimension. */
    public void insertDimension( String axisKey ) {
        if( dataAxes.contains( axisKey ) ) {
            throw new IllegalArgumentException( String.format( "Data of %s already spans axis %s", getName(), axisKey ) );
        }
        if( getDomainAxis( axisKey ).getSize() != 1 ) {
            throw new IllegalArgumentException( String.format( "Can't insert axis %s of size %d into data of %s", axisKey, getDomainAxis( axisKey ).getSize(), getName() ) );
        }
        int[] shape = data.getShape();
        int[] newShape = Arrays.copyOf( shape, shape.length + 1 );
        newShape[ shape.length ] = 1;
        List<String> axes = new ArrayList<String>( dataAxes );
        axes.add( axisKey );
        setData( data.reshape( newShape ), axes );
    }

    /**
     * A new field whose data is the named domain ancillary, on a copy of this field's domain.
     */
    public Field convertDomainAncillary( String key ) {
        DomainAncillary ancillary = getDomainAncillaries().get( key );
        if( ancillary == null ) { throw new IllegalArgumentException( String.format( "%s has no domain ancillary %s", getName(), key ) ); }
        Field field = new Field( ancillary.getStandardName() );
        copyInto( field );
        field.delConstruct( key );
        for( String faKey: new ArrayList<String>( field.getFieldAncillaries().keySet() ) ) { field.delConstruct( faKey ); }
        field.setData( new MaskedArray( ancillary.getData().copy() ), getConstructAxes( key ) );
        return field;
    }

    public Field copy() {
        Field field = new Field( getName() );
        copyInto( field );
        if( data != null ) { field.setData( data.copy(), dataAxes ); }
        return field;
    }

    public String toString() {
        return String.format( "<Field: %s%s>", getName(), ( data == null ) ? "" : ArrayHelper.shapeString( data.getShape() ) );
    }
}
