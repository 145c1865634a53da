package nasa.nccs.regrid.grid;

import nasa.nccs.regrid.RegridException;
import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Coordinate;
import nasa.nccs.regrid.cdm.Domain;
import nasa.nccs.regrid.cdm.DomainAxis;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.cdm.MaskedArray;
import nasa.nccs.regrid.cdm.SampleFields;
import nasa.nccs.regrid.engine.RegridMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ucar.ma2.ArrayBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class MaskExtractorTest {
    private final GridBuilder builder = new GridBuilder();
    private final MaskExtractor extractor = new MaskExtractor();

    @Test
    @DisplayName("Non-regrid dimensions are collapsed to their first element")
    void collapsesOtherDimensions() throws RegridException {
        Field f = SampleFields.spherical( "tas", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 30, 60, 6 ), false );
        SampleFields.addTime( f, 3 );
        f.setData( f.getData().withMasked( new int[]{ 0, 1, 2 }, new int[]{ 2, 3, 3 } ), f.getDataAxes() );
        GridDescriptor grid = builder.spherical( f, "source", RegridMethod.LINEAR, null, null );

        ArrayBoolean mask = extractor.extract( f, grid );

        assertThat( mask.getShape() ).containsExactly( 4, 6 );
        boolean[] values = ArrayHelper.toBooleans( mask );
        assertThat( values[ 1 * 6 + 2 ] ).isTrue();
        assertThat( values[ 3 * 6 + 3 ] ).isFalse();
        int count = 0;
        for( boolean v: values ) { if( v ) { count++; } }
        assertThat( count ).isEqualTo( 1 );
    }

    @Test
    @DisplayName("Data stored as (X, Y) gives a mask in grid (Y, X) order")
    void permutes() throws RegridException {
        Field f = new Field( "transposed" );
        String y = f.setDomainAxis( new DomainAxis( 2 ) );
        String x = f.setDomainAxis( new DomainAxis( 3 ) );
        f.setCoordinate( Coordinate.dimension( "latitude", "degrees_north", new double[]{ -30, 30 } ), y );
        f.setCoordinate( Coordinate.dimension( "longitude", "degrees_east", new double[]{ 0, 120, 240 } ), x );
        f.setData( MaskedArray.of( SampleFields.ramp( 6 ), 3, 2 ).withMasked( new int[]{ 2, 0 } ), x, y );
        GridDescriptor grid = builder.spherical( f, "source", RegridMethod.LINEAR, null, null );

        ArrayBoolean mask = extractor.extract( f, grid );

        assertThat( mask.getShape() ).containsExactly( 2, 3 );
        assertThat( ArrayHelper.toBooleans( mask ) ).containsExactly( false, false, true, false, false, false );
    }

    @Test
    @DisplayName("Domains and unmasked fields give an all false mask")
    void unmasked() throws RegridException {
        Field f = SampleFields.spherical( "tas", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 30, 60, 6 ), false );
        GridDescriptor grid = builder.spherical( f, "destination", RegridMethod.LINEAR, null, null );
        Domain domain = new Domain( "grid" );

        assertThat( ArrayHelper.any( extractor.extract( f, grid ) ) ).isFalse();
        assertThat( ArrayHelper.any( extractor.extract( domain, grid ) ) ).isFalse();
        assertThat( extractor.extract( f, grid ).getShape() ).containsExactly( 4, 6 );
    }
}
