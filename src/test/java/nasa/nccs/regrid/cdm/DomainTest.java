package nasa.nccs.regrid.cdm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainTest {
    private Field f;
    private String y;
    private String x;
    private String t;

    @BeforeEach
    void setUp() {
        f = SampleFields.spherical( "tas", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 60, 6 ), true );
        y = f.domainAxisKey( "Y" );
        x = f.domainAxisKey( "X" );
        t = SampleFields.addTime( f, 2 );
    }

    @Nested
    @DisplayName("Axis specifiers")
    class AxisSpecifiers {

        @Test
        @DisplayName("resolve keys, netCDF names and coordinate identities")
        void resolve() {
            assertThat( f.domainAxisKey( x ) ).isEqualTo( x );
            assertThat( f.domainAxisKey( "ncdim%lat" ) ).isEqualTo( y );
            assertThat( f.domainAxisKey( "longitude" ) ).isEqualTo( x );
            assertThat( f.domainAxisKey( "time" ) ).isEqualTo( t );
        }

        @Test
        @DisplayName("give null when nothing matches")
        void noMatch() {
            assertThat( f.domainAxisKey( "height" ) ).isNull();
            assertThat( f.domainAxisKey( "ncdim%depth" ) ).isNull();
            assertThat( f.domainAxisKey( null ) ).isNull();
        }
    }

    @Nested
    @DisplayName("Construct selection")
    class ConstructSelection {

        @Test
        @DisplayName("matches axes in OR, AND and SUBSET modes")
        void modes() {
            String area = f.setCellMeasure( new CellMeasure( "area", "m2", ArrayHelper.fromDoubles( new double[24], 4, 6 ) ), y, x );
            String flag = f.setFieldAncillary( new FieldAncillary( "status_flag", MaskedArray.of( new double[2], 2 ) ), t );

            assertThat( f.constructKeys( Collections.singletonList( x ), Domain.AxisMode.OR, Domain.ConstructType.CELL_MEASURE, Domain.ConstructType.FIELD_ANCILLARY ) )
                    .containsExactly( area );
            assertThat( f.constructKeys( Arrays.asList( y, x ), Domain.AxisMode.AND, Domain.ConstructType.CELL_MEASURE ) ).containsExactly( area );
            assertThat( f.constructKeys( Collections.singletonList( x ), Domain.AxisMode.AND, Domain.ConstructType.CELL_MEASURE ) ).containsExactly( area );
            assertThat( f.constructKeys( Collections.singletonList( x ), Domain.AxisMode.SUBSET, Domain.ConstructType.CELL_MEASURE ) ).isEmpty();
            assertThat( f.constructKeys( Collections.singletonList( t ), Domain.AxisMode.SUBSET, Domain.ConstructType.FIELD_ANCILLARY ) ).containsExactly( flag );
        }

        @Test
        @DisplayName("finds coordinates spanning regrid axes")
        void coordinates() {
            assertThat( f.coordinateKeys( Arrays.asList( y, x ), Domain.AxisMode.OR ) ).hasSize( 2 );
            assertThat( f.coordinateKeys( Collections.singletonList( t ), Domain.AxisMode.OR ) ).hasSize( 1 );
        }
    }

    @Test
    @DisplayName("Deleting a coordinate reference deletes its domain ancillaries")
    void deleteReference() {
        String orog = f.setDomainAncillary( new DomainAncillary( "surface_altitude", "m", ArrayHelper.fromDoubles( new double[24], 4, 6 ), null ), y, x );
        CoordinateReference ref = new CoordinateReference( "atmosphere_hybrid_height_coordinate" ).setDomainAncillary( "orog", orog );
        String refKey = f.setCoordinateReference( ref );

        f.delCoordinateReference( refKey );

        assertThat( f.getCoordinateReferences() ).isEmpty();
        assertThat( f.getDomainAncillaries() ).doesNotContainKey( orog );
        assertThat( f.hasConstruct( orog ) ).isFalse();
    }

    @Test
    @DisplayName("Constructs must match the sizes of the axes they span")
    void spanCheck() {
        assertThatThrownBy( () -> f.setCellMeasure( new CellMeasure( "area", "m2", ArrayHelper.fromDoubles( new double[6], 6 ) ), y ) )
                .isInstanceOf( IllegalArgumentException.class );
    }

    @Test
    @DisplayName("Copies are independent and keep cyclicity")
    void copy() {
        f.setCyclic( x, true, 360.0 );
        Field copy = f.copy();
        copy.getDomainAxis( x ).setSize( 12 );
        copy.setCyclic( x, false, 360.0 );

        assertThat( f.getDomainAxis( x ).getSize() ).isEqualTo( 6 );
        assertThat( f.isCyclic( x ) ).isTrue();
        assertThat( f.getPeriod( x ) ).isEqualTo( 360.0 );
        assertThat( copy.getData().getShape() ).containsExactly( 2, 4, 6 );
    }
}
