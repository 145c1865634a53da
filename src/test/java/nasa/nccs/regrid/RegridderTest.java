package nasa.nccs.regrid;

import nasa.nccs.regrid.cdm.ArrayHelper;
import nasa.nccs.regrid.cdm.Coordinate;
import nasa.nccs.regrid.cdm.DomainAncillary;
import nasa.nccs.regrid.cdm.Field;
import nasa.nccs.regrid.cdm.MaskedArray;
import nasa.nccs.regrid.cdm.SampleFields;
import nasa.nccs.regrid.engine.RecordingWeightEngine;
import nasa.nccs.regrid.engine.ReferenceWeightEngine;
import nasa.nccs.regrid.grid.CoordSystem;
import nasa.nccs.regrid.grid.GridSpec;
import nasa.nccs.regrid.operator.RegridOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RegridderTest {

    private static Field filled( Field f, double value ) {
        double[] values = new double[ (int) ArrayHelper.product( f.getData().getShape() ) ];
        Arrays.fill( values, value );
        f.setData( MaskedArray.of( values, f.getData().getShape() ), f.getDataAxes() );
        return f;
    }

    private static Field line( String name, double[] values ) {
        return SampleFields.cartesian( name, "x", "m", values, false );
    }

    private static RegridOptions.Builder cartesian( String method ) {
        return RegridOptions.builder().coordSystem( CoordSystem.CARTESIAN ).method( method ).axes( "x" );
    }

    private static RegridOptions.Builder spherical( String method ) {
        return RegridOptions.builder().method( method );
    }

    @Nested
    @DisplayName("Spherical")
    class Spherical {

        @Test
        @DisplayName("conservative regridding of a cyclic 4x3 grid onto 8x6 preserves a constant field")
        void conservative() throws RegridException {
            ReferenceWeightEngine engine = new ReferenceWeightEngine();
            Field src = filled( SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), true ), 5.0 );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -75, 30, 6 ), SampleFields.centres( 22.5, 45, 8 ), true );

            Field result = new Regridder( engine ).regrid( src, dst, spherical( "conservative" ).srcCyclic( Boolean.TRUE ).dstCyclic( Boolean.TRUE ).build() );

            assertThat( result.getData().getShape() ).containsExactly( 6, 8 );
            assertThat( result.getData().isMasked() ).isFalse();
            for( double v: ArrayHelper.toDoubles( result.getData().getData() ) ) { assertThat( v ).isCloseTo( 5.0, within( 1e-9 ) ); }
            assertThat( result.isCyclic( result.getDataAxes().get( 1 ) ) ).isTrue();
            assertThat( engine.getDestroyed() ).isEqualTo( 1 );
        }

        @Test
        @DisplayName("the source field is left untouched")
        void sourceUnchanged() throws RegridException {
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 45, 8 ), false );

            new Regridder( new ReferenceWeightEngine() ).regrid( src, dst, spherical( "linear" ).build() );

            assertThat( src.getData().getShape() ).containsExactly( 3, 4 );
            assertThat( ArrayHelper.toDoubles( src.getData().getData() ) ).containsExactly( SampleFields.ramp( 12 ) );
            assertThat( src.getDomainAxis( src.getDataAxes().get( 0 ) ).getSize() ).isEqualTo( 3 );
        }

        @Test
        @DisplayName("a grid specification can be the destination")
        void gridSpec() throws RegridException {
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            SampleFields.addTime( src, 2 );
            GridSpec spec = GridSpec.spherical( Coordinate.dimension( "latitude", "degrees_north", SampleFields.centres( -45, 30, 4 ) ),
                    Coordinate.dimension( "longitude", "degrees_east", SampleFields.centres( 0, 45, 8 ) ) );

            Field result = new Regridder( new ReferenceWeightEngine() ).regrid( src, spec, spherical( "linear" ).srcCyclic( Boolean.TRUE ).build() );

            assertThat( result.getData().getShape() ).containsExactly( 2, 4, 8 );
            assertThat( result.getData().isMasked() ).isFalse();
        }

        @Test
        @DisplayName("domain ancillaries spanning the grid are regridded with it")
        void domainAncillary() throws RegridException {
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            String key = src.setDomainAncillary( new DomainAncillary( "surface_altitude", "m", ArrayHelper.fromDoubles( new double[ 12 ], 3, 4 ), null ),
                    src.getDataAxes().get( 0 ), src.getDataAxes().get( 1 ) );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 45, 8 ), false );

            Field result = new Regridder( new ReferenceWeightEngine() ).regrid( src, dst, spherical( "linear" ).build() );

            assertThat( result.getDomainAncillaries().get( key ).getData().getShape() ).containsExactly( 4, 8 );
        }

        @Test
        @DisplayName("a returned operator regrids later fields without new weights")
        void reuse() throws RegridException {
            ReferenceWeightEngine engine = new ReferenceWeightEngine();
            Regridder regridder = new Regridder( engine );
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 45, 8 ), false );

            RegridResult built = regridder.execute( src, dst, spherical( "linear" ).returnOperator( true ).build() );
            assertThat( built.hasField() ).isFalse();
            RegridOperator operator = built.getOperator();

            Field direct = regridder.regrid( src, dst, spherical( "linear" ).build() );
            Field reused = regridder.regrid( src, operator, spherical( "linear" ).checkCoordinates( true ).build() );

            assertThat( engine.getOpened() ).isEqualTo( 2 );
            assertThat( Arrays.equals( ArrayHelper.toDoubles( reused.getData().getData() ), ArrayHelper.toDoubles( direct.getData().getData() ) ) ).isTrue();

            Field other = SampleFields.spherical( "other", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 36, 72, 5 ), false );
            assertThatThrownBy( () -> regridder.regrid( other, operator, spherical( "linear" ).build() ) ).isInstanceOf( OperatorReuseException.class );
        }
    }

    @Nested
    @DisplayName("Masks")
    class Masks {

        @Test
        @DisplayName("linear results are masked only where every contributor is masked")
        void linear() throws RegridException {
            Field src = line( "src", SampleFields.ramp( 4 ) );
            src.setData( src.getData().withMasked( new int[]{ 1 }, new int[]{ 2 } ), src.getDataAxes() );
            Field dst = line( "dst", SampleFields.centres( 0.5, 1.0, 3 ) );

            Field result = new Regridder( new ReferenceWeightEngine() ).regrid( src, dst, cartesian( "linear" ).build() );

            assertThat( ArrayHelper.toBooleans( result.getData().getMaskArray() ) ).containsExactly( false, true, false );
            assertThat( result.getData().getDouble( 0 ) ).isCloseTo( 0.0, within( 1e-12 ) );
            assertThat( result.getData().getDouble( 2 ) ).isCloseTo( 3.0, within( 1e-12 ) );
        }

        @Test
        @DisplayName("patch weights are derived with the source mask, which later data must share")
        void patch() throws RegridException {
            RecordingWeightEngine engine = RecordingWeightEngine.identity();
            Regridder regridder = new Regridder( engine );
            Field src = SampleFields.spherical( "src", SampleFields.centres( -45, 90, 2 ), SampleFields.centres( 60, 120, 3 ), false );
            src.setData( src.getData().withMasked( new int[]{ 0, 1 } ), src.getDataAxes() );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 90, 2 ), SampleFields.centres( 60, 120, 3 ), false );

            RegridOperator operator = regridder.buildOperator( src, dst, spherical( "patch" ).build() );

            assertThat( engine.lastSource().getMask() ).containsExactly( 1, 0, 1, 1, 1, 1 );
            assertThat( regridder.regrid( src, operator, spherical( "patch" ).build() ).getData().isMasked( 0, 1 ) ).isTrue();
            Field unmasked = SampleFields.spherical( "src", SampleFields.centres( -45, 90, 2 ), SampleFields.centres( 60, 120, 3 ), false );
            assertThatThrownBy( () -> regridder.regrid( unmasked, operator, spherical( "patch" ).build() ) )
                    .isInstanceOf( UnsupportedMaskVariationException.class );
        }

        @Test
        @DisplayName("nearest_stod can't regrid a mask that changes over time")
        void nearestStodVaryingMask() {
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            SampleFields.addTime( src, 2 );
            src.setData( src.getData().withMasked( new int[]{ 1, 0, 0 } ), src.getDataAxes() );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 45, 8 ), false );

            assertThatThrownBy( () -> new Regridder( new ReferenceWeightEngine() ).regrid( src, dst, spherical( "nearest_stod" ).build() ) )
                    .isInstanceOf( UnsupportedMaskVariationException.class );
        }

        @Test
        @DisplayName("ignoring the source mask is only allowed for nearest_stod")
        void useSrcMask() throws RegridException {
            Field src = SampleFields.spherical( "src", SampleFields.centres( -60, 60, 3 ), SampleFields.centres( 45, 90, 4 ), false );
            Field dst = SampleFields.spherical( "dst", SampleFields.centres( -45, 30, 4 ), SampleFields.centres( 0, 45, 8 ), false );
            Regridder regridder = new Regridder( new ReferenceWeightEngine() );

            assertThatThrownBy( () -> regridder.regrid( src, dst, spherical( "linear" ).useSrcMask( false ).build() ) )
                    .isInstanceOf( ConfigurationException.class );
            assertThat( regridder.regrid( src, dst, spherical( "nearest_stod" ).useSrcMask( false ).build() ).getData().getShape() )
                    .containsExactly( 4, 8 );
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {
        private final Regridder regridder = new Regridder( new ReferenceWeightEngine() );
        private final Field src = line( "src", SampleFields.ramp( 4 ) );
        private final Field dst = line( "dst", SampleFields.centres( 0.5, 1.0, 3 ) );

        @Test
        @DisplayName("Cartesian regridding needs between 1 and 3 axes")
        void cartesianAxes() {
            RegridOptions none = RegridOptions.builder().coordSystem( CoordSystem.CARTESIAN ).method( "linear" ).build();
            RegridOptions four = cartesian( "linear" ).axes( "x", "y", "z", "t" ).build();
            assertThatThrownBy( () -> regridder.regrid( src, dst, none ) ).isInstanceOf( ConfigurationException.class );
            assertThatThrownBy( () -> regridder.regrid( src, dst, four ) ).isInstanceOf( ConfigurationException.class );
        }

        @Test
        @DisplayName("an unknown method is rejected")
        void unknownMethod() {
            assertThatThrownBy( () -> regridder.regrid( src, dst, cartesian( "cubic" ).build() ) )
                    .isInstanceOf( ConfigurationException.class )
                    .hasMessageContaining( "cubic" );
        }

        @Test
        @DisplayName("1-d Cartesian regridding interpolates along the axis")
        void cartesian1d() throws RegridException {
            Field result = regridder.regrid( src, dst, cartesian( "linear" ).build() );
            assertThat( ArrayHelper.toDoubles( result.getData().getData() ) ).containsExactly( new double[]{ 0.5, 1.5, 2.5 }, within( 1e-12 ) );
        }

        @Test
        @DisplayName("1-d Cartesian regridding onto more cells than the source fills every one")
        void cartesian1dRefined() throws RegridException {
            Field fine = line( "fine", SampleFields.centres( 0.0, 0.5, 6 ) );
            Field result = regridder.regrid( src, fine, cartesian( "linear" ).build() );
            assertThat( result.getData().getShape() ).containsExactly( 6 );
            assertThat( result.getData().isMasked() ).isFalse();
            assertThat( ArrayHelper.toDoubles( result.getData().getData() ) ).containsExactly( new double[]{ 0.0, 0.5, 1.0, 1.5, 2.0, 2.5 }, within( 1e-12 ) );
        }

        @Test
        @DisplayName("a grid specification must use the requested coordinate system")
        void gridSpecSystem() {
            GridSpec spec = GridSpec.spherical( Coordinate.dimension( "latitude", "degrees_north", SampleFields.centres( -45, 30, 4 ) ),
                    Coordinate.dimension( "longitude", "degrees_east", SampleFields.centres( 0, 45, 8 ) ) );
            assertThatThrownBy( () -> regridder.regrid( src, spec, cartesian( "linear" ).build() ) ).isInstanceOf( ConfigurationException.class );
        }
    }
}
