package celestial.coordinates;

import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SphericalCoordinatesTest {

    private static SphericalCoordinates icrs(double longitude, double latitude) {
        return SphericalCoordinates.ofDegrees(longitude, latitude, CoordinateFrame.ICRS);
    }

    @Test
    void longitude_isNormalizedAndLatitudeClamped() {
        SphericalCoordinates coordinates = new SphericalCoordinates(-FastMath.PI / 2, 2.0, CoordinateFrame.ICRS);

        assertThat(coordinates.getLongitude()).isCloseTo(1.5 * FastMath.PI, within(1e-15));
        assertThat(coordinates.getLatitude()).isEqualTo(FastMath.PI / 2);
        assertThat(new SphericalCoordinates(2 * FastMath.PI, 0.0, CoordinateFrame.ICRS).getLongitude())
            .isEqualTo(0.0);
    }

    @Test
    void distance_mustBePositiveWhenKnown() {
        assertThatThrownBy(() -> new SphericalCoordinates(0.0, 0.0, 0.0, CoordinateFrame.ICRS))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SphericalCoordinates(0.0, 0.0, -1.0, CoordinateFrame.ICRS))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(icrs(0.0, 0.0).getDistance()).isNull();
    }

    @Test
    void rectangular_unitVectorWhenDistanceUnknown() {
        RectangularCoordinates rectangular = icrs(90.0, 0.0).toRectangular();

        assertThat(rectangular.getX()).isCloseTo(0.0, within(1e-15));
        assertThat(rectangular.getY()).isCloseTo(1.0, within(1e-15));
        assertThat(rectangular.getZ()).isCloseTo(0.0, within(1e-15));
        assertThat(rectangular.getDistance()).isNull();
        assertThat(rectangular.toSpherical().getDistance()).isNull();
    }

    @Test
    void rectangular_keepsDistanceWhenKnown() {
        SphericalCoordinates coordinates = new SphericalCoordinates(1.0, -0.4, 1.5e11, CoordinateFrame.J2000);

        SphericalCoordinates back = coordinates.toRectangular().toSpherical();

        assertThat(back.getDistance()).isCloseTo(1.5e11, within(1e-3));
        assertThat(back.getLongitude()).isCloseTo(1.0, within(1e-12));
        assertThat(back.getLatitude()).isCloseTo(-0.4, within(1e-12));
        assertThat(back.getFrame()).isEqualTo(CoordinateFrame.J2000);
    }

    @Test
    void shortVectors_haveUnknownDistance() {
        assertThat(new RectangularCoordinates(1.0, 0.0, 0.0, CoordinateFrame.ICRS).isDistanceKnown()).isFalse();
        assertThat(new RectangularCoordinates(1.2, 0.0, 0.0, CoordinateFrame.ICRS).getDistance())
            .isCloseTo(1.2, within(1e-15));
        assertThat(new RectangularCoordinates(0.0, 0.0, 0.0, CoordinateFrame.ICRS).toSpherical().getLatitude())
            .isEqualTo(0.0);
    }

    @Test
    void angularSeparation() {
        assertThat(icrs(0.0, 0.0).angularSeparation(icrs(90.0, 0.0))).isCloseTo(FastMath.PI / 2, within(1e-15));
        assertThat(icrs(0.0, 90.0).angularSeparation(icrs(123.0, -90.0))).isCloseTo(FastMath.PI, within(1e-15));
        assertThat(icrs(45.0, 30.0).angularSeparation(icrs(45.0, 30.0))).isEqualTo(0.0);
        // Arcturus - Spica
        assertThat(FastMath.toDegrees(icrs(213.9154, 19.1825).angularSeparation(icrs(201.2983, -11.1614))))
            .isCloseTo(32.7930, within(1e-4));
    }

    @Test
    void angularSeparation_requiresSameFrame() {
        SphericalCoordinates galactic = SphericalCoordinates.ofDegrees(0.0, 0.0, CoordinateFrame.GALACTIC);

        assertThatThrownBy(() -> icrs(0.0, 0.0).angularSeparation(galactic))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("different frames");
    }

    @Test
    void positionAngle_northAndEast() {
        SphericalCoordinates reference = icrs(10.0, 20.0);
        SphericalCoordinates north = icrs(10.0, 21.0);
        SphericalCoordinates onEquator = icrs(10.0, 0.0);
        SphericalCoordinates east = icrs(11.0, 0.0);

        assertThat(north.positionAngle(reference)).isCloseTo(0.0, within(1e-12));
        assertThat(reference.positionAngle(north)).isCloseTo(FastMath.PI, within(1e-12));
        assertThat(east.positionAngle(onEquator)).isCloseTo(FastMath.PI / 2, within(1e-12));
        assertThat(onEquator.positionAngle(east)).isCloseTo(1.5 * FastMath.PI, within(1e-12));
    }

    @Test
    void positionAngle_offMeridianPair_isNotReversedByHalfATurn() {
        SphericalCoordinates a = icrs(10.0, 45.0);
        SphericalCoordinates b = icrs(40.0, 50.0);

        double aFromB = FastMath.toDegrees(a.positionAngle(b));
        double bFromA = FastMath.toDegrees(b.positionAngle(a));

        // the great circle turns between the two points
        assertThat(aFromB).isCloseTo(267.6377, within(1e-3));
        assertThat(bFromA).isCloseTo(65.2669, within(1e-3));
        assertThat(aFromB - bFromA).isCloseTo(202.3709, within(1e-3));
    }

    @Test
    void circumpolarAndNeverRising() {
        GeographicLocation north = GeographicLocation.ofDegrees(52.0, 13.4);
        GeographicLocation south = GeographicLocation.ofDegrees(-34.0, 18.5);
        GeographicLocation equator = GeographicLocation.ofDegrees(0.0, 0.0);

        assertThat(icrs(0.0, 40.0).isCircumpolar(north)).isTrue();
        assertThat(icrs(0.0, 30.0).isCircumpolar(north)).isFalse();
        assertThat(icrs(0.0, -40.0).isNeverAboveHorizon(north)).isTrue();
        assertThat(icrs(0.0, -30.0).isNeverAboveHorizon(north)).isFalse();
        assertThat(icrs(0.0, -60.0).isCircumpolar(south)).isTrue();
        assertThat(icrs(0.0, 60.0).isNeverAboveHorizon(south)).isTrue();
        assertThat(icrs(0.0, 89.0).isCircumpolar(equator)).isFalse();
        assertThat(icrs(0.0, -89.0).isNeverAboveHorizon(equator)).isFalse();
    }

    @Test
    void toString_usesFrameSymbols() {
        assertThat(icrs(10.0, 20.0).toString()).isEqualTo("(ICRS)  α = 10.000000°  δ = 20.000000°");
        assertThat(SphericalCoordinates.ofDegrees(30.0, -5.0, CoordinateFrame.GALACTIC).toString())
            .isEqualTo("(Galactic)  l = 30.000000°  b = -5.000000°");
        assertThat(new SphericalCoordinates(0.0, 0.0, 2.5, CoordinateFrame.J2000).toString())
            .endsWith("  d = 2.500m");
    }
}
