package celestial.time;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SiderealTimeTest {

    private static final double TOLERANCE = FastMath.toRadians(1.0e-5);

    @Test
    void meanSiderealTimeAtMidnight_1987April10() {
        JulianDate midnight = JulianDate.fromInstant(Instant.parse("1987-04-10T00:00:00Z"));

        // 13h10m46.3668s
        assertThat(SiderealTime.meanAtGreenwich(midnight)).isCloseTo(FastMath.toRadians(197.693195), within(TOLERANCE));
        assertThat(SiderealTime.meanAtGreenwichAtStartOfDay(midnight))
            .isCloseTo(FastMath.toRadians(197.693195), within(TOLERANCE));
    }

    @Test
    void meanSiderealTimeAtInstant_1987April10() {
        JulianDate evening = JulianDate.fromInstant(Instant.parse("1987-04-10T19:21:00Z"));

        // 8h34m57.0896s
        assertThat(SiderealTime.meanAtGreenwich(evening)).isCloseTo(FastMath.toRadians(128.737873), within(TOLERANCE));
        assertThat(SiderealTime.meanAtGreenwichAtStartOfDay(evening))
            .isCloseTo(FastMath.toRadians(197.693195), within(TOLERANCE));
    }

    @Test
    void localSiderealTime_addsEastLongitude_andStaysNormalized() {
        JulianDate evening = JulianDate.fromInstant(Instant.parse("1987-04-10T19:21:00Z"));
        double greenwich = SiderealTime.meanAtGreenwich(evening);

        double local = SiderealTime.meanLocal(evening, FastMath.toRadians(-150.0));

        assertThat(local).isBetween(0.0, MathUtils.TWO_PI);
        assertThat(local).isCloseTo(MathUtils.normalizeAngle(greenwich - FastMath.toRadians(150.0), FastMath.PI),
                                    within(1e-12));
    }

    @Test
    void normalize_wrapsIntoOneRevolution() {
        assertThat(SiderealTime.normalize(-FastMath.PI / 2)).isCloseTo(1.5 * FastMath.PI, within(1e-15));
        assertThat(SiderealTime.normalize(5 * FastMath.PI)).isCloseTo(FastMath.PI, within(1e-14));
        assertThat(SiderealTime.normalize(0.0)).isEqualTo(0.0);
    }
}
