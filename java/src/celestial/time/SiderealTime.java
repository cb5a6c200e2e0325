package celestial.time;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * 平恒星时
 *
 * 不考虑章动（因此为"平"恒星时），结果单位为弧度，范围 [0, 2π)。
 */
public final class SiderealTime {

    private SiderealTime() {
    }

    /**
     * 某时刻的格林尼治平恒星时
     */
    public static double meanAtGreenwich(JulianDate date) {
        double t = date.getJulianCentury();
        double degrees = 280.46061837
                + 360.98564736629 * (date.getJulianDay() - JulianDate.J2000.getJulianDay())
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        return normalize(FastMath.toRadians(degrees));
    }

    /**
     * 该时刻所在 UT 日期 0h 的格林尼治平恒星时
     */
    public static double meanAtGreenwichAtStartOfDay(JulianDate date) {
        double t = date.startOfDayUT().getJulianCentury();
        double degrees = 100.46061837
                + 36000.770053608 * t
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        return normalize(FastMath.toRadians(degrees));
    }

    /**
     * 地方平恒星时
     *
     * @param date 时刻
     * @param longitude 观测者经度（弧度，东经为正）
     */
    public static double meanLocal(JulianDate date, double longitude) {
        return normalize(meanAtGreenwich(date) + longitude);
    }

    static double normalize(double angle) {
        double normalized = MathUtils.normalizeAngle(angle, FastMath.PI);
        return normalized >= MathUtils.TWO_PI ? 0.0 : normalized;
    }
}
