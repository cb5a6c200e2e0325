package celestial.events;

import celestial.coordinates.CoordinateFrame;
import celestial.coordinates.FrameTransformer;
import celestial.coordinates.GeographicLocation;
import celestial.coordinates.SphericalCoordinates;
import celestial.time.JulianDate;
import celestial.time.SiderealTime;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * 升落中天单次计算
 *
 * 假定天体在当日保持给定位置不动。时角在恒星时中计算，换算为平太阳日时乘以
 * 恒星日长度 0.9972695663，时刻落在当日 0h UT 起算的一个恒星日之内。
 */
public class RiseTransitSetSolver {

    private final FrameTransformer transformer;

    public RiseTransitSetSolver(FrameTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * 将坐标变换到当日赤道坐标系后计算
     *
     * @param coordinates 天体坐标（任意坐标系）
     * @param date 日期（取其 UT 日期）
     * @param location 观测地点
     * @param angleBelowHorizon 升落判定高度在地平线下的角度（弧度）
     */
    public RiseTransitSet solve(SphericalCoordinates coordinates, JulianDate date,
                                GeographicLocation location, double angleBelowHorizon) {
        CoordinateFrame equatorial = CoordinateFrame.equatorial(date)
                                                    .withOrigin(coordinates.getFrame().getOrigin());
        return compute(transformer.transform(coordinates, equatorial), date, location, angleBelowHorizon);
    }

    /**
     * 由当日赤道坐标直接计算
     */
    public static RiseTransitSet compute(SphericalCoordinates equatorial, JulianDate date,
                                         GeographicLocation location, double angleBelowHorizon) {
        double rightAscension = equatorial.getLongitude();
        double declination = equatorial.getLatitude();
        double latitude = location.getLatitude();

        double jd0 = date.getJulianDayAtStartOfDayUT();
        double siderealAtMidnight = SiderealTime.meanAtGreenwichAtStartOfDay(date);

        // 中天时刻，以恒星日为单位
        double transitRevolutions = fraction((rightAscension - location.getLongitude() - siderealAtMidnight)
                                             / MathUtils.TWO_PI);
        double m0 = transitRevolutions * JulianDate.SIDEREAL_DAY_FRACTION;

        JulianDate rising = null;
        JulianDate setting = null;
        double cosH0 = (FastMath.sin(-angleBelowHorizon) - FastMath.sin(latitude) * FastMath.sin(declination))
                / (FastMath.cos(latitude) * FastMath.cos(declination));
        if (FastMath.abs(cosH0) <= 1.0) {
            double halfArc = FastMath.acos(cosH0) / MathUtils.TWO_PI;
            rising = JulianDate.ofJulianDay(jd0 + fraction(transitRevolutions - halfArc) * JulianDate.SIDEREAL_DAY_FRACTION);
            setting = JulianDate.ofJulianDay(jd0 + fraction(transitRevolutions + halfArc) * JulianDate.SIDEREAL_DAY_FRACTION);
        }

        double ma = m0 <= 0.5
                ? m0 + JulianDate.HALF_SIDEREAL_DAY_FRACTION
                : m0 - JulianDate.HALF_SIDEREAL_DAY_FRACTION;

        return new RiseTransitSet(rising, JulianDate.ofJulianDay(jd0 + m0),
                                  setting, JulianDate.ofJulianDay(jd0 + ma));
    }

    private static double fraction(double value) {
        double f = value - FastMath.floor(value);
        return f >= 1.0 ? 0.0 : f;
    }
}
