package celestial.events;

import celestial.bodies.BodyKind;
import celestial.coordinates.SphericalCoordinates;
import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * 各类天体的事件策略表
 *
 * 太阳：0°50′（折射加视半径），计算晨昏蒙影。
 * 月球：由地平视差 π = asin(R⊕/d) 动态计算，h0 = 0.7275π − 0°34′，去除下中天。
 * 行星：平均大气折射 0°34′，去除下中天。
 */
public final class EventPolicies {

    /** 太阳升落判定：地平线下 0°50′ */
    public static final double SUN_ANGLE_BELOW_HORIZON = FastMath.toRadians(50.0 / 60.0);

    /** 月球距离未知时使用的平均地月距离（米） */
    static final double MEAN_MOON_DISTANCE = 3.8440e8;

    private static final double MOON_REFRACTION_TERM = FastMath.toRadians(0.5667);
    private static final double MOON_PARALLAX_FACTOR = 0.7275;

    private static final Map<BodyKind, EventPolicy> POLICIES;

    static {
        Map<BodyKind, EventPolicy> policies = new EnumMap<>(BodyKind.class);
        policies.put(BodyKind.SUN, new EventPolicy(
            AngleBelowHorizonPolicy.fixed(SUN_ANGLE_BELOW_HORIZON), true,
            EnumSet.noneOf(AstronomicalEventType.class)));
        policies.put(BodyKind.MOON, new EventPolicy(
            EventPolicies::moonAngleBelowHorizon, false,
            EnumSet.of(AstronomicalEventType.LOWER_CULMINATION)));
        policies.put(BodyKind.PLANET, new EventPolicy(
            AngleBelowHorizonPolicy.fixed(SphericalCoordinates.MEAN_ATMOSPHERIC_REFRACTION), false,
            EnumSet.of(AstronomicalEventType.LOWER_CULMINATION)));
        POLICIES = Collections.unmodifiableMap(policies);
    }

    private EventPolicies() {
    }

    public static EventPolicy forKind(BodyKind kind) {
        return POLICIES.get(kind);
    }

    /**
     * 月球升落判定高度（地平线下角度，弧度）
     */
    public static double moonAngleBelowHorizon(SphericalCoordinates equatorial) {
        Double distance = equatorial.getDistance();
        double parallax = FastMath.asin(Constants.WGS84_EARTH_EQUATORIAL_RADIUS
                                        / (distance == null ? MEAN_MOON_DISTANCE : distance));
        return MOON_REFRACTION_TERM - MOON_PARALLAX_FACTOR * parallax;
    }
}
