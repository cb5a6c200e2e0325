package celestial.events;

import org.hipparchus.util.FastMath;

/**
 * 晨昏蒙影：太阳中心在地平线下的深度及对应的晨、昏事件类型
 */
public enum Twilight {

    CIVIL(6.0, AstronomicalEventType.CIVIL_DAWN, AstronomicalEventType.CIVIL_DUSK),
    NAUTICAL(12.0, AstronomicalEventType.NAUTICAL_DAWN, AstronomicalEventType.NAUTICAL_DUSK),
    ASTRONOMICAL(18.0, AstronomicalEventType.ASTRONOMICAL_DAWN, AstronomicalEventType.ASTRONOMICAL_DUSK);

    private final double depthDegrees;
    private final AstronomicalEventType dawn;
    private final AstronomicalEventType dusk;

    Twilight(double depthDegrees, AstronomicalEventType dawn, AstronomicalEventType dusk) {
        this.depthDegrees = depthDegrees;
        this.dawn = dawn;
        this.dusk = dusk;
    }

    /**
     * 地平线下深度（弧度）
     */
    public double getAngleBelowHorizon() {
        return FastMath.toRadians(depthDegrees);
    }

    public AstronomicalEventType getDawn() {
        return dawn;
    }

    public AstronomicalEventType getDusk() {
        return dusk;
    }

    /**
     * 将升起/落下重新标记为晨光/昏影，其余类型返回 null
     */
    AstronomicalEventType relabel(AstronomicalEventType type) {
        if (type == AstronomicalEventType.RISING) {
            return dawn;
        } else if (type == AstronomicalEventType.SETTING) {
            return dusk;
        }
        return null;
    }
}
