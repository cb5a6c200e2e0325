package celestial.events;

import celestial.coordinates.SphericalCoordinates;
import celestial.time.JulianDate;

/**
 * 随时间变化的天体位置，可以是任意坐标系
 */
@FunctionalInterface
public interface PositionFunction {

    SphericalCoordinates positionAt(JulianDate epoch);
}
