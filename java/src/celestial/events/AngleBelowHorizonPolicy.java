package celestial.events;

import celestial.coordinates.SphericalCoordinates;

/**
 * 升落判定高度：给出天体在当日赤道坐标下的位置，返回地平线下的角度（弧度）
 */
@FunctionalInterface
public interface AngleBelowHorizonPolicy {

    double angleBelowHorizon(SphericalCoordinates equatorial);

    static AngleBelowHorizonPolicy fixed(double angle) {
        return equatorial -> angle;
    }
}
