package celestial.coordinates;

import celestial.time.JulianDate;
import celestial.time.SiderealTime;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.frames.FramesFactory;
import org.orekit.utils.Constants;

/**
 * 坐标原点平移
 *
 * 在 ICRS 中做矢量加减：日心原点取星历上下文中太阳的地心位置，站心原点取 WGS-84
 * 椭球上观测点的位置（按格林尼治平恒星时旋转到当日赤道坐标系，再转到 ICRS）。
 * 距离未知的坐标只表示方向，平移后方向不变，只更换原点标签。
 */
public class OriginTranslator {

    /** 星历上下文中太阳位置表的名称 */
    public static final String SUN_TABLE = "sun";

    private final FrameTransformer transformer;
    private final OneAxisEllipsoid earth;

    public OriginTranslator(FrameTransformer transformer) {
        this.transformer = transformer;
        this.earth = new OneAxisEllipsoid(
            Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
            Constants.WGS84_EARTH_FLATTENING,
            FramesFactory.getGCRF()
        );
    }

    /**
     * 将坐标平移到另一原点，坐标系类型和历元保持不变
     *
     * @param coordinates 原坐标
     * @param target 目标原点
     * @param epoch 平移所对应的时刻（太阳位置和地球自转取该时刻）
     */
    public RectangularCoordinates translate(RectangularCoordinates coordinates,
                                            CoordinateFrameOrigin target,
                                            JulianDate epoch) {
        CoordinateFrame source = coordinates.getFrame();
        if (source.getOrigin().equals(target)) {
            return coordinates;
        }
        CoordinateFrame destination = source.withOrigin(target);
        if (!coordinates.isDistanceKnown()) {
            return new RectangularCoordinates(coordinates.toVector3D(), destination);
        }

        Vector3D icrs = transformer.transform(coordinates, CoordinateFrame.ICRS.withOrigin(source.getOrigin()))
                                   .toVector3D();
        Vector3D translated = icrs.add(geocentricPosition(source.getOrigin(), epoch))
                                  .subtract(geocentricPosition(target, epoch));
        RectangularCoordinates result = new RectangularCoordinates(translated, CoordinateFrame.ICRS.withOrigin(target));
        return transformer.transform(result, destination);
    }

    /**
     * 原点在 ICRS 中的地心位置（米）
     */
    public Vector3D geocentricPosition(CoordinateFrameOrigin origin, JulianDate epoch) {
        switch (origin.getKind()) {
            case HELIOCENTRIC:
                double[] sun = transformer.getContext().getBodyTable(SUN_TABLE).interpolate(epoch);
                return new Vector3D(sun[0], sun[1], sun[2]);
            case TOPOCENTRIC:
                return observerPosition(origin.getLocation(), epoch);
            default:
                return Vector3D.ZERO;
        }
    }

    /**
     * 观测点在 ICRS 中的地心位置（米）
     */
    public Vector3D observerPosition(GeographicLocation location, JulianDate epoch) {
        Vector3D bodyFixed = earth.transform(location.toGeodeticPoint());
        double gmst = SiderealTime.meanAtGreenwich(epoch);
        Vector3D ofDate = RotationFactors.rotateZ(bodyFixed, FastMath.cos(gmst), FastMath.sin(gmst), 1.0);
        return transformer.transform(new RectangularCoordinates(ofDate, CoordinateFrame.fk5(epoch)),
                                     CoordinateFrame.ICRS).toVector3D();
    }
}
