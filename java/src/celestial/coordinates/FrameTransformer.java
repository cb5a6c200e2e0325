package celestial.coordinates;

import celestial.ephemeris.EphemerisContext;
import celestial.ephemeris.EphemerisRangeException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * 坐标系变换器
 *
 * 任意两个坐标系之间的旋转都经由银道坐标系中转：先转到银道坐标系，再转到目标坐标系。
 * 每个坐标系的旋转角由星历上下文中的旋转表插值得到，因此只需为每个坐标系保存一条路径。
 *
 * 只做旋转，不做原点平移；结果带有目标坐标系。需要平移时先使用 {@link OriginTranslator}。
 * 不修正光行时和光行差。
 *
 * 线程安全：只读访问星历上下文。
 */
public class FrameTransformer {

    private final EphemerisContext context;

    public FrameTransformer(EphemerisContext context) {
        this.context = context;
    }

    public EphemerisContext getContext() {
        return context;
    }

    /**
     * 变换直角坐标
     *
     * 源坐标系与目标坐标系相等时原样返回同一对象。
     *
     * @throws EphemerisRangeException 历元超出旋转表范围
     */
    public RectangularCoordinates transform(RectangularCoordinates coordinates, CoordinateFrame target) {
        if (coordinates.getFrame().equals(target)) {
            return coordinates;
        }
        Vector3D galactic = toGalactic(coordinates.toVector3D(), coordinates.getFrame());
        return new RectangularCoordinates(fromGalactic(galactic, target), target);
    }

    /**
     * 变换球面坐标，距离未知时按方向处理
     *
     * @throws EphemerisRangeException 历元超出旋转表范围
     */
    public SphericalCoordinates transform(SphericalCoordinates coordinates, CoordinateFrame target) {
        if (coordinates.getFrame().equals(target)) {
            return coordinates;
        }
        return transform(coordinates.toRectangular(), target).toSpherical();
    }

    /**
     * 两坐标的角距，第二个坐标先变换到第一个坐标的坐标系
     */
    public double angularSeparation(SphericalCoordinates first, SphericalCoordinates second) {
        return first.angularSeparation(transform(second, first.getFrame()));
    }

    /**
     * target 相对 reference 的位置角，reference 先变换到 target 的坐标系
     */
    public double positionAngle(SphericalCoordinates target, SphericalCoordinates reference) {
        return target.positionAngle(transform(reference, target.getFrame()));
    }

    Vector3D toGalactic(Vector3D vector, CoordinateFrame frame) {
        switch (frame.getType()) {
            case GALACTIC:
                return vector;
            case HORIZONTAL:
                return rotationFactors(frame).toGalactic(horizontalToEquatorial(vector, frame));
            default:
                return rotationFactors(frame).toGalactic(vector);
        }
    }

    Vector3D fromGalactic(Vector3D vector, CoordinateFrame frame) {
        switch (frame.getType()) {
            case GALACTIC:
                return vector;
            case HORIZONTAL:
                return equatorialToHorizontal(rotationFactors(frame).fromGalactic(vector), frame);
            default:
                return rotationFactors(frame).fromGalactic(vector);
        }
    }

    private RotationFactors rotationFactors(CoordinateFrame frame) {
        String table = frame.getType().getTableName();
        return new RotationFactors(context.getFrameTable(table).interpolate(frame.getRotationEpoch()));
    }

    /**
     * 当日赤道坐标 → 地平坐标（x 指北、y 指东、z 指天顶）
     */
    private static Vector3D equatorialToHorizontal(Vector3D equatorial, CoordinateFrame frame) {
        GeographicLocation location = frame.getOrigin().getLocation();
        double siderealTime = location.meanSiderealTime(frame.getEquinox());
        double tilt = location.getLatitude() - FastMath.PI / 2;

        Vector3D local = RotationFactors.rotateZ(equatorial, FastMath.cos(siderealTime), FastMath.sin(siderealTime), -1.0);
        local = RotationFactors.rotateY(local, FastMath.cos(tilt), FastMath.sin(tilt), 1.0);
        return new Vector3D(-local.getX(), local.getY(), local.getZ());
    }

    private static Vector3D horizontalToEquatorial(Vector3D horizontal, CoordinateFrame frame) {
        GeographicLocation location = frame.getOrigin().getLocation();
        double siderealTime = location.meanSiderealTime(frame.getEquinox());
        double tilt = location.getLatitude() - FastMath.PI / 2;

        Vector3D local = new Vector3D(-horizontal.getX(), horizontal.getY(), horizontal.getZ());
        local = RotationFactors.rotateY(local, FastMath.cos(tilt), FastMath.sin(tilt), -1.0);
        return RotationFactors.rotateZ(local, FastMath.cos(siderealTime), FastMath.sin(siderealTime), 1.0);
    }
}
