package celestial.coordinates;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.io.Serializable;

/**
 * 直角坐标
 *
 * 单位为米。模长小于 {@link #MINIMUM_KNOWN_DISTANCE} 时视为距离未知，只表示方向。
 */
public final class RectangularCoordinates implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 低于此模长（米）距离视为未知；单位方向向量和地心占位向量都落在此范围内 */
    public static final double MINIMUM_KNOWN_DISTANCE = 1.1;

    private final double x;
    private final double y;
    private final double z;
    private final CoordinateFrame frame;

    public RectangularCoordinates(double x, double y, double z, CoordinateFrame frame) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.frame = frame;
    }

    public RectangularCoordinates(Vector3D vector, CoordinateFrame frame) {
        this(vector.getX(), vector.getY(), vector.getZ(), frame);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public CoordinateFrame getFrame() {
        return frame;
    }

    public Vector3D toVector3D() {
        return new Vector3D(x, y, z);
    }

    /**
     * 距离（米），小于 1.1 米时返回 null
     */
    public Double getDistance() {
        double d = norm();
        return d < MINIMUM_KNOWN_DISTANCE ? null : d;
    }

    public boolean isDistanceKnown() {
        return getDistance() != null;
    }

    private double norm() {
        return FastMath.sqrt(x * x + y * y + z * z);
    }

    public SphericalCoordinates toSpherical() {
        double d = norm();
        double latitude = d == 0.0 ? 0.0 : FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, z / d)));
        double longitude = FastMath.atan2(y, x);
        return new SphericalCoordinates(longitude, latitude, getDistance(), frame);
    }

    @Override
    public String toString() {
        Double distance = getDistance();
        if (distance == null) {
            return String.format("(%s)  (x=%.9f, y=%.9f, z=%.9f)", frame.getLabel(), x, y, z);
        }
        return String.format("(%s)  (x=%.3fm, y=%.3fm, z=%.3fm)  d = %.3fm", frame.getLabel(), x, y, z, distance);
    }
}
