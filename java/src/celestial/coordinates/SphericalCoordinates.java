package celestial.coordinates;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * 球面坐标
 *
 * 经度归一化到 [0, 2π)，纬度截断到 [-π/2, π/2]（截断而非回绕，调用方需保证取值合理）。
 * 距离单位为米，未知时为 null，此时坐标只表示方向。
 */
public final class SphericalCoordinates implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 平均大气折射 0°34′（弧度） */
    public static final double MEAN_ATMOSPHERIC_REFRACTION = FastMath.toRadians(34.0 / 60.0);

    private final double longitude;
    private final double latitude;
    private final Double distance;
    private final CoordinateFrame frame;

    public SphericalCoordinates(double longitude, double latitude, CoordinateFrame frame) {
        this(longitude, latitude, null, frame);
    }

    /**
     * 创建球面坐标
     *
     * @param longitude 经度（弧度）
     * @param latitude 纬度（弧度）
     * @param distance 距离（米），未知时为 null
     * @param frame 坐标系
     */
    public SphericalCoordinates(double longitude, double latitude, Double distance, CoordinateFrame frame) {
        if (distance != null && !(distance > 0.0)) {
            throw new IllegalArgumentException("Distance must be positive: " + distance);
        }
        this.longitude = normalizeLongitude(longitude);
        this.latitude = FastMath.max(-FastMath.PI / 2, FastMath.min(FastMath.PI / 2, latitude));
        this.distance = distance;
        this.frame = Objects.requireNonNull(frame, "frame");
    }

    public static SphericalCoordinates ofDegrees(double longitude, double latitude, CoordinateFrame frame) {
        return new SphericalCoordinates(FastMath.toRadians(longitude), FastMath.toRadians(latitude), frame);
    }

    private static double normalizeLongitude(double angle) {
        double normalized = MathUtils.normalizeAngle(angle, FastMath.PI);
        return normalized >= MathUtils.TWO_PI ? 0.0 : normalized;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitudeDegrees() {
        return FastMath.toDegrees(longitude);
    }

    public double getLatitudeDegrees() {
        return FastMath.toDegrees(latitude);
    }

    /**
     * 距离（米），未知时为 null
     */
    public Double getDistance() {
        return distance;
    }

    public CoordinateFrame getFrame() {
        return frame;
    }

    /**
     * 转换为直角坐标；距离未知时按单位球处理
     */
    public RectangularCoordinates toRectangular() {
        double d = distance == null ? 1.0 : distance;
        double cosLat = FastMath.cos(latitude);
        return new RectangularCoordinates(cosLat * FastMath.cos(longitude) * d,
                                          cosLat * FastMath.sin(longitude) * d,
                                          FastMath.sin(latitude) * d,
                                          frame);
    }

    /**
     * 与同一坐标系中另一坐标的角距（弧度，[0, π]）
     *
     * 采用 atan2 形式，在角距很小或接近 π 时都保持精度。不同坐标系的坐标请使用
     * {@link FrameTransformer#angularSeparation(SphericalCoordinates, SphericalCoordinates)}。
     */
    public double angularSeparation(SphericalCoordinates other) {
        requireSameFrame(other);
        double deltaLon = other.longitude - longitude;
        double sinLat1 = FastMath.sin(latitude);
        double cosLat1 = FastMath.cos(latitude);
        double sinLat2 = FastMath.sin(other.latitude);
        double cosLat2 = FastMath.cos(other.latitude);
        double cosDelta = FastMath.cos(deltaLon);

        double a = cosLat2 * FastMath.sin(deltaLon);
        double b = cosLat1 * sinLat2 - sinLat1 * cosLat2 * cosDelta;
        double numerator = FastMath.sqrt(a * a + b * b);
        double denominator = sinLat1 * sinLat2 + cosLat1 * cosLat2 * cosDelta;
        return FastMath.atan2(numerator, denominator);
    }

    /**
     * 本坐标相对于参考坐标的位置角（弧度，[0, 2π)）
     *
     * 正北为 0，正东（经度增大方向）为 π/2。两坐标须在同一坐标系。
     */
    public double positionAngle(SphericalCoordinates reference) {
        requireSameFrame(reference);
        double deltaLon = longitude - reference.longitude;
        double y = FastMath.cos(latitude) * FastMath.sin(deltaLon);
        double x = FastMath.sin(latitude) * FastMath.cos(reference.latitude)
                - FastMath.cos(latitude) * FastMath.sin(reference.latitude) * FastMath.cos(deltaLon);
        return normalizeLongitude(FastMath.atan2(y, x));
    }

    /**
     * 在该地点是否永不落下（计入平均大气折射），纬度按赤纬处理
     */
    public boolean isCircumpolar(GeographicLocation location) {
        double phi = location.getLatitude();
        if (phi > 0.0) {
            return latitude >= FastMath.PI / 2 - phi - MEAN_ATMOSPHERIC_REFRACTION;
        } else if (phi < 0.0) {
            return latitude <= -FastMath.PI / 2 - phi + MEAN_ATMOSPHERIC_REFRACTION;
        }
        return false;
    }

    /**
     * 在该地点是否永不升起（计入平均大气折射），纬度按赤纬处理
     */
    public boolean isNeverAboveHorizon(GeographicLocation location) {
        double phi = location.getLatitude();
        if (phi > 0.0) {
            return latitude < -FastMath.PI / 2 + phi - MEAN_ATMOSPHERIC_REFRACTION;
        } else if (phi < 0.0) {
            return latitude > FastMath.PI / 2 + phi + MEAN_ATMOSPHERIC_REFRACTION;
        }
        return false;
    }

    private void requireSameFrame(SphericalCoordinates other) {
        if (!frame.equals(other.frame)) {
            throw new IllegalArgumentException("Coordinates are in different frames: "
                + frame + " and " + other.frame);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SphericalCoordinates)) {
            return false;
        }
        SphericalCoordinates that = (SphericalCoordinates) o;
        return Double.compare(longitude, that.longitude) == 0
                && Double.compare(latitude, that.latitude) == 0
                && Objects.equals(distance, that.distance)
                && frame.equals(that.frame);
    }

    @Override
    public int hashCode() {
        return Objects.hash(longitude, latitude, distance, frame);
    }

    @Override
    public String toString() {
        CoordinateFrameType type = frame.getType();
        String text = String.format(Locale.ROOT, "(%s)  %s = %.6f°  %s = %.6f°", frame.getLabel(),
            type.getLongitudeSymbol(), getLongitudeDegrees(), type.getLatitudeSymbol(), getLatitudeDegrees());
        if (distance != null) {
            text = text + String.format(Locale.ROOT, "  d = %.3fm", distance);
        }
        return text;
    }
}
