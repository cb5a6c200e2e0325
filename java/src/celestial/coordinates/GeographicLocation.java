package celestial.coordinates;

import celestial.time.JulianDate;
import celestial.time.SiderealTime;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.GeodeticPoint;

import java.io.Serializable;
import java.util.Objects;

/**
 * 地理位置
 *
 * 地球表面上的观测点：纬度、经度（弧度，北纬、东经为正）和可选海拔（米）。
 * 不可变值类型。
 */
public final class GeographicLocation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double latitude;    // 弧度
    private final double longitude;   // 弧度，东经为正
    private final Double elevation;   // 米，可为 null

    public GeographicLocation(double latitude, double longitude) {
        this(latitude, longitude, null);
    }

    /**
     * 创建地理位置
     *
     * @param latitude 纬度（弧度），范围 [-π/2, π/2]
     * @param longitude 经度（弧度），东经为正
     * @param elevation 海拔（米），未知时为 null
     */
    public GeographicLocation(double latitude, double longitude, Double elevation) {
        if (!(latitude >= -FastMath.PI / 2 && latitude <= FastMath.PI / 2)) {
            throw new IllegalArgumentException("Latitude out of range [-pi/2, pi/2]: " + latitude);
        }
        if (Double.isNaN(longitude) || Double.isInfinite(longitude)) {
            throw new IllegalArgumentException("Longitude must be finite: " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
    }

    /**
     * 由角度创建
     *
     * @param latitude 纬度（度）
     * @param longitude 经度（度）
     */
    public static GeographicLocation ofDegrees(double latitude, double longitude) {
        return new GeographicLocation(FastMath.toRadians(latitude), FastMath.toRadians(longitude));
    }

    public static GeographicLocation ofDegrees(double latitude, double longitude, double elevation) {
        return new GeographicLocation(FastMath.toRadians(latitude), FastMath.toRadians(longitude), elevation);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public Double getElevation() {
        return elevation;
    }

    public boolean hasElevation() {
        return elevation != null;
    }

    /**
     * 转换为 Orekit 大地坐标点（海拔未知时取 0）
     */
    public GeodeticPoint toGeodeticPoint() {
        return new GeodeticPoint(latitude, longitude, elevation == null ? 0.0 : elevation);
    }

    /**
     * 该地点在某时刻的地方平恒星时（弧度）
     */
    public double meanSiderealTime(JulianDate date) {
        return SiderealTime.meanLocal(date, longitude);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeographicLocation)) {
            return false;
        }
        GeographicLocation that = (GeographicLocation) o;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Objects.equals(elevation, that.elevation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, elevation);
    }

    @Override
    public String toString() {
        return String.format("GeographicLocation{lat=%.5f°, lon=%.5f°%s}",
            FastMath.toDegrees(latitude), FastMath.toDegrees(longitude),
            elevation == null ? "" : ", elevation=" + elevation + "m");
    }
}
