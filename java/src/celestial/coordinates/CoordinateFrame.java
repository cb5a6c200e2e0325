package celestial.coordinates;

import celestial.time.JulianDate;

import java.io.Serializable;
import java.util.Objects;

/**
 * 坐标系
 *
 * 由类型、历元（春分点日期）和原点确定。FK4/FK5/黄道/地平坐标系必须给出历元，
 * ICRF 和银道坐标系不带历元。地平坐标系的历元即观测时刻，原点为观测者所在位置。
 */
public final class CoordinateFrame implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final CoordinateFrame ICRS = new CoordinateFrame(CoordinateFrameType.ICRF, null,
                                                                   CoordinateFrameOrigin.GEOCENTRIC);
    public static final CoordinateFrame GALACTIC = new CoordinateFrame(CoordinateFrameType.GALACTIC, null,
                                                                       CoordinateFrameOrigin.GEOCENTRIC);
    public static final CoordinateFrame B1900 = fk4(JulianDate.B1900);
    public static final CoordinateFrame B1950 = fk4(JulianDate.B1950);
    public static final CoordinateFrame J2000 = fk5(JulianDate.J2000);
    public static final CoordinateFrame J2050 = fk5(JulianDate.J2050);

    private final CoordinateFrameType type;
    private final JulianDate equinox;
    private final CoordinateFrameOrigin origin;

    /**
     * 创建坐标系
     *
     * @param type 坐标系类型
     * @param equinox 历元，ICRF 和银道坐标系必须为 null
     * @param origin 原点
     */
    public CoordinateFrame(CoordinateFrameType type, JulianDate equinox, CoordinateFrameOrigin origin) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(origin, "origin");
        if (type.isEquinoxRequired() && equinox == null) {
            throw new IllegalArgumentException("Frame type " + type + " requires an equinox");
        }
        if (!type.isEquinoxRequired() && equinox != null) {
            throw new IllegalArgumentException("Frame type " + type + " does not take an equinox");
        }
        if (type == CoordinateFrameType.HORIZONTAL && !origin.isTopocentric()) {
            throw new IllegalArgumentException("Horizontal frames require a topocentric origin");
        }
        this.type = type;
        this.equinox = equinox;
        this.origin = origin;
    }

    public static CoordinateFrame fk4(JulianDate equinox) {
        return new CoordinateFrame(CoordinateFrameType.FK4, equinox, CoordinateFrameOrigin.GEOCENTRIC);
    }

    public static CoordinateFrame fk5(JulianDate equinox) {
        return new CoordinateFrame(CoordinateFrameType.FK5, equinox, CoordinateFrameOrigin.GEOCENTRIC);
    }

    /**
     * 某日期的赤道坐标系（FK5，当日春分点）
     */
    public static CoordinateFrame equatorial(JulianDate date) {
        return fk5(date);
    }

    public static CoordinateFrame meanEcliptic(JulianDate equinox) {
        return new CoordinateFrame(CoordinateFrameType.MEAN_ECLIPTIC, equinox, CoordinateFrameOrigin.GEOCENTRIC);
    }

    public static CoordinateFrame trueEcliptic(JulianDate equinox) {
        return new CoordinateFrame(CoordinateFrameType.TRUE_ECLIPTIC, equinox, CoordinateFrameOrigin.GEOCENTRIC);
    }

    /**
     * 地平坐标系
     *
     * @param epoch 观测时刻
     * @param location 观测者位置
     */
    public static CoordinateFrame horizontal(JulianDate epoch, GeographicLocation location) {
        return new CoordinateFrame(CoordinateFrameType.HORIZONTAL, epoch, CoordinateFrameOrigin.topocentric(location));
    }

    /**
     * 类型和历元相同、原点不同的坐标系
     */
    public CoordinateFrame withOrigin(CoordinateFrameOrigin newOrigin) {
        if (origin.equals(newOrigin)) {
            return this;
        }
        return new CoordinateFrame(type, equinox, newOrigin);
    }

    public CoordinateFrameType getType() {
        return type;
    }

    /**
     * 历元，ICRF 和银道坐标系为 null
     */
    public JulianDate getEquinox() {
        return equinox;
    }

    public CoordinateFrameOrigin getOrigin() {
        return origin;
    }

    /**
     * 查询旋转角度表时使用的时刻：无历元的坐标系取 J2000
     */
    JulianDate getRotationEpoch() {
        return equinox == null ? JulianDate.J2000 : equinox;
    }

    /**
     * 简短标签，如 "ICRS"、"J2000.0"、"B1950.0"
     */
    public String getLabel() {
        if (equinox != null) {
            return equinox.toEpochLabel();
        }
        return type == CoordinateFrameType.ICRF ? "ICRS" : "Galactic";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoordinateFrame)) {
            return false;
        }
        CoordinateFrame that = (CoordinateFrame) o;
        return type == that.type && Objects.equals(equinox, that.equinox) && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, equinox, origin);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(type.name()).append(' ').append(getLabel());
        if (origin.getKind() != CoordinateFrameOrigin.Kind.GEOCENTRIC) {
            builder.append(' ').append(origin);
        }
        return builder.toString();
    }
}
