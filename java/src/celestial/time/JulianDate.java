package celestial.time;

import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.io.Serializable;
import java.time.Instant;

/**
 * 儒略日时刻
 *
 * 以儒略日（JD）表示的连续时间值，是星历插值的统一时间轴。
 * 不可变，可在线程间共享。
 */
public final class JulianDate implements Comparable<JulianDate>, Serializable {

    private static final long serialVersionUID = 1L;

    /** 1970-01-01 0h UTC 对应的儒略日 */
    private static final double JULIAN_DAY_UNIX_EPOCH = 2440587.5;

    private static final double JULIAN_DAY_J2000 = 2451545.0;
    private static final double JULIAN_DAY_B1900 = 2415020.3135;

    /** 贝塞尔年（回归年）长度（天） */
    public static final double BESSELIAN_YEAR_DAYS = 365.2421988;

    /** 儒略年长度（天） */
    public static final double JULIAN_YEAR_DAYS = Constants.JULIAN_YEAR / Constants.JULIAN_DAY;

    /** 一个恒星日对应的平太阳日数 */
    public static final double SIDEREAL_DAY_FRACTION = 0.9972695663;

    /** 半个恒星日对应的平太阳日数 */
    public static final double HALF_SIDEREAL_DAY_FRACTION = 0.4986347859;

    public static final JulianDate B1900 = new JulianDate(JULIAN_DAY_B1900);
    public static final JulianDate B1950 = new JulianDate(2433282.42344);
    public static final JulianDate J2000 = new JulianDate(JULIAN_DAY_J2000);
    public static final JulianDate J2050 = new JulianDate(2469807.5);

    private final double julianDay;

    /**
     * 创建儒略日时刻
     *
     * @param julianDay 儒略日
     */
    public JulianDate(double julianDay) {
        if (Double.isNaN(julianDay) || Double.isInfinite(julianDay)) {
            throw new IllegalArgumentException("Julian Day must be finite: " + julianDay);
        }
        this.julianDay = julianDay;
    }

    public static JulianDate ofJulianDay(double julianDay) {
        return new JulianDate(julianDay);
    }

    /**
     * 由儒略历元创建（如 2000.0 对应 J2000.0）
     */
    public static JulianDate ofJulianEpoch(double epoch) {
        return new JulianDate(JULIAN_DAY_J2000 + (epoch - 2000.0) * JULIAN_YEAR_DAYS);
    }

    /**
     * 由贝塞尔历元创建（如 1950.0 对应 B1950.0）
     */
    public static JulianDate ofBesselianEpoch(double epoch) {
        return new JulianDate(JULIAN_DAY_B1900 + (epoch - 1900.0) * BESSELIAN_YEAR_DAYS);
    }

    public static JulianDate fromInstant(Instant instant) {
        double days = instant.getEpochSecond() / Constants.JULIAN_DAY
                + instant.getNano() / (Constants.JULIAN_DAY * 1.0e9);
        return new JulianDate(JULIAN_DAY_UNIX_EPOCH + days);
    }

    public Instant toInstant() {
        double seconds = (julianDay - JULIAN_DAY_UNIX_EPOCH) * Constants.JULIAN_DAY;
        long whole = (long) FastMath.floor(seconds);
        long nanos = FastMath.round((seconds - whole) * 1.0e9);
        return Instant.ofEpochSecond(whole, nanos);
    }

    public double getJulianDay() {
        return julianDay;
    }

    /**
     * 儒略世纪数 T = (JD - 2451545.0) / 36525
     */
    public double getJulianCentury() {
        return (julianDay - JULIAN_DAY_J2000) * Constants.JULIAN_DAY / Constants.JULIAN_CENTURY;
    }

    public double getJulianEpoch() {
        return 2000.0 + (julianDay - JULIAN_DAY_J2000) / JULIAN_YEAR_DAYS;
    }

    public double getBesselianEpoch() {
        return 1900.0 + (julianDay - JULIAN_DAY_B1900) / BESSELIAN_YEAR_DAYS;
    }

    /**
     * 当前 UT 日期 0h 的儒略日
     */
    public double getJulianDayAtStartOfDayUT() {
        return FastMath.floor(julianDay - 0.5) + 0.5;
    }

    /**
     * 当前 UT 日期 0h
     */
    public JulianDate startOfDayUT() {
        return new JulianDate(getJulianDayAtStartOfDayUT());
    }

    /**
     * 距离最近的 0h UT（过了正午取下一个午夜，正午之前取上一个午夜）
     */
    public JulianDate midnightUT() {
        return new JulianDate(FastMath.rint(julianDay - 0.5) + 0.5);
    }

    /**
     * 当前日期的 12h UT
     */
    public JulianDate noonUT() {
        return new JulianDate(FastMath.rint(julianDay));
    }

    public JulianDate shiftedBy(double seconds) {
        return new JulianDate(julianDay + seconds / Constants.JULIAN_DAY);
    }

    public JulianDate shiftedByDays(double days) {
        return new JulianDate(julianDay + days);
    }

    /**
     * 与另一时刻的时间差（秒），this - other
     */
    public double durationFrom(JulianDate other) {
        return (julianDay - other.julianDay) * Constants.JULIAN_DAY;
    }

    public boolean isBefore(JulianDate other) {
        return julianDay < other.julianDay;
    }

    public boolean isAfter(JulianDate other) {
        return julianDay > other.julianDay;
    }

    /**
     * 标准历元的标签，如 "J2000.0"、"B1950.0"；其余时刻按儒略历元给出
     */
    public String toEpochLabel() {
        if (this.equals(J2000)) {
            return "J2000.0";
        } else if (this.equals(J2050)) {
            return "J2050.0";
        } else if (this.equals(B1900)) {
            return "B1900.0";
        } else if (this.equals(B1950)) {
            return "B1950.0";
        }
        return String.format("J%.4f", getJulianEpoch());
    }

    @Override
    public int compareTo(JulianDate other) {
        return Double.compare(julianDay, other.julianDay);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JulianDate)) {
            return false;
        }
        return Double.compare(julianDay, ((JulianDate) o).julianDay) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(julianDay);
    }

    @Override
    public String toString() {
        return toInstant() + " (JD " + julianDay + ")";
    }
}
