package celestial.ephemeris;

import celestial.time.JulianDate;
import org.orekit.errors.OrekitException;

/**
 * 星历范围错误
 *
 * 请求的时刻超出星历表可插值范围时抛出。不做外推，也不截断到边界。
 */
public class EphemerisRangeException extends OrekitException {

    private static final long serialVersionUID = 1L;

    private final String ephemerisName;
    private final JulianDate epoch;

    public EphemerisRangeException(String ephemerisName, JulianDate epoch,
                                   double firstValidJulianDay, double lastValidJulianDay) {
        super(CelestialMessages.OUT_OF_RANGE_EPHEMERIS_DATE,
              epoch.getJulianDay(), firstValidJulianDay, lastValidJulianDay, ephemerisName);
        this.ephemerisName = ephemerisName;
        this.epoch = epoch;
    }

    public String getEphemerisName() {
        return ephemerisName;
    }

    public JulianDate getEpoch() {
        return epoch;
    }
}
