package celestial.ephemeris;

import org.hipparchus.exception.Localizable;

import java.util.Locale;

/**
 * 错误消息目录
 *
 * 与 OrekitMessages 的用法相同，作为 OrekitException 的消息说明符。
 */
public enum CelestialMessages implements Localizable {

    OUT_OF_RANGE_EPHEMERIS_DATE("epoch JD {0} is outside the interpolable range [{1}, {2}) of ephemeris {3}"),
    EVENT_REFINEMENT_DID_NOT_CONVERGE("refinement of {0} did not converge after {1} iterations (last candidate JD {2})"),
    UNABLE_TO_READ_EPHEMERIS("unable to read ephemeris {0}: {1}"),
    UNABLE_TO_PARSE_EPHEMERIS_LINE("unable to parse line {0} of ephemeris {1}: {2}"),
    MISSING_EPHEMERIS("no ephemeris registered for {0}"),
    NON_INCREASING_EPHEMERIS_EPOCHS("epochs of ephemeris {0} are not strictly increasing at row {1}"),
    INCONSISTENT_EPHEMERIS_COLUMNS("row {1} of ephemeris {0} has {2} values, expected {3}"),
    EMPTY_EPHEMERIS("ephemeris {0} contains no samples");

    private final String sourceFormat;

    CelestialMessages(String sourceFormat) {
        this.sourceFormat = sourceFormat;
    }

    @Override
    public String getSourceString() {
        return sourceFormat;
    }

    @Override
    public String getLocalizedString(Locale locale) {
        return sourceFormat;
    }
}
