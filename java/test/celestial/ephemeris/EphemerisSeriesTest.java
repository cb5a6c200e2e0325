package celestial.ephemeris;

import celestial.time.JulianDate;
import org.junit.jupiter.api.Test;
import org.orekit.errors.OrekitIllegalArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EphemerisSeriesTest {

    private static EphemerisSample sample(double julianDay, double... values) {
        return new EphemerisSample(JulianDate.ofJulianDay(julianDay), values);
    }

    @Test
    void rejectsNonIncreasingEpochs() {
        assertThatThrownBy(() -> new EphemerisSeries("bad", Arrays.asList(
                sample(1.0, 0.0), sample(2.0, 0.0), sample(2.0, 0.0))))
            .isInstanceOf(OrekitIllegalArgumentException.class)
            .hasMessageContaining("bad");
    }

    @Test
    void rejectsInconsistentColumnCounts() {
        assertThatThrownBy(() -> new EphemerisSeries("ragged", Arrays.asList(
                sample(1.0, 0.0, 1.0), sample(2.0, 0.0))))
            .isInstanceOf(OrekitIllegalArgumentException.class);
    }

    @Test
    void samples_areACopyInEpochOrder_andReadOnly() {
        List<EphemerisSample> source = new ArrayList<>(Arrays.asList(
            sample(1.0, 10.0), sample(2.0, 20.0), sample(3.0, 30.0)));
        EphemerisSeries series = new EphemerisSeries("copy", source);
        source.clear();

        assertThat(series.getSamples()).hasSize(3);
        assertThat(series.getSamples()).extracting(s -> s.getEpoch().getJulianDay())
                                       .containsExactly(1.0, 2.0, 3.0);
        assertThat(series.getSamples().get(2)).isSameAs(series.getSample(2));
        assertThatThrownBy(() -> series.getSamples().add(sample(4.0, 40.0)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsEmptySeries() {
        assertThatThrownBy(() -> new EphemerisSeries("empty", Collections.emptyList()))
            .isInstanceOf(OrekitIllegalArgumentException.class);
    }

    @Test
    void shortSeries_hasNoInterpolableRange() {
        EphemerisSeries series = new EphemerisSeries("short", Arrays.asList(
            sample(1.0, 1.0), sample(2.0, 2.0), sample(3.0, 3.0), sample(4.0, 4.0),
            sample(5.0, 5.0), sample(6.0, 6.0), sample(7.0, 7.0), sample(8.0, 8.0)));

        assertThat(series.isInterpolable(JulianDate.ofJulianDay(5.0))).isFalse();
        assertThatThrownBy(() -> series.interpolate(JulianDate.ofJulianDay(5.0)))
            .isInstanceOf(EphemerisRangeException.class);
    }

    @Test
    void samplesAreDefensivelyCopied() {
        double[] values = {1.0, 2.0};
        EphemerisSample sample = new EphemerisSample(JulianDate.J2000, values);
        values[0] = 99.0;
        sample.getValues()[1] = 99.0;

        assertThat(sample.getValues()).containsExactly(1.0, 2.0);
        assertThat(sample.getColumnCount()).isEqualTo(2);
    }
}
