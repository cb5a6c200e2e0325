package celestial.ephemeris;

import celestial.time.JulianDate;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 星历表中的一行：时刻 + 各列数值
 */
public final class EphemerisSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final JulianDate epoch;
    private final double[] values;

    public EphemerisSample(JulianDate epoch, double... values) {
        this.epoch = epoch;
        this.values = values.clone();
    }

    public JulianDate getEpoch() {
        return epoch;
    }

    public double getValue(int column) {
        return values[column];
    }

    public double[] getValues() {
        return values.clone();
    }

    public int getColumnCount() {
        return values.length;
    }

    @Override
    public String toString() {
        return "EphemerisSample{JD " + epoch.getJulianDay() + ", values=" + Arrays.toString(values) + '}';
    }
}
