package celestial.ephemeris;

import celestial.time.JulianDate;
import org.orekit.errors.OrekitIllegalArgumentException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 星历时间序列
 *
 * 按时间严格递增、近似等间隔的样本表。构造后只读，可被多个线程共享而无需加锁。
 * 有效插值范围为 [t(4), t(n-4))：查询时刻两侧都需要足够的样本构成五点窗口。
 */
public final class EphemerisSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 有效范围两端各需保留的样本数 */
    static final int EDGE_SAMPLES = 4;

    private final String name;
    private final List<EphemerisSample> samples;
    private final double[] julianDays;

    /**
     * 创建星历序列
     *
     * @param name 序列名称（用于错误信息和日志）
     * @param samples 按时间严格递增的样本
     */
    public EphemerisSeries(String name, List<EphemerisSample> samples) {
        if (samples.isEmpty()) {
            throw new OrekitIllegalArgumentException(CelestialMessages.EMPTY_EPHEMERIS, name);
        }
        int columns = samples.get(0).getColumnCount();
        double[] days = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            EphemerisSample sample = samples.get(i);
            if (sample.getColumnCount() != columns) {
                throw new OrekitIllegalArgumentException(CelestialMessages.INCONSISTENT_EPHEMERIS_COLUMNS,
                                                         name, i, sample.getColumnCount(), columns);
            }
            days[i] = sample.getEpoch().getJulianDay();
            if (i > 0 && days[i] <= days[i - 1]) {
                throw new OrekitIllegalArgumentException(CelestialMessages.NON_INCREASING_EPHEMERIS_EPOCHS,
                                                         name, i);
            }
        }
        this.name = name;
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.julianDays = days;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return samples.size();
    }

    public EphemerisSample getSample(int index) {
        return samples.get(index);
    }

    public List<EphemerisSample> getSamples() {
        return samples;
    }

    public int getColumnCount() {
        return samples.get(0).getColumnCount();
    }

    double getJulianDay(int index) {
        return julianDays[index];
    }

    public JulianDate getFirstEpoch() {
        return samples.get(0).getEpoch();
    }

    public JulianDate getLastEpoch() {
        return samples.get(samples.size() - 1).getEpoch();
    }

    /**
     * 有效插值范围起点（含）
     */
    public double getFirstInterpolableJulianDay() {
        return julianDays[Math.min(EDGE_SAMPLES, julianDays.length - 1)];
    }

    /**
     * 有效插值范围终点（不含）
     */
    public double getLastInterpolableJulianDay() {
        if (julianDays.length <= 2 * EDGE_SAMPLES) {
            return getFirstInterpolableJulianDay();
        }
        return julianDays[julianDays.length - EDGE_SAMPLES];
    }

    public boolean isInterpolable(JulianDate epoch) {
        double jd = epoch.getJulianDay();
        return jd >= getFirstInterpolableJulianDay() && jd < getLastInterpolableJulianDay();
    }

    /**
     * 二分查找包围该时刻的样本下标
     *
     * @return 满足 t(i) <= t 的最大下标；时刻早于第一行时返回 -1。与样本时刻相等时返回该样本
     */
    public int findIndex(JulianDate epoch) {
        int position = Arrays.binarySearch(julianDays, epoch.getJulianDay());
        if (position >= 0) {
            return position;
        }
        return -position - 2;
    }

    /**
     * 插值得到该时刻的各列数值
     *
     * @throws EphemerisRangeException 时刻超出有效插值范围
     */
    public double[] interpolate(JulianDate epoch) {
        return BesselInterpolator.interpolate(this, epoch);
    }

    @Override
    public String toString() {
        return String.format("EphemerisSeries{%s, %d samples, JD %.5f - %.5f}",
            name, samples.size(), julianDays[0], julianDays[julianDays.length - 1]);
    }
}
