package celestial.ephemeris;

import celestial.time.JulianDate;
import org.hipparchus.util.FastMath;

/**
 * 五点贝塞尔插值
 *
 * 以离查询时刻最近的样本为中心取连续五个样本，对每一列独立地用一到四阶差分插值。
 * 在样本时刻上精确复现表值；超出有效范围时抛出 {@link EphemerisRangeException}，不外推。
 */
public final class BesselInterpolator {

    private BesselInterpolator() {
    }

    /**
     * 插值星历序列
     *
     * @param series 星历序列
     * @param epoch 查询时刻
     * @return 各列插值结果，列顺序与表一致
     * @throws EphemerisRangeException 查询时刻前后样本不足
     */
    public static double[] interpolate(EphemerisSeries series, JulianDate epoch) {
        int index = series.findIndex(epoch);
        if (index - 2 < 2 || index + 2 > series.size() - 3) {
            throw new EphemerisRangeException(series.getName(), epoch,
                series.getFirstInterpolableJulianDay(), series.getLastInterpolableJulianDay());
        }

        // 在 index-2 .. index+2 的候选窗口中找时间上最近的样本
        double t = epoch.getJulianDay();
        int closest = index - 2;
        double minDifference = FastMath.abs(t - series.getJulianDay(closest));
        for (int i = index - 1; i <= index + 2; i++) {
            double difference = FastMath.abs(t - series.getJulianDay(i));
            if (difference < minDifference) {
                minDifference = difference;
                closest = i;
            }
        }

        double n = (t - series.getJulianDay(closest))
                / (series.getJulianDay(closest + 1) - series.getJulianDay(closest));

        double[] result = new double[series.getColumnCount()];
        for (int column = 0; column < result.length; column++) {
            result[column] = interpolatedValue(n,
                series.getSample(closest - 2).getValue(column),
                series.getSample(closest - 1).getValue(column),
                series.getSample(closest).getValue(column),
                series.getSample(closest + 1).getValue(column),
                series.getSample(closest + 2).getValue(column));
        }
        return result;
    }

    /**
     * 五点中心差分插值公式
     *
     * @param n 插值因子，以 y3 为原点、相邻样本间隔为单位
     */
    public static double interpolatedValue(double n, double y1, double y2, double y3, double y4, double y5) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = y4 - y3;
        double d = y5 - y4;
        double e = b - a;
        double f = c - b;
        double g = d - c;
        double h = f - e;
        double j = g - f;
        double k = j - h;
        double n2 = n * n;
        return y3 + n / 2 * (b + c) + n2 / 2 * f + n * (n2 - 1) / 12 * (h + j) + n2 * (n2 - 1) / 24 * k;
    }
}
