package celestial.events;

import celestial.time.JulianDate;
import org.hipparchus.util.FastMath;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 事件时刻迭代精化
 *
 * 单次计算假定天体位置取自起始日期，而非事件时刻。精化时以上一次的候选时刻为新的基准日期
 * 重新计算，在相隔一个恒星日的同类候选中取最接近上一次的一个，直到前后两次相差不超过容差。
 * 所有事件类型共用同一个有迭代上限的循环。
 */
public class EventRefiner {

    private static final Logger logger = Logger.getLogger(EventRefiner.class.getName());

    /**
     * 以某一基准日期做一次单次计算
     */
    @FunctionalInterface
    public interface SinglePass {
        RiseTransitSet compute(JulianDate date);
    }

    private final int maxIterations;
    private final double toleranceSeconds;

    public EventRefiner(EventSolverConfig config) {
        this(config.getMaxIterations(), config.getConvergenceToleranceSeconds());
    }

    public EventRefiner(int maxIterations, double toleranceSeconds) {
        this.maxIterations = maxIterations;
        this.toleranceSeconds = toleranceSeconds;
    }

    /**
     * 精化某一类型的事件
     *
     * @param type 事件类型（升起、中天、落下或下中天）
     * @param seed 初始候选时刻
     * @param pass 单次计算
     * @return 收敛后的时刻；精化过程中该事件消失（天体变为拱极或永不升起）时返回 null
     * @throws EventConvergenceException 超过最大迭代次数仍未收敛
     */
    public JulianDate refine(AstronomicalEventType type, JulianDate seed, SinglePass pass) {
        JulianDate current = seed;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            JulianDate found = pass.compute(current).get(type);
            if (found == null) {
                logger.finest(() -> "Event " + type.getLabel() + " vanished during refinement");
                return null;
            }
            JulianDate candidate = nearestRevolution(found, current);
            if (FastMath.abs(candidate.durationFrom(current)) <= toleranceSeconds) {
                if (logger.isLoggable(Level.FINEST)) {
                    logger.finest(String.format("Event %s converged after %d iterations at JD %.6f",
                        type.getLabel(), iteration, current.getJulianDay()));
                }
                return current;
            }
            current = candidate;
        }
        throw new EventConvergenceException(type, maxIterations, current);
    }

    /**
     * 精化某一类型的事件，并把结果限定在 [dayStart, dayStart + 1 天) 之内
     *
     * 精化会沿着最接近的恒星日走，可能越过日界。越界时从相隔一个恒星日、落回当天一侧的候选重新精化，
     * 仍不在当天则视为当天没有该事件。
     *
     * @return 当天内收敛的时刻，没有则返回 null
     */
    public JulianDate refineWithinDay(AstronomicalEventType type, JulianDate seed, SinglePass pass,
                                      JulianDate dayStart) {
        JulianDate converged = refine(type, seed, pass);
        if (converged == null || isWithinDay(converged, dayStart)) {
            return converged;
        }
        double shift = converged.isBefore(dayStart)
            ? JulianDate.SIDEREAL_DAY_FRACTION : -JulianDate.SIDEREAL_DAY_FRACTION;
        JulianDate reseeded = refine(type, converged.shiftedByDays(shift), pass);
        if (reseeded == null || !isWithinDay(reseeded, dayStart)) {
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest(String.format("Event %s has no occurrence in the UT day starting at JD %.6f",
                    type.getLabel(), dayStart.getJulianDay()));
            }
            return null;
        }
        return reseeded;
    }

    static boolean isWithinDay(JulianDate date, JulianDate dayStart) {
        return !date.isBefore(dayStart) && date.isBefore(dayStart.shiftedByDays(1.0));
    }

    /**
     * 在 found 及其前后一个恒星日的候选中取最接近 reference 的
     */
    static JulianDate nearestRevolution(JulianDate found, JulianDate reference) {
        JulianDate best = found;
        double bestDistance = FastMath.abs(found.durationFrom(reference));
        for (double shift : new double[] {-JulianDate.SIDEREAL_DAY_FRACTION, JulianDate.SIDEREAL_DAY_FRACTION}) {
            JulianDate shifted = found.shiftedByDays(shift);
            double distance = FastMath.abs(shifted.durationFrom(reference));
            if (distance < bestDistance) {
                best = shifted;
                bestDistance = distance;
            }
        }
        return best;
    }
}
