package celestial.events.calculator;

import celestial.bodies.EphemerisBody;
import celestial.coordinates.FrameTransformer;
import celestial.ephemeris.EphemerisRangeException;
import celestial.events.AstronomicalEvent;
import celestial.events.AstronomicalEventSolver;
import celestial.events.EventCollector;
import celestial.events.EventConvergenceException;
import celestial.events.EventSolverConfig;
import celestial.events.model.BatchResult;
import celestial.events.model.ObserverSite;
import celestial.time.JulianDate;
import org.orekit.errors.OrekitException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * 批量事件计算器
 *
 * 对所有天体-站点对逐日计算升落中天和晨昏蒙影事件。
 *
 * 星历上下文只读，因此各对可以在固定大小的线程池中并行计算；
 * 单个天体-站点对的失败被记录在结果中，不影响其余各对。
 */
public class BatchEventCalculator {

    private static final Logger logger = Logger.getLogger(BatchEventCalculator.class.getName());

    static final String EPHEMERIS_RANGE_ERROR = "EPHEMERIS_RANGE_ERROR";
    static final String CONVERGENCE_ERROR = "CONVERGENCE_ERROR";
    static final String COMPUTATION_ERROR = "COMPUTATION_ERROR";

    private final AstronomicalEventSolver solver;
    private final EventSolverConfig config;

    /**
     * 创建批量计算器（使用默认配置）
     */
    public BatchEventCalculator(FrameTransformer transformer) {
        this(transformer, new EventSolverConfig());
    }

    public BatchEventCalculator(FrameTransformer transformer, EventSolverConfig config) {
        this.config = config;
        this.solver = new AstronomicalEventSolver(transformer, config);
    }

    /**
     * 批量计算所有天体-站点对的事件
     *
     * @param bodies 天体列表
     * @param sites 观测站点列表
     * @param startDate 起始日期（取其 UT 日期）
     * @param days 天数
     * @return BatchResult 计算结果
     */
    public BatchResult computeBatch(List<EphemerisBody> bodies,
                                    List<ObserverSite> sites,
                                    JulianDate startDate,
                                    int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1: " + days);
        }
        long startTimeMs = System.currentTimeMillis();
        BatchResult result = new BatchResult();
        result.getStatistics().setTotalPairs(bodies.size() * sites.size());
        JulianDate firstDay = startDate.startOfDayUT();

        if (config.isUseParallel() && bodies.size() * sites.size() > 1) {
            computeParallel(bodies, sites, firstDay, days, result);
        } else {
            for (EphemerisBody body : bodies) {
                for (ObserverSite site : sites) {
                    computePair(body, site, firstDay, days, result);
                }
            }
        }

        long computationTimeMs = System.currentTimeMillis() - startTimeMs;
        result.getStatistics().setComputationTimeMs(computationTimeMs);
        logger.info("Batch event computation finished: " + result.getStatistics());
        return result;
    }

    /**
     * 并行计算（每个天体-站点对一个任务）
     */
    private void computeParallel(List<EphemerisBody> bodies,
                                 List<ObserverSite> sites,
                                 JulianDate firstDay,
                                 int days,
                                 BatchResult result) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(bodies.size() * sites.size(), config.getParallelism())
        );

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (EphemerisBody body : bodies) {
                for (ObserverSite site : sites) {
                    futures.add(executor.submit(() -> computePair(body, site, firstDay, days, result)));
                }
            }

            // 等待所有任务完成
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Parallel event computation interrupted", e);
                } catch (ExecutionException e) {
                    throw new RuntimeException("Parallel event computation failed", e.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }
    }

    /**
     * 计算单个天体-站点对在整个时段内的事件
     */
    private void computePair(EphemerisBody body, ObserverSite site, JulianDate firstDay, int days,
                             BatchResult result) {
        try {
            EventCollector collector = new EventCollector();
            for (int day = 0; day < days; day++) {
                collector.addAll(solver.events(body, firstDay.shiftedByDays(day), site.getLocation()));
            }
            List<AstronomicalEvent> events = collector.getEvents();
            if (!events.isEmpty()) {
                result.addEvents(body.getName(), site.getId(), events);
                result.getStatistics().incrementPairsWithEvents();
            }
        } catch (EphemerisRangeException e) {
            recordError(result, body, site, EPHEMERIS_RANGE_ERROR, e);
        } catch (EventConvergenceException e) {
            recordError(result, body, site, CONVERGENCE_ERROR, e);
        } catch (OrekitException e) {
            recordError(result, body, site, COMPUTATION_ERROR, e);
        }
    }

    private static void recordError(BatchResult result, EphemerisBody body, ObserverSite site,
                                    String errorType, OrekitException e) {
        logger.warning(String.format("Event computation failed for %s at %s: %s",
            body.getName(), site.getId(), e.getMessage()));
        result.addError(body.getName(), site.getId(), errorType, e.getMessage());
    }
}
