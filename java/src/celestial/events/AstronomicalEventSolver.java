package celestial.events;

import celestial.bodies.BodyDescriptor;
import celestial.bodies.EphemerisBody;
import celestial.coordinates.CoordinateFrame;
import celestial.coordinates.FrameTransformer;
import celestial.coordinates.GeographicLocation;
import celestial.coordinates.SphericalCoordinates;
import celestial.ephemeris.EphemerisRangeException;
import celestial.time.JulianDate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 天文事件计算器
 *
 * 计算升起、中天、落下、下中天以及（太阳的）晨昏蒙影时刻。每个事件先做一次单次计算，
 * 再以 {@link EventRefiner} 迭代到自洽：天体位置取自事件时刻本身。
 *
 * 天体相关的差异（判定高度、晨昏蒙影、事件过滤）由 {@link EventPolicies} 按天体类别给出，
 * 计算过程本身与天体无关。
 */
public class AstronomicalEventSolver {

    private static final Logger logger = Logger.getLogger(AstronomicalEventSolver.class.getName());

    private static final AstronomicalEventType[] DAILY_TYPES = {
        AstronomicalEventType.RISING,
        AstronomicalEventType.UPPER_CULMINATION,
        AstronomicalEventType.SETTING,
        AstronomicalEventType.LOWER_CULMINATION
    };

    private static final AstronomicalEventType[] HORIZON_TYPES = {
        AstronomicalEventType.RISING,
        AstronomicalEventType.SETTING
    };

    private final FrameTransformer transformer;
    private final EventSolverConfig config;
    private final EventRefiner refiner;

    public AstronomicalEventSolver(FrameTransformer transformer) {
        this(transformer, new EventSolverConfig());
    }

    public AstronomicalEventSolver(FrameTransformer transformer, EventSolverConfig config) {
        this.transformer = transformer;
        this.config = config;
        this.refiner = new EventRefiner(config);
    }

    public EventSolverConfig getConfig() {
        return config;
    }

    /**
     * 精化后的升起、中天、落下、下中天时刻
     *
     * @param position 天体位置（任意坐标系）
     * @param date 日期，取其 UT 日期
     * @param location 观测地点
     * @param angleBelowHorizon 升落判定高度在地平线下的角度（弧度）
     * @throws EphemerisRangeException 位置或旋转表超出范围
     * @throws EventConvergenceException 精化未收敛
     */
    public RiseTransitSet risingTransitAndSetting(PositionFunction position, JulianDate date,
                                                  GeographicLocation location, double angleBelowHorizon) {
        return risingTransitAndSetting(position, date, location, AngleBelowHorizonPolicy.fixed(angleBelowHorizon));
    }

    public RiseTransitSet risingTransitAndSetting(PositionFunction position, JulianDate date,
                                                  GeographicLocation location, AngleBelowHorizonPolicy policy) {
        Map<AstronomicalEventType, JulianDate> refined = refineAll(position, date, location, policy, DAILY_TYPES);
        return new RiseTransitSet(refined.get(AstronomicalEventType.RISING),
                                  refined.get(AstronomicalEventType.UPPER_CULMINATION),
                                  refined.get(AstronomicalEventType.SETTING),
                                  refined.get(AstronomicalEventType.LOWER_CULMINATION));
    }

    /**
     * 不关联具体天体的升落中天事件
     */
    public List<AstronomicalEvent> events(PositionFunction position, JulianDate date,
                                          GeographicLocation location, double angleBelowHorizon) {
        AngleBelowHorizonPolicy policy = AngleBelowHorizonPolicy.fixed(angleBelowHorizon);
        Map<AstronomicalEventType, JulianDate> refined = refineAll(position, date, location, policy, DAILY_TYPES);
        EventCollector collector = new EventCollector();
        collector.addAll(toEvents(refined, null, position));
        return collector.getEvents();
    }

    /**
     * 某天体在某 UT 日期的全部事件，按时刻排序
     *
     * 太阳附加民用、航海、天文晨昏蒙影；月球和行星不报告下中天。
     */
    public List<AstronomicalEvent> events(EphemerisBody body, JulianDate date, GeographicLocation location) {
        EventPolicy policy = EventPolicies.forKind(body.getKind());
        PositionFunction position = epoch -> body.sphericalCoordinates(epoch, CoordinateFrame.ICRS);
        List<BodyDescriptor> bodies = Collections.singletonList(body.getDescriptor());

        EventCollector collector = new EventCollector();
        collector.addAll(toEvents(
            refineAll(position, date, location, policy.getAngleBelowHorizon(), DAILY_TYPES), bodies, position));

        if (policy.isTwilight() && config.isIncludeTwilight()) {
            for (Twilight twilight : Twilight.values()) {
                AngleBelowHorizonPolicy depth = AngleBelowHorizonPolicy.fixed(twilight.getAngleBelowHorizon());
                for (AstronomicalEvent event : toEvents(
                        refineAll(position, date, location, depth, HORIZON_TYPES), bodies, position)) {
                    collector.add(event.withType(twilight.relabel(event.getType())));
                }
            }
        }

        List<AstronomicalEvent> events = policy.filter(collector.getEvents());
        logger.fine(() -> String.format("Computed %d events for %s on JD %.1f",
            events.size(), body.getName(), date.getJulianDayAtStartOfDayUT()));
        return events;
    }

    private Map<AstronomicalEventType, JulianDate> refineAll(PositionFunction position, JulianDate date,
                                                             GeographicLocation location,
                                                             AngleBelowHorizonPolicy policy,
                                                             AstronomicalEventType[] types) {
        EventRefiner.SinglePass pass = seed -> singlePass(position, seed, location, policy);
        RiseTransitSet initial = pass.compute(date);
        JulianDate dayStart = date.startOfDayUT();

        Map<AstronomicalEventType, JulianDate> refined = new EnumMap<>(AstronomicalEventType.class);
        for (AstronomicalEventType type : types) {
            JulianDate seed = initial.get(type);
            if (seed == null) {
                continue;
            }
            JulianDate converged = refiner.refineWithinDay(type, seed, pass, dayStart);
            if (converged != null) {
                refined.put(type, converged);
            }
        }
        return refined;
    }

    private RiseTransitSet singlePass(PositionFunction position, JulianDate date,
                                      GeographicLocation location, AngleBelowHorizonPolicy policy) {
        SphericalCoordinates equatorial = toEquatorial(position.positionAt(date), date);
        return RiseTransitSetSolver.compute(equatorial, date, location, policy.angleBelowHorizon(equatorial));
    }

    private SphericalCoordinates toEquatorial(SphericalCoordinates coordinates, JulianDate date) {
        CoordinateFrame equatorial = CoordinateFrame.equatorial(date).withOrigin(coordinates.getFrame().getOrigin());
        return transformer.transform(coordinates, equatorial);
    }

    private List<AstronomicalEvent> toEvents(Map<AstronomicalEventType, JulianDate> refined,
                                             List<BodyDescriptor> bodies, PositionFunction position) {
        List<AstronomicalEvent> events = new ArrayList<>();
        for (Map.Entry<AstronomicalEventType, JulianDate> entry : refined.entrySet()) {
            JulianDate date = entry.getValue();
            SphericalCoordinates coordinates = toEquatorial(position.positionAt(date), date);
            events.add(new AstronomicalEvent(entry.getKey(), date, bodies, coordinates,
                                             coordinates.getFrame().getOrigin()));
        }
        return events;
    }
}
