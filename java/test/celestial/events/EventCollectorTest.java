package celestial.events;

import celestial.bodies.BodyDescriptor;
import celestial.coordinates.CoordinateFrameOrigin;
import celestial.time.JulianDate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class EventCollectorTest {

    private static final JulianDate DATE = JulianDate.ofJulianDay(2459386.5);

    private static AstronomicalEvent sunEvent(AstronomicalEventType type, double dayOffset) {
        return new AstronomicalEvent(type, DATE.shiftedByDays(dayOffset),
                                     Collections.singletonList(BodyDescriptor.SUN), null,
                                     CoordinateFrameOrigin.GEOCENTRIC);
    }

    @Test
    void add_ignoresDuplicatesWithinTolerance() {
        EventCollector collector = new EventCollector();

        assertThat(collector.add(sunEvent(AstronomicalEventType.RISING, 0.15))).isTrue();
        assertThat(collector.add(sunEvent(AstronomicalEventType.RISING, 0.15 + 1.0 / 86400.0))).isFalse();
        assertThat(collector.add(sunEvent(AstronomicalEventType.SETTING, 0.15))).isTrue();
        assertThat(collector.getEventCount()).isEqualTo(2);
    }

    @Test
    void getEvents_sortsByDate() {
        EventCollector collector = new EventCollector();
        collector.add(sunEvent(AstronomicalEventType.SETTING, 0.85));
        collector.add(sunEvent(AstronomicalEventType.UPPER_CULMINATION, 0.5));
        collector.add(sunEvent(AstronomicalEventType.RISING, 0.15));

        assertThat(collector.getEvents())
            .extracting(AstronomicalEvent::getType)
            .containsExactly(AstronomicalEventType.RISING,
                             AstronomicalEventType.UPPER_CULMINATION,
                             AstronomicalEventType.SETTING);

        collector.clear();
        assertThat(collector.getEvents()).isEmpty();
    }

    @Test
    void concurrentAdds_keepEachEventOnce() throws Exception {
        EventCollector collector = new EventCollector();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                futures.add(executor.submit(() -> {
                    for (int day = 0; day < 50; day++) {
                        collector.add(sunEvent(AstronomicalEventType.RISING, day + 0.2));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertThat(collector.getEventCount()).isEqualTo(50);
    }
}
