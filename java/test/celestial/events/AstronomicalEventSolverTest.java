package celestial.events;

import celestial.TestEphemerides;
import celestial.bodies.BodyDescriptor;
import celestial.bodies.EphemerisBody;
import celestial.coordinates.CoordinateFrame;
import celestial.coordinates.FrameTransformer;
import celestial.coordinates.GeographicLocation;
import celestial.coordinates.SphericalCoordinates;
import celestial.time.JulianDate;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstronomicalEventSolverTest {

    private static final double TOLERANCE_SECONDS = 60.0;

    private static final GeographicLocation GREENWICH = GeographicLocation.ofDegrees(51.4769, -0.0005);
    private static final GeographicLocation BOSTON = GeographicLocation.ofDegrees(42.3333, -71.0833);

    private final FrameTransformer transformer = TestEphemerides.transformer();
    private final AstronomicalEventSolver solver = new AstronomicalEventSolver(transformer);

    private final EphemerisBody sun = new EphemerisBody(BodyDescriptor.SUN, transformer);
    private final EphemerisBody moon = new EphemerisBody(BodyDescriptor.MOON, transformer);
    private final EphemerisBody venus = new EphemerisBody(BodyDescriptor.VENUS, transformer);

    private static void assertNear(JulianDate actual, JulianDate expected) {
        assertThat(actual).as("expected about %s", expected).isNotNull();
        assertThat(FastMath.abs(actual.durationFrom(expected))).as("%s vs %s", actual, expected)
            .isLessThan(TOLERANCE_SECONDS);
    }

    private static JulianDate timeOf(List<AstronomicalEvent> events, AstronomicalEventType type) {
        return events.stream()
                     .filter(event -> event.getType() == type)
                     .map(AstronomicalEvent::getDate)
                     .findFirst()
                     .orElse(null);
    }

    private static List<AstronomicalEventType> typesOf(List<AstronomicalEvent> events) {
        return events.stream().map(AstronomicalEvent::getType).collect(Collectors.toList());
    }

    @Test
    void venus_atBoston_1988March20() {
        PositionFunction position = epoch -> venus.sphericalCoordinates(epoch, CoordinateFrame.ICRS);
        JulianDate date = JulianDate.ofJulianDay(2447240.5);

        RiseTransitSet result = solver.risingTransitAndSetting(position, date, BOSTON,
            SphericalCoordinates.MEAN_ATMOSPHERIC_REFRACTION);

        assertNear(result.getRising(), TestEphemerides.dateTime(1988, 3, 20, 12, 25, 27));
        assertNear(result.getTransit(), TestEphemerides.dateTime(1988, 3, 20, 19, 40, 31));
        assertNear(result.getSetting(), TestEphemerides.dateTime(1988, 3, 20, 2, 54, 40));
        assertNear(result.getAntitransit(), TestEphemerides.dateTime(1988, 3, 20, 7, 40, 23));
    }

    @Test
    void venusEvents_excludeLowerCulmination() {
        List<AstronomicalEvent> events = solver.events(venus, JulianDate.ofJulianDay(2447240.5), BOSTON);

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.SETTING, AstronomicalEventType.RISING, AstronomicalEventType.UPPER_CULMINATION);
        assertThat(events).allSatisfy(event -> assertThat(event.getBodies()).containsExactly(BodyDescriptor.VENUS));
    }

    @Test
    void sun_atGreenwich_onSolstice_withTwilight() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21), GREENWICH);

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.LOWER_CULMINATION,
            AstronomicalEventType.NAUTICAL_DAWN,
            AstronomicalEventType.CIVIL_DAWN,
            AstronomicalEventType.RISING,
            AstronomicalEventType.UPPER_CULMINATION,
            AstronomicalEventType.SETTING,
            AstronomicalEventType.CIVIL_DUSK,
            AstronomicalEventType.NAUTICAL_DUSK);
        assertNear(timeOf(events, AstronomicalEventType.LOWER_CULMINATION), TestEphemerides.dateTime(2021, 6, 21, 0, 2, 0));
        assertNear(timeOf(events, AstronomicalEventType.NAUTICAL_DAWN), TestEphemerides.dateTime(2021, 6, 21, 1, 40, 40));
        assertNear(timeOf(events, AstronomicalEventType.CIVIL_DAWN), TestEphemerides.dateTime(2021, 6, 21, 2, 55, 7));
        assertNear(timeOf(events, AstronomicalEventType.RISING), TestEphemerides.dateTime(2021, 6, 21, 3, 42, 49));
        assertNear(timeOf(events, AstronomicalEventType.UPPER_CULMINATION), TestEphemerides.dateTime(2021, 6, 21, 12, 1, 53));
        assertNear(timeOf(events, AstronomicalEventType.SETTING), TestEphemerides.dateTime(2021, 6, 21, 20, 20, 57));
        assertNear(timeOf(events, AstronomicalEventType.CIVIL_DUSK), TestEphemerides.dateTime(2021, 6, 21, 21, 8, 39));
        assertNear(timeOf(events, AstronomicalEventType.NAUTICAL_DUSK), TestEphemerides.dateTime(2021, 6, 21, 22, 23, 4));
    }

    @Test
    void sunAltitude_atUpperCulmination() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21), GREENWICH);
        JulianDate transit = timeOf(events, AstronomicalEventType.UPPER_CULMINATION);

        SphericalCoordinates horizontal = sun.sphericalCoordinates(transit,
            CoordinateFrame.horizontal(transit, GREENWICH));

        assertThat(horizontal.getLatitudeDegrees()).isBetween(61.9, 62.0);
        assertThat(horizontal.getLongitudeDegrees()).isBetween(179.9, 180.1);
    }

    @Test
    void twilight_canBeSwitchedOff() {
        EventSolverConfig config = new EventSolverConfig();
        config.setIncludeTwilight(false);
        AstronomicalEventSolver withoutTwilight = new AstronomicalEventSolver(transformer, config);

        List<AstronomicalEvent> events = withoutTwilight.events(sun, TestEphemerides.date(2021, 6, 21), GREENWICH);

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.LOWER_CULMINATION,
            AstronomicalEventType.RISING,
            AstronomicalEventType.UPPER_CULMINATION,
            AstronomicalEventType.SETTING);
    }

    @Test
    void sun_atVienna_onNewYearsDay() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 1, 1),
                                                       GeographicLocation.ofDegrees(48.20, 16.39));

        assertNear(timeOf(events, AstronomicalEventType.RISING), TestEphemerides.dateTime(2021, 1, 1, 6, 45, 8));
        assertNear(timeOf(events, AstronomicalEventType.UPPER_CULMINATION), TestEphemerides.dateTime(2021, 1, 1, 10, 58, 7));
        assertNear(timeOf(events, AstronomicalEventType.SETTING), TestEphemerides.dateTime(2021, 1, 1, 15, 11, 17));
        assertNear(timeOf(events, AstronomicalEventType.ASTRONOMICAL_DAWN), TestEphemerides.dateTime(2021, 1, 1, 4, 51, 18));
        assertNear(timeOf(events, AstronomicalEventType.ASTRONOMICAL_DUSK), TestEphemerides.dateTime(2021, 1, 1, 17, 5, 9));
    }

    @Test
    void sun_atEidsvoll() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2020, 11, 2),
                                                       GeographicLocation.ofDegrees(60.331, 11.263));

        assertNear(timeOf(events, AstronomicalEventType.RISING), TestEphemerides.dateTime(2020, 11, 2, 6, 42, 12));
        assertNear(timeOf(events, AstronomicalEventType.SETTING), TestEphemerides.dateTime(2020, 11, 2, 15, 13, 56));
    }

    @Test
    void midnightSun_atTromso_hasOnlyCulminations() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21),
                                                       GeographicLocation.ofDegrees(69.65, 18.96));

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.UPPER_CULMINATION, AstronomicalEventType.LOWER_CULMINATION);
        assertNear(events.get(0).getDate(), TestEphemerides.dateTime(2021, 6, 21, 10, 46, 2));
        assertNear(events.get(1).getDate(), TestEphemerides.dateTime(2021, 6, 21, 22, 46, 9));
    }

    @Test
    void sunset_inNewYork_fallsEarlyInTheUtDay() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21),
                                                       GeographicLocation.ofDegrees(40.7128, -74.0060));

        assertNear(timeOf(events, AstronomicalEventType.SETTING), TestEphemerides.dateTime(2021, 6, 21, 0, 30, 36));
        assertNear(timeOf(events, AstronomicalEventType.RISING), TestEphemerides.dateTime(2021, 6, 21, 9, 25, 5));
    }

    @Test
    void sun_lowerCulminationAfterMidnight_belongsToTheRequestedDay() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21), GREENWICH);

        JulianDate lowerCulmination = timeOf(events, AstronomicalEventType.LOWER_CULMINATION);
        assertNear(lowerCulmination, TestEphemerides.dateTime(2021, 6, 21, 0, 2, 0));
        assertThat(lowerCulmination.isBefore(TestEphemerides.date(2021, 6, 22))).isTrue();
    }

    @Test
    void sun_lowerCulminationCrossingMidnight_isAbsentThatDay() {
        // 2021-06-11 23:59:51 and 2021-06-13 00:00:03
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 12), GREENWICH,
                                                       SphericalCoordinates.MEAN_ATMOSPHERIC_REFRACTION);

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.RISING, AstronomicalEventType.UPPER_CULMINATION, AstronomicalEventType.SETTING);
    }

    @Test
    void sunAndMoonEvents_stayWithinTheRequestedUtDay_forAMonth() {
        GeographicLocation[] locations = {GREENWICH, GeographicLocation.ofDegrees(60.0, 10.0)};
        JulianDate first = TestEphemerides.date(2021, 6, 1);

        for (int day = 0; day < 30; day++) {
            JulianDate start = first.shiftedByDays(day);
            JulianDate end = start.shiftedByDays(1.0);
            for (GeographicLocation location : locations) {
                for (EphemerisBody body : new EphemerisBody[] {sun, moon}) {
                    List<AstronomicalEvent> events = solver.events(body, start, location);
                    assertThat(events).as("%s at %s on %s", body, location, start)
                        .allSatisfy(event -> {
                            assertThat(event.getDate().isBefore(start)).as("%s", event).isFalse();
                            assertThat(event.getDate().isBefore(end)).as("%s", event).isTrue();
                        });
                }
            }
        }
    }

    @Test
    void moon_atGreenwich_usesParallaxCorrectedHorizon() {
        List<AstronomicalEvent> events = solver.events(moon, TestEphemerides.date(2021, 3, 15), GREENWICH);

        assertThat(typesOf(events)).containsExactly(
            AstronomicalEventType.RISING, AstronomicalEventType.UPPER_CULMINATION, AstronomicalEventType.SETTING);
        assertNear(events.get(0).getDate(), TestEphemerides.dateTime(2021, 3, 15, 7, 21, 53));
        assertNear(events.get(1).getDate(), TestEphemerides.dateTime(2021, 3, 15, 13, 44, 10));
        assertNear(events.get(2).getDate(), TestEphemerides.dateTime(2021, 3, 15, 20, 20, 50));
    }

    @Test
    void events_carryEquatorialCoordinatesAtTheEventInstant() {
        List<AstronomicalEvent> events = solver.events(sun, TestEphemerides.date(2021, 6, 21), GREENWICH);
        AstronomicalEvent transit = events.stream()
            .filter(event -> event.getType() == AstronomicalEventType.UPPER_CULMINATION)
            .findFirst()
            .orElseThrow(IllegalStateException::new);

        assertThat(transit.getCoordinates().getFrame()).isEqualTo(CoordinateFrame.equatorial(transit.getDate()));
        assertThat(transit.getCoordinates().getLatitudeDegrees()).isBetween(23.43, 23.44);
        assertThat(transit.getOrigin()).isEqualTo(transit.getCoordinates().getFrame().getOrigin());
    }

    @Test
    void fixedStar_eventsWithoutBodies() {
        SphericalCoordinates vega = SphericalCoordinates.ofDegrees(279.2347, 38.7837, CoordinateFrame.ICRS);

        List<AstronomicalEvent> events = solver.events(epoch -> vega, TestEphemerides.date(2021, 6, 21), GREENWICH,
                                                       SphericalCoordinates.MEAN_ATMOSPHERIC_REFRACTION);

        // Vega is circumpolar at Greenwich
        assertThat(typesOf(events)).containsExactlyInAnyOrder(
            AstronomicalEventType.UPPER_CULMINATION, AstronomicalEventType.LOWER_CULMINATION);
        assertThat(events).allSatisfy(event -> assertThat(event.getBodies()).isNull());
    }

    @Test
    void tooFewIterations_isAConvergenceError() {
        EventSolverConfig config = new EventSolverConfig();
        config.setMaxIterations(1);
        AstronomicalEventSolver impatient = new AstronomicalEventSolver(transformer, config);

        assertThatThrownBy(() -> impatient.events(venus, JulianDate.ofJulianDay(2447240.5), BOSTON))
            .isInstanceOf(EventConvergenceException.class)
            .satisfies(e -> assertThat(((EventConvergenceException) e).getIterations()).isEqualTo(1));
    }
}
