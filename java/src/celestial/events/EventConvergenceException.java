package celestial.events;

import celestial.ephemeris.CelestialMessages;
import celestial.time.JulianDate;
import org.orekit.errors.OrekitException;

/**
 * 事件迭代精化在最大迭代次数内未收敛
 */
public class EventConvergenceException extends OrekitException {

    private static final long serialVersionUID = 1L;

    private final AstronomicalEventType eventType;
    private final int iterations;
    private final JulianDate lastCandidate;

    public EventConvergenceException(AstronomicalEventType eventType, int iterations, JulianDate lastCandidate) {
        super(CelestialMessages.EVENT_REFINEMENT_DID_NOT_CONVERGE,
              eventType.getLabel(), iterations, lastCandidate.getJulianDay());
        this.eventType = eventType;
        this.iterations = iterations;
        this.lastCandidate = lastCandidate;
    }

    public AstronomicalEventType getEventType() {
        return eventType;
    }

    public int getIterations() {
        return iterations;
    }

    public JulianDate getLastCandidate() {
        return lastCandidate;
    }
}
