package celestial.events;

/**
 * 天文事件类型
 */
public enum AstronomicalEventType {
    RISING("rising"),
    UPPER_CULMINATION("upper culmination"),
    SETTING("setting"),
    LOWER_CULMINATION("lower culmination"),
    ASTRONOMICAL_DAWN("astronomical dawn"),
    NAUTICAL_DAWN("nautical dawn"),
    CIVIL_DAWN("civil dawn"),
    CIVIL_DUSK("civil dusk"),
    NAUTICAL_DUSK("nautical dusk"),
    ASTRONOMICAL_DUSK("astronomical dusk"),
    SUPERIOR_CONJUNCTION("superior conjunction"),
    INFERIOR_CONJUNCTION("inferior conjunction"),
    CONJUNCTION("conjunction"),
    TRIPLE_CONJUNCTION("triple conjunction"),
    QUASI_CONJUNCTION("quasi conjunction"),
    ECLIPSE("eclipse"),
    OCCULTATION("occultation"),
    TRANSIT("transit"),
    GREATEST_ELONGATION("time of greatest elongation"),
    /** 两天体视角距最小的时刻 */
    APPULSE("appulse");

    private final String label;

    AstronomicalEventType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
