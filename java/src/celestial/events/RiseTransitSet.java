package celestial.events;

import celestial.time.JulianDate;

/**
 * 升起、中天、落下、下中天时刻
 *
 * 天体在该日不经过给定高度（拱极或永不升起）时，升起和落下为 null；中天和下中天总是存在。
 */
public final class RiseTransitSet {

    private final JulianDate rising;
    private final JulianDate transit;
    private final JulianDate setting;
    private final JulianDate antitransit;

    public RiseTransitSet(JulianDate rising, JulianDate transit, JulianDate setting, JulianDate antitransit) {
        this.rising = rising;
        this.transit = transit;
        this.setting = setting;
        this.antitransit = antitransit;
    }

    public JulianDate getRising() {
        return rising;
    }

    public JulianDate getTransit() {
        return transit;
    }

    public JulianDate getSetting() {
        return setting;
    }

    public JulianDate getAntitransit() {
        return antitransit;
    }

    public boolean hasRisingAndSetting() {
        return rising != null && setting != null;
    }

    /**
     * 按事件类型取时刻
     *
     * @return 该类型的时刻；类型不存在或不属于升落中天类时返回 null
     */
    public JulianDate get(AstronomicalEventType type) {
        switch (type) {
            case RISING:
                return rising;
            case UPPER_CULMINATION:
                return transit;
            case SETTING:
                return setting;
            case LOWER_CULMINATION:
                return antitransit;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "RiseTransitSet{rising=" + rising +
                ", transit=" + transit +
                ", setting=" + setting +
                ", antitransit=" + antitransit +
                '}';
    }
}
