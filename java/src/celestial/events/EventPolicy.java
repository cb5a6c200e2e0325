package celestial.events;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 某类天体的事件策略：升落判定高度、是否计算晨昏蒙影、以及需要去除的事件类型
 */
public final class EventPolicy {

    private final AngleBelowHorizonPolicy angleBelowHorizon;
    private final boolean twilight;
    private final Set<AstronomicalEventType> excludedTypes;

    public EventPolicy(AngleBelowHorizonPolicy angleBelowHorizon, boolean twilight,
                       Set<AstronomicalEventType> excludedTypes) {
        this.angleBelowHorizon = angleBelowHorizon;
        this.twilight = twilight;
        this.excludedTypes = excludedTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(excludedTypes));
    }

    public AngleBelowHorizonPolicy getAngleBelowHorizon() {
        return angleBelowHorizon;
    }

    public boolean isTwilight() {
        return twilight;
    }

    public Set<AstronomicalEventType> getExcludedTypes() {
        return excludedTypes;
    }

    public List<AstronomicalEvent> filter(List<AstronomicalEvent> events) {
        if (excludedTypes.isEmpty()) {
            return events;
        }
        return events.stream()
                     .filter(event -> !excludedTypes.contains(event.getType()))
                     .collect(Collectors.toList());
    }
}
