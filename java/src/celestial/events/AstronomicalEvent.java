package celestial.events;

import celestial.bodies.BodyDescriptor;
import celestial.coordinates.CoordinateFrameOrigin;
import celestial.coordinates.SphericalCoordinates;
import celestial.time.JulianDate;
import org.hipparchus.util.FastMath;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 天文事件
 *
 * 两个事件相等当且仅当类型、关联天体集合、原点相同，且时刻相差不超过
 * {@link #TIME_TOLERANCE_SECONDS} 秒。这种带容差的相等不具备传递性；
 * hashCode 不包含时刻。
 */
public final class AstronomicalEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 判定两个事件为同一事件的时间容差（秒） */
    public static final double TIME_TOLERANCE_SECONDS = 2.0;

    private final AstronomicalEventType type;
    private final JulianDate date;
    private final List<BodyDescriptor> bodies;
    private final SphericalCoordinates coordinates;
    private final CoordinateFrameOrigin origin;

    /**
     * 创建事件
     *
     * @param type 事件类型
     * @param date 事件时刻
     * @param bodies 关联天体，与具体天体无关时为 null
     * @param coordinates 事件时刻的坐标
     * @param origin 事件适用的原点
     */
    public AstronomicalEvent(AstronomicalEventType type, JulianDate date, List<BodyDescriptor> bodies,
                             SphericalCoordinates coordinates, CoordinateFrameOrigin origin) {
        this.type = Objects.requireNonNull(type, "type");
        this.date = Objects.requireNonNull(date, "date");
        this.bodies = bodies == null ? null : Collections.unmodifiableList(new ArrayList<>(bodies));
        this.coordinates = coordinates;
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public AstronomicalEventType getType() {
        return type;
    }

    public JulianDate getDate() {
        return date;
    }

    /**
     * 关联天体，可能为 null
     */
    public List<BodyDescriptor> getBodies() {
        return bodies;
    }

    public SphericalCoordinates getCoordinates() {
        return coordinates;
    }

    public CoordinateFrameOrigin getOrigin() {
        return origin;
    }

    /**
     * 同一时刻、同一天体，但类型不同的事件
     */
    public AstronomicalEvent withType(AstronomicalEventType newType) {
        return new AstronomicalEvent(newType, date, bodies, coordinates, origin);
    }

    /**
     * 保留指定类型的事件
     */
    public static List<AstronomicalEvent> filter(List<AstronomicalEvent> events,
                                                 Set<AstronomicalEventType> types) {
        return events.stream()
                     .filter(event -> types.contains(event.type))
                     .collect(Collectors.toList());
    }

    /**
     * 保留与任一指定天体相关的事件
     */
    public static List<AstronomicalEvent> filter(List<AstronomicalEvent> events,
                                                 Collection<BodyDescriptor> bodies) {
        List<AstronomicalEvent> result = new ArrayList<>();
        for (AstronomicalEvent event : events) {
            if (event.bodies != null && event.bodies.stream().anyMatch(bodies::contains)) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * 去除重复事件，保留首次出现的事件及原有顺序
     */
    public static List<AstronomicalEvent> removeDuplicates(List<AstronomicalEvent> events) {
        List<AstronomicalEvent> result = new ArrayList<>();
        for (AstronomicalEvent event : events) {
            if (!result.contains(event)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AstronomicalEvent)) {
            return false;
        }
        AstronomicalEvent that = (AstronomicalEvent) o;
        if (type != that.type) {
            return false;
        }
        if (!Objects.equals(bodySet(), that.bodySet())) {
            return false;
        }
        if (FastMath.abs(date.durationFrom(that.date)) > TIME_TOLERANCE_SECONDS) {
            return false;
        }
        return origin.equals(that.origin);
    }

    private Set<BodyDescriptor> bodySet() {
        return bodies == null ? null : new HashSet<>(bodies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bodySet(), origin);
    }

    @Override
    public String toString() {
        String subject;
        if (bodies != null) {
            subject = bodies.stream().map(BodyDescriptor::getName).collect(Collectors.joining(", "));
        } else {
            subject = "[" + coordinates + "]";
        }
        return subject + "\t" + type.getLabel() + "\t" + date;
    }
}
