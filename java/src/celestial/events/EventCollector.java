package celestial.events;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 事件收集器
 *
 * 线程安全的事件记录器。按两秒容差判定重复，重复事件被忽略；取出时按时刻排序。
 */
public class EventCollector {

    private final List<AstronomicalEvent> events = new ArrayList<>();

    /**
     * 记录事件
     *
     * @return 事件被加入时为 true，与已有事件重复时为 false
     */
    public synchronized boolean add(AstronomicalEvent event) {
        if (events.contains(event)) {
            return false;
        }
        return events.add(event);
    }

    public synchronized void addAll(Collection<AstronomicalEvent> newEvents) {
        for (AstronomicalEvent event : newEvents) {
            add(event);
        }
    }

    /**
     * 获取所有事件，按时刻先后排序
     */
    public synchronized List<AstronomicalEvent> getEvents() {
        List<AstronomicalEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(AstronomicalEvent::getDate));
        return sorted;
    }

    public synchronized int getEventCount() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
    }
}
