package celestial.events.model;

import celestial.events.AstronomicalEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量事件计算结果
 *
 * 存储所有天体-站点对的事件、逐对错误和统计信息。可被多个工作线程同时写入。
 */
public class BatchResult {
    // (bodyName, siteId) -> List<AstronomicalEvent>
    private final Map<String, List<AstronomicalEvent>> events;
    private final List<ComputationError> errors;
    private final ComputationStatistics statistics;

    public BatchResult() {
        this.events = new LinkedHashMap<>();
        this.errors = new ArrayList<>();
        this.statistics = new ComputationStatistics();
    }

    /**
     * 添加某一天体-站点对的事件
     */
    public synchronized void addEvents(String bodyName, String siteId, List<AstronomicalEvent> eventList) {
        String key = makeKey(bodyName, siteId);
        events.computeIfAbsent(key, k -> new ArrayList<>()).addAll(eventList);
        statistics.addToEventCount(eventList.size());
    }

    /**
     * 添加错误信息
     */
    public synchronized void addError(String bodyName, String siteId, String errorType, String errorMessage) {
        errors.add(new ComputationError(bodyName, siteId, errorType, errorMessage));
        statistics.incrementErrorCount();
    }

    /**
     * 获取指定天体-站点对的事件
     */
    public synchronized List<AstronomicalEvent> getEvents(String bodyName, String siteId) {
        List<AstronomicalEvent> list = events.get(makeKey(bodyName, siteId));
        return list == null ? Collections.emptyList() : new ArrayList<>(list);
    }

    /**
     * 获取所有事件，键为 "天体-站点"
     */
    public synchronized Map<String, List<AstronomicalEvent>> getAllEvents() {
        return new LinkedHashMap<>(events);
    }

    /**
     * 获取所有错误
     */
    public synchronized List<ComputationError> getErrors() {
        return new ArrayList<>(errors);
    }

    public boolean hasErrors() {
        return statistics.getErrorCount() > 0;
    }

    public ComputationStatistics getStatistics() {
        return statistics;
    }

    private static String makeKey(String bodyName, String siteId) {
        return bodyName + "-" + siteId;
    }

    /**
     * 计算统计信息内部类
     */
    public static class ComputationStatistics {
        private int totalPairs = 0;
        private int pairsWithEvents = 0;
        private int totalEvents = 0;
        private int errorCount = 0;
        private long computationTimeMs = 0;

        public synchronized void setTotalPairs(int totalPairs) { this.totalPairs = totalPairs; }
        public synchronized void incrementPairsWithEvents() { this.pairsWithEvents++; }
        public synchronized void addToEventCount(int count) { this.totalEvents += count; }
        public synchronized void incrementErrorCount() { this.errorCount++; }
        public synchronized void setComputationTimeMs(long time) { this.computationTimeMs = time; }

        public synchronized int getTotalPairs() { return totalPairs; }
        public synchronized int getPairsWithEvents() { return pairsWithEvents; }
        public synchronized int getTotalEvents() { return totalEvents; }
        public synchronized int getErrorCount() { return errorCount; }
        public synchronized long getComputationTimeMs() { return computationTimeMs; }

        @Override
        public synchronized String toString() {
            return String.format("ComputationStatistics{pairs=%d, pairsWithEvents=%d, events=%d, errors=%d, time=%dms}",
                totalPairs, pairsWithEvents, totalEvents, errorCount, computationTimeMs);
        }
    }

    /**
     * 计算错误信息内部类
     */
    public static class ComputationError {
        private final String bodyName;
        private final String siteId;
        private final String errorType;
        private final String errorMessage;

        public ComputationError(String bodyName, String siteId,
                               String errorType, String errorMessage) {
            this.bodyName = bodyName;
            this.siteId = siteId;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
        }

        public String getBodyName() { return bodyName; }
        public String getSiteId() { return siteId; }
        public String getErrorType() { return errorType; }
        public String getErrorMessage() { return errorMessage; }

        @Override
        public String toString() {
            return bodyName + "-" + siteId + " " + errorType + ": " + errorMessage;
        }
    }
}
