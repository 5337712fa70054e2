package in.leanvibe.service.streaming;

import in.leanvibe.domain.event.EventPriority;
import in.leanvibe.domain.event.EventType;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate counters of the streaming service.
 */
final class StreamingStats {
    private final AtomicInteger connectedClients = new AtomicInteger(0);
    private final AtomicLong totalEventsSent = new AtomicLong(0);
    private final AtomicLong failedDeliveries = new AtomicLong(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong compressedMessages = new AtomicLong(0);
    private final AtomicLong missedEventsTracked = new AtomicLong(0);
    private final Map<EventType, AtomicLong> eventsByType = new ConcurrentHashMap<>();
    private final Map<EventPriority, AtomicLong> eventsByPriority = new ConcurrentHashMap<>();

    void recordEmitted(EventType type, EventPriority priority) {
        totalEventsSent.incrementAndGet();
        eventsByType.computeIfAbsent(type, k -> new AtomicLong()).incrementAndGet();
        eventsByPriority.computeIfAbsent(priority, k -> new AtomicLong()).incrementAndGet();
    }

    void recordDelivered(boolean compressed) {
        messagesDelivered.incrementAndGet();
        if (compressed) {
            compressedMessages.incrementAndGet();
        }
    }

    void recordFailedDelivery() {
        failedDeliveries.incrementAndGet();
    }

    void recordMissedEvent() {
        missedEventsTracked.incrementAndGet();
    }

    void setConnectedClients(int count) {
        connectedClients.set(count);
    }

    StatsSnapshot snapshot(int queueDepth) {
        Map<String, Long> byType = new TreeMap<>();
        eventsByType.forEach((type, count) -> byType.put(type.wireName(), count.get()));
        Map<String, Long> byPriority = new TreeMap<>();
        eventsByPriority.forEach((priority, count) -> byPriority.put(priority.wireName(), count.get()));

        return new StatsSnapshot(
            connectedClients.get(),
            totalEventsSent.get(),
            Collections.unmodifiableMap(byType),
            Collections.unmodifiableMap(byPriority),
            failedDeliveries.get(),
            messagesDelivered.get(),
            compressedMessages.get(),
            missedEventsTracked.get(),
            queueDepth);
    }
}
