package in.leanvibe.service.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Read-only aggregate statistics of the streaming service.
 * {@code totalEventsSent} counts emitted events, not deliveries.
 */
public record StatsSnapshot(
    @JsonProperty("connected_clients") int connectedClients,
    @JsonProperty("total_events_sent") long totalEventsSent,
    @JsonProperty("events_by_type") Map<String, Long> eventsByType,
    @JsonProperty("events_by_priority") Map<String, Long> eventsByPriority,
    @JsonProperty("failed_deliveries") long failedDeliveries,
    @JsonProperty("messages_delivered") long messagesDelivered,
    @JsonProperty("compressed_messages") long compressedMessages,
    @JsonProperty("missed_events_tracked") long missedEventsTracked,
    @JsonProperty("queue_depth") int queueDepth
) {
}
