package in.leanvibe.service.streaming;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.leanvibe.domain.event.EventPriority;
import in.leanvibe.domain.event.NotificationChannel;
import in.leanvibe.domain.event.StreamEvent;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire envelope sent to streaming clients.
 *
 * <pre>
 * {"message_type": "notification", "event_type": "file_changed", "priority": "medium",
 *  "channel": "file_system", "timestamp": "...", "data": {...}, "sequence_number": 42}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingMessage(
    @JsonProperty("message_type") String messageType,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("priority") EventPriority priority,
    @JsonProperty("channel") NotificationChannel channel,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("data") Object data,
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("batch_info") Map<String, Object> batchInfo
) {
    public static final String TYPE_NOTIFICATION = "notification";
    public static final String TYPE_BATCH = "batch_notification";
    public static final String TYPE_SESSION_RESTORED = "session_restored";

    public static StreamingMessage notification(StreamEvent event, long sequenceNumber) {
        return new StreamingMessage(
            TYPE_NOTIFICATION,
            event.type().wireName(),
            event.priority(),
            event.channel(),
            event.timestamp(),
            event,
            sequenceNumber,
            null);
    }

    /**
     * Multi-event envelope. Priority is the highest among the members;
     * members keep their emission order. {@code compressed} in batch_info reports
     * whether the client opted into compression; the frame type tells whether it
     * actually was.
     */
    public static StreamingMessage batch(List<StreamEvent> events, long sequenceNumber, boolean compressionEnabled) {
        EventPriority maxPriority = events.stream()
            .map(StreamEvent::priority)
            .max(Comparator.naturalOrder())
            .orElse(EventPriority.LOW);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("events", events);
        data.put("batch_size", events.size());

        Map<String, Object> batchInfo = new LinkedHashMap<>();
        batchInfo.put("event_count", events.size());
        batchInfo.put("compressed", compressionEnabled);

        return new StreamingMessage(
            TYPE_BATCH,
            "batch",
            maxPriority,
            NotificationChannel.ALL,
            Instant.now(),
            data,
            sequenceNumber,
            batchInfo);
    }

    public static StreamingMessage sessionRestored(Map<String, Object> syncData, long sequenceNumber) {
        return new StreamingMessage(
            TYPE_SESSION_RESTORED,
            TYPE_SESSION_RESTORED,
            EventPriority.HIGH,
            NotificationChannel.SYSTEM,
            Instant.now(),
            syncData,
            sequenceNumber,
            null);
    }
}
