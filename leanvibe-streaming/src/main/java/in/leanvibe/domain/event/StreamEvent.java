package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable system event flowing through the streaming engine.
 *
 * Header fields (id, type, priority, channel, timestamp, source) are common to
 * every event; {@link #payload()} carries the kind-specific body.
 * Use {@link StreamEvents} to build events: it fixes priority and channel per type.
 */
public record StreamEvent(
    @JsonProperty("event_id") String id,
    @JsonProperty("event_type") EventType type,
    @JsonProperty("priority") EventPriority priority,
    @JsonProperty("channel") NotificationChannel channel,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("source") String source,
    @JsonProperty("payload") EventPayload payload
) {
    public StreamEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
        if (channel == NotificationChannel.ALL) {
            throw new IllegalArgumentException("ALL is a subscription wildcard, not an event channel");
        }
    }

    public String filePath() {
        return payload.filePath();
    }

    public Double confidenceScore() {
        return payload.confidenceScore();
    }
}
