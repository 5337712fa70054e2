package in.leanvibe.service.reconnection;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.leanvibe.domain.event.StreamEvent;

import java.time.Instant;

/**
 * An event a disconnected client would have received.
 */
public record MissedEvent(
    @JsonProperty("event") StreamEvent event,
    @JsonProperty("missed_at") Instant missedAt
) {
}
