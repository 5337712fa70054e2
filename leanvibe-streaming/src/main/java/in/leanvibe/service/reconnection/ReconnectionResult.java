package in.leanvibe.service.reconnection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of a client reconnection.
 *
 * @param sessionRestored    false when the client must start a new session
 * @param missedEventsCount  events replayed in the session_restored message
 * @param reconnectionTime   when the reconnection was handled
 * @param lastSequenceNumber last sequence number the client saw before the sync message; 0 for a new session
 */
public record ReconnectionResult(
    @JsonProperty("session_restored") boolean sessionRestored,
    @JsonProperty("missed_events_count") int missedEventsCount,
    @JsonProperty("reconnection_time") Instant reconnectionTime,
    @JsonProperty("last_sequence_number") long lastSequenceNumber
) {
    public static ReconnectionResult newSession(Instant now) {
        return new ReconnectionResult(false, 0, now, 0);
    }
}
