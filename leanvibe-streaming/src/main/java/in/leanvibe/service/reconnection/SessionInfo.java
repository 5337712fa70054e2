package in.leanvibe.service.reconnection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of a retained client session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionInfo(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("last_seen") Instant lastSeen,
    @JsonProperty("last_heartbeat") Instant lastHeartbeat,
    @JsonProperty("disconnected_at") Instant disconnectedAt,
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("missed_events_count") int missedEventsCount,
    @JsonProperty("reconnections") int reconnections,
    @JsonProperty("reconnection_eligible") boolean reconnectionEligible
) {
}
