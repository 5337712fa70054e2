package in.leanvibe.domain.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only snapshot of a client's connection state.
 */
public record ClientInfo(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("connected_at") Instant connectedAt,
    @JsonProperty("last_seen") Instant lastSeen,
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("active") boolean active,
    @JsonProperty("preferences") ClientPreferences preferences
) {
}
