package in.leanvibe.service.reconnection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * All retained sessions plus the retention settings that apply to them.
 */
public record SessionsSnapshot(
    @JsonProperty("total_sessions") int totalSessions,
    @JsonProperty("disconnected_sessions") int disconnectedSessions,
    @JsonProperty("grace_period_seconds") long gracePeriodSeconds,
    @JsonProperty("max_missed_events") int maxMissedEvents,
    @JsonProperty("sessions") Map<String, SessionInfo> sessions
) {
}
