package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agent session activity (query started, processing, completed, failed).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentPayload(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("query") String query,
    @JsonProperty("response") String response,
    @JsonProperty("confidence_score") Double confidenceScore
) implements EventPayload {
}
