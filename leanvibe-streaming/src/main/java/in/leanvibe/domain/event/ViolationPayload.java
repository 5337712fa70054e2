package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Architectural or quality rule violation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationPayload(
    @JsonProperty("violation_id") String violationId,
    @JsonProperty("violation_type") String violationType,
    @JsonProperty("severity") String severity,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("description") String description,
    @JsonProperty("confidence_score") Double confidenceScore
) implements EventPayload {
}
