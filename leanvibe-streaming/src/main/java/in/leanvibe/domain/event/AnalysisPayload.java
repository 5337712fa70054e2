package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an analysis run (AST parse, graph update, ...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisPayload(
    @JsonProperty("analysis_type") String analysisType,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("success") boolean success,
    @JsonProperty("processing_time_seconds") double processingTimeSeconds,
    @JsonProperty("confidence_score") Double confidenceScore,
    @JsonProperty("error_message") String errorMessage
) implements EventPayload {
}
