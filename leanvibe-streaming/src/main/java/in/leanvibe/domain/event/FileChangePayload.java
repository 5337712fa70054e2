package in.leanvibe.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * File system change reported by the file monitor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileChangePayload(
    @JsonProperty("file_path") String filePath,
    @JsonProperty("change_type") String changeType,   // created | modified | deleted | moved
    @JsonProperty("old_path") String oldPath
) implements EventPayload {
}
