package in.leanvibe.domain.event;

/**
 * Kind-specific body of a {@link StreamEvent}.
 *
 * Custom client filters only look at the file path and confidence score,
 * so every payload kind answers both (null when not applicable).
 */
public interface EventPayload {

    default String filePath() {
        return null;
    }

    default Double confidenceScore() {
        return null;
    }
}
