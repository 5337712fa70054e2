package in.leanvibe.infrastructure.resilience;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an {@link UpstreamGuard} call.
 *
 * @param value    operation result, or the fallback's result when degraded
 * @param degraded true when the fallback was used
 * @param message  human-readable status, set when degraded
 * @param strategy strategy in use when the call completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuardedResult<T>(
    @JsonProperty("value") T value,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("message") String message,
    @JsonProperty("strategy") String strategy
) {
    public static final String DEGRADED_MESSAGE = "service degraded, using fallback";
    public static final String UNAVAILABLE_MESSAGE = "service unavailable";

    public static <T> GuardedResult<T> ok(T value, String strategy) {
        return new GuardedResult<>(value, false, null, strategy);
    }

    public static <T> GuardedResult<T> degraded(T fallbackValue, String strategy) {
        return new GuardedResult<>(fallbackValue, true, DEGRADED_MESSAGE, strategy);
    }

    public static <T> GuardedResult<T> unavailable(String strategy) {
        return new GuardedResult<>(null, true, UNAVAILABLE_MESSAGE, strategy);
    }
}
