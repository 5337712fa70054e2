package in.leanvibe.infrastructure.resilience;

/**
 * Outcome of a call made through a {@link CircuitBreaker}.
 *
 * @param status what happened to the call
 * @param value  the operation's return value when {@code status == SUCCESS}
 * @param error  the operation's exception when {@code status == FAILED}
 */
public record UpstreamResult<T>(Status status, T value, Throwable error) {

    public enum Status {
        SUCCESS,
        FAILED,
        SHORT_CIRCUITED
    }

    public static <T> UpstreamResult<T> success(T value) {
        return new UpstreamResult<>(Status.SUCCESS, value, null);
    }

    public static <T> UpstreamResult<T> failed(Throwable error) {
        return new UpstreamResult<>(Status.FAILED, null, error);
    }

    public static <T> UpstreamResult<T> shortCircuited() {
        return new UpstreamResult<>(Status.SHORT_CIRCUITED, null, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
