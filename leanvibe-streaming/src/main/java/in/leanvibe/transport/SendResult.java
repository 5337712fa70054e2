package in.leanvibe.transport;

/**
 * Outcome of a single send on a {@link ClientTransport}.
 */
public enum SendResult {
    OK,
    TRANSPORT_CLOSED;

    public boolean isOk() {
        return this == OK;
    }
}
