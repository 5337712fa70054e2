package in.leanvibe.service.reconnection;

/**
 * Thrown when every session sync attempt for a reconnecting client failed.
 */
public class ReconnectionExhaustedException extends RuntimeException {
    private final String clientId;
    private final int attempts;

    public ReconnectionExhaustedException(String clientId, int attempts) {
        super("Reconnection of client " + clientId + " failed after " + attempts + " attempts");
        this.clientId = clientId;
        this.attempts = attempts;
    }

    public ReconnectionExhaustedException(String clientId, int attempts, Throwable cause) {
        super("Reconnection of client " + clientId + " interrupted after " + attempts + " attempts", cause);
        this.clientId = clientId;
        this.attempts = attempts;
    }

    public String getClientId() {
        return clientId;
    }

    public int getAttempts() {
        return attempts;
    }
}
