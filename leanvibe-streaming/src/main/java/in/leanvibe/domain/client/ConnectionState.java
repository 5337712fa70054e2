package in.leanvibe.domain.client;

import java.time.Instant;

/**
 * Per-client delivery state.
 *
 * All mutation and every send to the client happen while holding this
 * object's monitor, so sequence numbering never interleaves between the
 * delivery thread and a reconnection sync.
 */
public final class ConnectionState {
    private final String clientId;
    private final Instant connectedAt;
    private Instant lastSeen;
    private long sequenceNumber;
    private boolean active;
    private volatile ClientPreferences preferences;  // volatile: replaced by API threads, read by delivery thread

    public ConnectionState(String clientId, ClientPreferences preferences) {
        this.clientId = clientId;
        this.preferences = preferences;
        this.connectedAt = Instant.now();
        this.lastSeen = connectedAt;
        this.sequenceNumber = 0;
        this.active = true;
    }

    public String getClientId() {
        return clientId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public synchronized Instant getLastSeen() {
        return lastSeen;
    }

    public synchronized long getSequenceNumber() {
        return sequenceNumber;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public ClientPreferences getPreferences() {
        return preferences;
    }

    public void setPreferences(ClientPreferences preferences) {
        this.preferences = preferences;
    }

    /**
     * Sequence number the next delivered message will carry.
     * Not consumed until {@link #commitDelivery(long)}.
     */
    public synchronized long peekNextSequence() {
        return sequenceNumber + 1;
    }

    /**
     * Record a successful send stamped with {@code sequence}.
     */
    public synchronized void commitDelivery(long sequence) {
        if (sequence <= sequenceNumber) {
            throw new IllegalStateException("Sequence " + sequence + " is not after " + sequenceNumber
                + " for client " + clientId);
        }
        sequenceNumber = sequence;
        lastSeen = Instant.now();
    }

    public synchronized void touch() {
        lastSeen = Instant.now();
    }

    /**
     * Mark inactive. {@code lastSeen} keeps the time of the last successful contact.
     *
     * @return true if the client was active before this call
     */
    public synchronized boolean deactivate() {
        boolean wasActive = active;
        active = false;
        return wasActive;
    }

    public synchronized void activate() {
        active = true;
        lastSeen = Instant.now();
    }

    public synchronized ClientInfo snapshot() {
        return new ClientInfo(clientId, connectedAt, lastSeen, sequenceNumber, active, preferences);
    }
}
