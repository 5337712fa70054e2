package in.leanvibe.infrastructure.metrics;

/**
 * Streaming metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, Grafana, CloudWatch, etc.
 */
public interface StreamingMetrics {

    /**
     * Record an event accepted onto the ingestion queue.
     *
     * @param eventType wire name of the event type
     * @param priority  wire name of the priority
     */
    void recordEventEmitted(String eventType, String priority);

    /**
     * Record a message successfully handed to a client transport.
     *
     * @param messageType notification | batch_notification | session_restored
     * @param compressed  whether the binary (gzip) path was used
     * @param eventCount  events carried by the message
     */
    void recordMessageDelivered(String messageType, boolean compressed, int eventCount);

    /**
     * Record a failed delivery.
     *
     * @param reason TRANSPORT_CLOSED, SERIALIZATION, INTERNAL
     */
    void recordDeliveryFailure(String reason);

    void updateConnectedClients(int total, int active);

    void updateQueueDepth(int depth);

    void recordReconnection(boolean restored, int missedEvents);

    /**
     * @param dependency upstream dependency name
     * @param state      CLOSED | OPEN | HALF_OPEN
     */
    void updateCircuitState(String dependency, String state);

    void recordStrategySwitch(String dependency, String fromStrategy, String toStrategy);

    /**
     * No-op implementation used when metrics are not configured.
     */
    StreamingMetrics NOOP = new StreamingMetrics() {
        @Override public void recordEventEmitted(String eventType, String priority) {}
        @Override public void recordMessageDelivered(String messageType, boolean compressed, int eventCount) {}
        @Override public void recordDeliveryFailure(String reason) {}
        @Override public void updateConnectedClients(int total, int active) {}
        @Override public void updateQueueDepth(int depth) {}
        @Override public void recordReconnection(boolean restored, int missedEvents) {}
        @Override public void updateCircuitState(String dependency, String state) {}
        @Override public void recordStrategySwitch(String dependency, String fromStrategy, String toStrategy) {}
    };
}
