package in.leanvibe.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of StreamingMetrics.
 *
 * Key Metrics:
 * - streaming_events_emitted_total{type, priority} - Events accepted for distribution
 * - streaming_messages_delivered_total{message_type, compressed} - Messages sent to clients
 * - streaming_batch_size - Events per delivered message
 * - streaming_delivery_failures_total{reason} - Failed deliveries
 * - streaming_clients{state} - Registered clients (active / total)
 * - streaming_queue_depth - Ingestion queue depth
 * - streaming_reconnections_total{outcome} - Reconnection outcomes
 * - upstream_circuit_state{dependency} - 0=CLOSED, 1=HALF_OPEN, 2=OPEN
 * - upstream_strategy_switches_total{dependency, from, to} - Strategy failovers
 *
 * Usage:
 * <pre>
 * PrometheusStreamingMetrics metrics = new PrometheusStreamingMetrics();
 * streamingService.setMetrics(metrics);
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusStreamingMetrics implements StreamingMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusStreamingMetrics.class);

    private final CollectorRegistry registry;

    private final Counter eventsEmitted;
    private final Counter messagesDelivered;
    private final Histogram batchSize;
    private final Counter deliveryFailures;
    private final Gauge clients;
    private final Gauge queueDepth;
    private final Counter reconnections;
    private final Histogram missedEventsReplayed;
    private final Gauge circuitState;
    private final Counter strategySwitches;

    public PrometheusStreamingMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamingMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsEmitted = Counter.build()
            .name("streaming_events_emitted_total")
            .help("Total number of events accepted for distribution")
            .labelNames("type", "priority")
            .register(registry);

        this.messagesDelivered = Counter.build()
            .name("streaming_messages_delivered_total")
            .help("Total number of messages delivered to clients")
            .labelNames("message_type", "compressed")
            .register(registry);

        this.batchSize = Histogram.build()
            .name("streaming_batch_size")
            .help("Number of events per delivered message")
            .buckets(1, 2, 5, 10, 20)
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("streaming_delivery_failures_total")
            .help("Total number of failed deliveries")
            .labelNames("reason")
            .register(registry);

        this.clients = Gauge.build()
            .name("streaming_clients")
            .help("Registered streaming clients")
            .labelNames("state")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("streaming_queue_depth")
            .help("Events waiting in the ingestion queue")
            .register(registry);

        this.reconnections = Counter.build()
            .name("streaming_reconnections_total")
            .help("Total number of client reconnections")
            .labelNames("outcome")
            .register(registry);

        this.missedEventsReplayed = Histogram.build()
            .name("streaming_missed_events_replayed")
            .help("Missed events reported per restored session")
            .buckets(0, 1, 10, 100, 1000)
            .register(registry);

        this.circuitState = Gauge.build()
            .name("upstream_circuit_state")
            .help("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
            .labelNames("dependency")
            .register(registry);

        this.strategySwitches = Counter.build()
            .name("upstream_strategy_switches_total")
            .help("Total number of upstream strategy switches")
            .labelNames("dependency", "from", "to")
            .register(registry);

        log.info("[PrometheusStreamingMetrics] Initialized streaming metrics");
    }

    @Override
    public void recordEventEmitted(String eventType, String priority) {
        eventsEmitted.labels(eventType, priority).inc();
    }

    @Override
    public void recordMessageDelivered(String messageType, boolean compressed, int eventCount) {
        messagesDelivered.labels(messageType, String.valueOf(compressed)).inc();
        batchSize.observe(eventCount);
    }

    @Override
    public void recordDeliveryFailure(String reason) {
        deliveryFailures.labels(reason).inc();
    }

    @Override
    public void updateConnectedClients(int total, int active) {
        clients.labels("total").set(total);
        clients.labels("active").set(active);
    }

    @Override
    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    @Override
    public void recordReconnection(boolean restored, int missedEvents) {
        reconnections.labels(restored ? "restored" : "new_session").inc();
        if (restored) {
            missedEventsReplayed.observe(missedEvents);
        }
    }

    @Override
    public void updateCircuitState(String dependency, String state) {
        double value = switch (state) {
            case "OPEN" -> 2;
            case "HALF_OPEN" -> 1;
            default -> 0;
        };
        circuitState.labels(dependency).set(value);
    }

    @Override
    public void recordStrategySwitch(String dependency, String fromStrategy, String toStrategy) {
        strategySwitches.labels(dependency, fromStrategy, toStrategy).inc();
    }

    /**
     * Get the Prometheus registry for exposing metrics.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
