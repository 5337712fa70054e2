package in.leanvibe.service.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.leanvibe.config.StreamingConfig;
import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.domain.client.ConnectionState;
import in.leanvibe.domain.event.EventType;
import in.leanvibe.domain.event.StreamEvent;
import in.leanvibe.domain.event.StreamEvents;
import in.leanvibe.infrastructure.metrics.StreamingMetrics;
import in.leanvibe.service.streaming.ConnectionRegistry.RegisteredClient;
import in.leanvibe.transport.ClientTransport;
import in.leanvibe.transport.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Real-time event distribution engine.
 *
 * Producers call {@link #emitEvent(StreamEvent)}; events go through a bounded
 * ingestion queue and are delivered by a single delivery thread:
 * <pre>
 * queue -> for each client: EventFilter -> EventBatcher -> StreamingMessage
 *       -> CompressionManager (opt-in) -> ClientTransport
 * </pre>
 *
 * Threading:
 * - The processing loop and every batch-timer flush run on one delivery thread,
 *   so batching and sequence numbering for a client never interleave.
 * - Register/unregister/update calls come from API threads and only touch
 *   concurrent maps or per-client state under its monitor.
 * - Every send to a client holds that client's {@link ConnectionState} monitor.
 *
 * Failure isolation: a closed transport deactivates only that client; any
 * exception while processing one client is logged and counted, the loop goes on.
 */
public final class EventStreamingService {
    private static final Logger log = LoggerFactory.getLogger(EventStreamingService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final StreamingConfig config;
    private final BlockingQueue<StreamEvent> eventQueue;
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final EventFilter eventFilter;
    private final CompressionManager compressionManager = new CompressionManager();
    private final StreamingStats stats = new StreamingStats();
    private final ScheduledExecutorService deliveryExecutor;
    private final EventBatcher eventBatcher;

    private volatile Thread deliveryThread;
    private volatile boolean running = false;
    private ScheduledFuture<?> processingTask;

    private volatile StreamingMetrics metrics = StreamingMetrics.NOOP;
    private volatile MissedEventListener missedEventListener;

    public EventStreamingService(StreamingConfig config) {
        this(config, new EventFilter());
    }

    EventStreamingService(StreamingConfig config, EventFilter eventFilter) {
        this.config = config;
        this.eventFilter = eventFilter;
        this.eventQueue = new LinkedBlockingQueue<>(config.queueCapacity());
        this.deliveryExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-delivery");
            t.setDaemon(true);
            deliveryThread = t;
            return t;
        });
        this.eventBatcher = new EventBatcher(deliveryExecutor, this::onBatchFlushed);
        log.info("[Streaming] Event streaming service initialized (queue capacity: {})", config.queueCapacity());
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start the processing loop. No-op if already running.
     */
    public synchronized void start() {
        if (running) {
            log.debug("[Streaming] Already running");
            return;
        }
        running = true;
        processingTask = deliveryExecutor.scheduleWithFixedDelay(
            this::processQueue, 0, config.pollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("[Streaming] Event streaming service started (poll interval: {}ms)", config.pollIntervalMs());
    }

    /**
     * Stop the processing loop and cancel all batch timers.
     * Returns after any in-flight delivery on the delivery thread has finished;
     * nothing is delivered after this method returns. No-op if not running.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (processingTask != null) {
            processingTask.cancel(false);
            processingTask = null;
        }
        eventBatcher.cancelAll();
        awaitDeliveryThreadIdle();

        log.info("[Streaming] Event streaming service stopped ({} events left in queue)", eventQueue.size());
    }

    /**
     * Stop and release the delivery thread. The service cannot be restarted afterwards.
     */
    public void shutdown() {
        stop();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wait for a no-op task queued behind whatever the delivery thread is doing.
     */
    private void awaitDeliveryThreadIdle() {
        if (Thread.currentThread() == deliveryThread || deliveryExecutor.isShutdown()) {
            return;
        }
        try {
            deliveryExecutor.submit(() -> { }).get(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Streaming] Delivery thread did not become idle: {}", e.toString());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // CLIENT LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a client. Re-registering an id replaces its previous state,
     * including sequence numbering and any buffered batch.
     *
     * @param preferences null for {@link ClientPreferences#defaults(String)}
     */
    public ClientInfo registerClient(String clientId, ClientTransport transport, ClientPreferences preferences) {
        ClientPreferences prefs = preferences != null ? preferences : ClientPreferences.defaults(clientId);
        RegisteredClient previous = registry.register(clientId, transport, prefs);
        if (previous != null) {
            eventBatcher.cancel(clientId);
            eventFilter.forgetClient(clientId);
            log.info("[Streaming] Client {} re-registered, previous state replaced", clientId);
        } else {
            log.info("[Streaming] Client {} registered for event streaming", clientId);
        }
        updateClientGauges();
        return registry.get(clientId).state().snapshot();
    }

    public void unregisterClient(String clientId) {
        RegisteredClient removed = registry.remove(clientId);
        eventBatcher.cancel(clientId);
        eventFilter.forgetClient(clientId);
        updateClientGauges();
        if (removed != null) {
            log.info("[Streaming] Client {} unregistered from event streaming", clientId);
        }
    }

    /**
     * Replace a client's preferences. Sequence number and active flag are kept.
     *
     * @return false if the client is not registered
     */
    public boolean updateClientPreferences(String clientId, ClientPreferences preferences) {
        RegisteredClient client = registry.get(clientId);
        if (client == null) {
            log.warn("[Streaming] Preferences update for unknown client {}", clientId);
            return false;
        }
        if (!clientId.equals(preferences.clientId())) {
            throw new IllegalArgumentException("Preferences belong to " + preferences.clientId() + ", not " + clientId);
        }
        client.state().setPreferences(preferences);
        log.info("[Streaming] Updated preferences for client {}", clientId);
        return true;
    }

    /**
     * Mark a client inactive without removing its state (connection dropped).
     * Events matching its preferences are reported as missed until it reconnects.
     */
    public boolean deactivateClient(String clientId) {
        RegisteredClient client = registry.get(clientId);
        if (client == null) {
            return false;
        }
        boolean wasActive;
        synchronized (client.state()) {
            wasActive = client.state().deactivate();
        }
        updateClientGauges();
        if (wasActive) {
            log.info("[Streaming] Client {} deactivated, state retained", clientId);
            notifyDeactivated(clientId);
        }
        return wasActive;
    }

    /**
     * Bind a new transport to a retained client and send the session sync message.
     * The client is marked active only if the sync message was sent.
     * The message carries the next sequence number, so numbering continues
     * from the disconnected session.
     *
     * @param syncData body of the session_restored message; last_sequence_number is added here
     */
    public SendResult reactivateClient(String clientId, ClientTransport transport, Map<String, Object> syncData) {
        RegisteredClient client = registry.get(clientId);
        if (client == null) {
            throw new IllegalArgumentException("Unknown client: " + clientId);
        }

        ConnectionState state = client.state();
        SendResult result;
        synchronized (state) {
            client.bindTransport(transport);
            long sequence = state.peekNextSequence();

            Map<String, Object> data = new LinkedHashMap<>(syncData);
            data.put("last_sequence_number", sequence - 1);

            StreamingMessage message = StreamingMessage.sessionRestored(data, sequence);
            result = transmit(client, message, List.of());
            if (result.isOk()) {
                state.activate();
            }
        }
        updateClientGauges();
        return result;
    }

    public boolean isRegistered(String clientId) {
        return registry.contains(clientId);
    }

    public Optional<ClientInfo> getClient(String clientId) {
        RegisteredClient client = registry.get(clientId);
        return client == null ? Optional.empty() : Optional.of(client.state().snapshot());
    }

    // ═══════════════════════════════════════════════════════════════
    // INGESTION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Enqueue an event for distribution. Blocks while the ingestion queue is full.
     * Aggregate stats are updated here, not at delivery time.
     */
    public void emitEvent(StreamEvent event) throws InterruptedException {
        eventQueue.put(event);
        recordEmitted(event);
    }

    /**
     * Enqueue an event, waiting at most {@code timeout} for queue space.
     *
     * @return false if the queue stayed full; stats are not updated in that case
     */
    public boolean tryEmitEvent(StreamEvent event, Duration timeout) throws InterruptedException {
        if (!eventQueue.offer(event, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("[Streaming] Ingestion queue full, dropped {} event {}", event.type().wireName(), event.id());
            return false;
        }
        recordEmitted(event);
        return true;
    }

    public void emitFileChange(String filePath, String changeType, String oldPath) throws InterruptedException {
        emitEvent(StreamEvents.fileChange(filePath, changeType, oldPath));
    }

    public void emitAnalysisCompleted(String analysisType, String filePath, double processingTimeSeconds)
            throws InterruptedException {
        emitEvent(StreamEvents.analysis(analysisType, filePath, true, processingTimeSeconds));
    }

    public void emitViolationDetected(String violationId, String violationType, String severity,
                                      String filePath, String description) throws InterruptedException {
        emitEvent(StreamEvents.violation(violationId, violationType, severity, filePath, description));
    }

    public void emitAgentEvent(String sessionId, EventType type, String query) throws InterruptedException {
        emitEvent(StreamEvents.agent(sessionId, type, query));
    }

    private void recordEmitted(StreamEvent event) {
        stats.recordEmitted(event.type(), event.priority());
        metrics.recordEventEmitted(event.type().wireName(), event.priority().wireName());
    }

    // ═══════════════════════════════════════════════════════════════
    // PROCESSING LOOP (delivery thread)
    // ═══════════════════════════════════════════════════════════════

    private void processQueue() {
        try {
            int processed = 0;
            StreamEvent event;
            while (running && processed < config.maxEventsPerTick() && (event = eventQueue.poll()) != null) {
                deliverEvent(event);
                processed++;
            }
            metrics.updateQueueDepth(eventQueue.size());
        } catch (Exception e) {
            // must not escape: an exception would cancel the scheduled loop
            log.error("[Streaming] Error processing event queue: {}", e.getMessage(), e);
        }
    }

    /**
     * Deliver one event to every registered client.
     */
    void deliverEvent(StreamEvent event) {
        for (RegisteredClient client : registry.clients()) {
            try {
                processClient(client, event);
            } catch (Exception e) {
                log.error("[Streaming] Error delivering {} to client {}: {}",
                    event.type().wireName(), client.clientId(), e.getMessage(), e);
                stats.recordFailedDelivery();
                metrics.recordDeliveryFailure("INTERNAL");
            }
        }
    }

    private void processClient(RegisteredClient client, StreamEvent event) {
        ConnectionState state = client.state();
        ClientPreferences prefs = state.getPreferences();

        if (!state.isActive()) {
            trackMissed(client.clientId(), prefs, event);
            return;
        }

        if (!eventFilter.shouldDeliver(event, prefs)) {
            return;
        }

        Optional<List<StreamEvent>> batch = eventBatcher.addEvent(client.clientId(), event, prefs);
        batch.ifPresent(events -> sendBatch(client, events));
    }

    private void onBatchFlushed(String clientId, List<StreamEvent> events) {
        RegisteredClient client = registry.get(clientId);
        if (client == null) {
            return;
        }
        try {
            sendBatch(client, events);
        } catch (Exception e) {
            log.error("[Streaming] Error flushing batch to client {}: {}", clientId, e.getMessage(), e);
            stats.recordFailedDelivery();
            metrics.recordDeliveryFailure("INTERNAL");
        }
    }

    private void sendBatch(RegisteredClient client, List<StreamEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        ConnectionState state = client.state();
        synchronized (state) {
            if (registry.get(client.clientId()) != client) {
                return;  // unregistered or replaced while the batch was pending
            }
            if (!state.isActive()) {
                for (StreamEvent event : events) {
                    trackMissed(client.clientId(), state.getPreferences(), event);
                }
                return;
            }

            long sequence = state.peekNextSequence();
            StreamingMessage message = events.size() == 1
                ? StreamingMessage.notification(events.get(0), sequence)
                : StreamingMessage.batch(events, sequence, state.getPreferences().enableCompression());

            transmit(client, message, events);
        }
    }

    /**
     * Serialize, optionally compress, and send. Caller holds the client's state monitor.
     * Commits the sequence number on success. On a closed transport the client is
     * deactivated and the events the message carried are reported as missed.
     */
    private SendResult transmit(RegisteredClient client, StreamingMessage message, List<StreamEvent> events) {
        ConnectionState state = client.state();
        String json;
        try {
            json = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.messageType()
                + " for client " + client.clientId(), e);
        }

        boolean compressed = false;
        SendResult result;
        ClientTransport transport = client.transport();
        if (state.getPreferences().enableCompression()) {
            CompressionResult payload = compressionManager.compressMessage(json);
            compressed = payload.compressed();
            result = compressed ? transport.sendBytes(payload.bytes()) : transport.sendText(json);
        } else {
            result = transport.sendText(json);
        }

        if (result.isOk()) {
            state.commitDelivery(message.sequenceNumber());
            stats.recordDelivered(compressed);
            metrics.recordMessageDelivered(message.messageType(), compressed, events.size());
            return result;
        }

        boolean wasActive = state.deactivate();
        stats.recordFailedDelivery();
        metrics.recordDeliveryFailure(result.name());
        updateClientGauges();
        log.warn("[Streaming] Transport closed for client {}, marking inactive (seq {} not delivered)",
            client.clientId(), message.sequenceNumber());
        if (wasActive) {
            notifyDeactivated(client.clientId());
        }
        for (StreamEvent event : events) {
            trackMissed(client.clientId(), state.getPreferences(), event);
        }
        return result;
    }

    private void trackMissed(String clientId, ClientPreferences prefs, StreamEvent event) {
        MissedEventListener listener = missedEventListener;
        if (listener == null || !eventFilter.matchesPreferences(event, prefs)) {
            return;
        }
        listener.onMissedEvent(clientId, event);
        stats.recordMissedEvent();
        log.debug("[Streaming] Tracked missed {} for inactive client {}", event.type().wireName(), clientId);
    }

    private void notifyDeactivated(String clientId) {
        MissedEventListener listener = missedEventListener;
        if (listener != null) {
            listener.onClientDeactivated(clientId);
        }
    }

    private void updateClientGauges() {
        stats.setConnectedClients(registry.size());
        metrics.updateConnectedClients(registry.size(), registry.activeCount());
    }

    // ═══════════════════════════════════════════════════════════════
    // INTROSPECTION
    // ═══════════════════════════════════════════════════════════════

    public StatsSnapshot getStats() {
        return stats.snapshot(eventQueue.size());
    }

    public Map<String, ClientInfo> getClientInfo() {
        return registry.snapshot();
    }

    int pendingBatchSize(String clientId) {
        return eventBatcher.pendingCount(clientId);
    }

    // ═══════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ═══════════════════════════════════════════════════════════════

    public void setMetrics(StreamingMetrics metrics) {
        this.metrics = metrics != null ? metrics : StreamingMetrics.NOOP;
    }

    public void setMissedEventListener(MissedEventListener listener) {
        this.missedEventListener = listener;
    }
}
