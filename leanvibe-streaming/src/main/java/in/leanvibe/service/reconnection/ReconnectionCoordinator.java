package in.leanvibe.service.reconnection;

import in.leanvibe.config.ReconnectionConfig;
import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.domain.event.StreamEvent;
import in.leanvibe.infrastructure.metrics.StreamingMetrics;
import in.leanvibe.service.streaming.EventStreamingService;
import in.leanvibe.service.streaming.MissedEventListener;
import in.leanvibe.transport.ClientTransport;
import in.leanvibe.transport.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bridges a dropped client connection and its re-established one.
 *
 * While a client is disconnected its engine state is kept inactive and events
 * matching its preferences are buffered here (bounded, oldest trimmed). On
 * reconnection within the grace period the buffered events are replayed in one
 * session_restored message, and sequence numbering continues where it stopped.
 *
 * A maintenance task deactivates clients whose heartbeat timed out and drops
 * sessions idle beyond the retention period.
 */
public class ReconnectionCoordinator implements MissedEventListener {
    private static final Logger log = LoggerFactory.getLogger(ReconnectionCoordinator.class);

    private final EventStreamingService streamingService;
    private final ReconnectionConfig config;
    private final Clock clock;
    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private volatile StreamingMetrics metrics = StreamingMetrics.NOOP;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "SessionMaintenance");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private ScheduledFuture<?> maintenanceTask;

    public ReconnectionCoordinator(EventStreamingService streamingService, ReconnectionConfig config) {
        this(streamingService, config, Clock.systemUTC());
    }

    ReconnectionCoordinator(EventStreamingService streamingService, ReconnectionConfig config, Clock clock) {
        this.streamingService = streamingService;
        this.config = config;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            log.warn("[Reconnection] Already running");
            return;
        }
        long intervalMs = config.maintenanceInterval().toMillis();
        log.info("[Reconnection] Starting session maintenance (interval: {}s, heartbeat timeout: {}s)",
            config.maintenanceInterval().toSeconds(), config.heartbeatTimeout().toSeconds());
        running = true;

        maintenanceTask = scheduler.scheduleWithFixedDelay(
            this::performMaintenance,
            intervalMs,
            intervalMs,
            TimeUnit.MILLISECONDS
        );
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[Reconnection] Stopping session maintenance");
        running = false;

        if (maintenanceTask != null) {
            maintenanceTask.cancel(false);
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // SESSION LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start tracking a session for a freshly registered client.
     */
    public void registerSession(String clientId, ClientInfo state) {
        sessions.put(clientId, new ClientSession(clientId, state.sequenceNumber(), clock.instant()));
        log.info("[Reconnection] Registered session for client {}", clientId);
    }

    /**
     * Record a heartbeat from the client.
     */
    public void heartbeat(String clientId) {
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            Instant now = clock.instant();
            session.lastHeartbeat = now;
            if (session.disconnectedAt == null) {
                session.lastSeen = now;
            }
        }
    }

    /**
     * The client's connection dropped. Engine state is kept but marked inactive.
     */
    public void clientDisconnected(String clientId) {
        streamingService.deactivateClient(clientId);

        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            markDisconnected(session);
        }
        log.info("[Reconnection] Client {} disconnected, session preserved for {}s",
            clientId, config.gracePeriod().toSeconds());
    }

    /**
     * Buffer an event for a disconnected client. Ignored for clients without a session.
     */
    public void recordMissedEvent(String clientId, StreamEvent event) {
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.missedEvents.addLast(new MissedEvent(event, clock.instant()));
            if (session.missedEvents.size() > config.maxMissedEvents()) {
                session.missedEvents.removeFirst();
                if (!session.trimWarned) {
                    session.trimWarned = true;
                    log.warn("[Reconnection] Missed events for client {} exceed {}, trimming oldest",
                        clientId, config.maxMissedEvents());
                }
            }
        }
    }

    @Override
    public void onMissedEvent(String clientId, StreamEvent event) {
        recordMissedEvent(clientId, event);
    }

    /**
     * The engine dropped the client on its own, e.g. after a send hit a closed transport.
     */
    @Override
    public void onClientDeactivated(String clientId) {
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            markDisconnected(session);
        }
        log.info("[Reconnection] Client {} dropped by the engine, session preserved for {}s",
            clientId, config.gracePeriod().toSeconds());
    }

    /**
     * Restore the client's session over a new transport.
     *
     * Within the grace period the engine rebinds the transport and sends a
     * session_restored message, retried with backoff. Outside it (or with no
     * retained session) the old state is dropped and the caller must register
     * the client as new.
     *
     * @throws ReconnectionExhaustedException if every sync attempt failed
     */
    public ReconnectionResult clientReconnected(String clientId, ClientTransport transport) {
        Instant now = clock.instant();
        ClientSession session = sessions.get(clientId);

        if (session == null || !streamingService.isRegistered(clientId)) {
            log.warn("[Reconnection] No session found for reconnecting client {}, starting new session", clientId);
            discard(clientId);
            metrics.recordReconnection(false, 0);
            return ReconnectionResult.newSession(now);
        }

        List<MissedEvent> replay;
        Duration disconnectedFor;
        synchronized (session) {
            // no disconnect recorded: the old connection was live until this reconnect
            Instant since = session.disconnectedAt != null ? session.disconnectedAt : now;
            disconnectedFor = Duration.between(since, now);
            if (disconnectedFor.compareTo(config.gracePeriod()) > 0) {
                log.info("[Reconnection] Client {} reconnected after {}s, grace period of {}s exceeded",
                    clientId, disconnectedFor.toSeconds(), config.gracePeriod().toSeconds());
                discard(clientId);
                metrics.recordReconnection(false, 0);
                return ReconnectionResult.newSession(now);
            }
            purgeExpired(session, now);
            replay = new ArrayList<>(session.missedEvents);
        }

        Map<String, Object> syncData = new LinkedHashMap<>();
        syncData.put("status", "reconnected");
        syncData.put("session_restored", true);
        syncData.put("missed_events_count", replay.size());
        syncData.put("missed_events", replay);
        syncData.put("disconnection_duration_ms", disconnectedFor.toMillis());

        ReconnectionPolicy policy = ReconnectionPolicy.forSessionSync(config);
        while (policy.shouldRetry()) {
            SendResult result = streamingService.reactivateClient(clientId, transport, syncData);
            if (result.isOk()) {
                policy.recordSuccess();
                return completeReconnection(clientId, session, replay, now);
            }

            policy.recordFailure();
            log.warn("[Reconnection] Session sync for client {} failed (attempt {}/{})",
                clientId, policy.getAttemptCount(), policy.getMaxAttempts());
            if (!policy.shouldRetry()) {
                break;
            }
            try {
                Thread.sleep(policy.getNextDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReconnectionExhaustedException(clientId, policy.getAttemptCount(), e);
            }
        }

        log.error("[Reconnection] Giving up on client {} after {} attempts", clientId, policy.getAttemptCount());
        metrics.recordReconnection(false, 0);
        throw new ReconnectionExhaustedException(clientId, policy.getAttemptCount());
    }

    private ReconnectionResult completeReconnection(String clientId, ClientSession session, List<MissedEvent> replay,
                                                    Instant now) {
        int replayed = replay.size();
        long sequence = streamingService.getClient(clientId).map(ClientInfo::sequenceNumber).orElse(0L);
        synchronized (session) {
            // events recorded after the replay snapshot stay buffered
            Set<MissedEvent> sent = Collections.newSetFromMap(new IdentityHashMap<>());
            sent.addAll(replay);
            session.missedEvents.removeIf(sent::contains);
            session.disconnectedAt = null;
            session.lastSeen = now;
            session.lastHeartbeat = now;
            session.sequenceNumber = sequence;
            session.reconnections++;
            session.trimWarned = false;
        }

        metrics.recordReconnection(true, replayed);
        log.info("[Reconnection] Client {} reconnected, replayed {} missed events (seq {})",
            clientId, replayed, sequence);
        // the sync message itself carries sequence; the client last saw the one before
        return new ReconnectionResult(true, replayed, now, sequence - 1);
    }

    /**
     * Drop the session and the client's engine state.
     */
    public void discard(String clientId) {
        sessions.remove(clientId);
        streamingService.unregisterClient(clientId);
    }

    // ═══════════════════════════════════════════════════════════════
    // MAINTENANCE
    // ═══════════════════════════════════════════════════════════════

    private void performMaintenance() {
        try {
            detectHeartbeatTimeouts();
            cleanupExpiredSessions();
        } catch (Exception e) {
            log.error("[Reconnection] Error in session maintenance: {}", e.getMessage(), e);
        }
    }

    /**
     * Deactivate connected clients whose last heartbeat is older than the timeout.
     * Clients that never sent a heartbeat are not tracked.
     *
     * @return ids of clients deactivated by this sweep
     */
    List<String> detectHeartbeatTimeouts() {
        Instant now = clock.instant();
        List<String> timedOut = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            synchronized (session) {
                if (session.disconnectedAt != null || session.lastHeartbeat == null) {
                    continue;
                }
                if (Duration.between(session.lastHeartbeat, now).compareTo(config.heartbeatTimeout()) > 0) {
                    markDisconnected(session);
                    timedOut.add(session.clientId);
                }
            }
        }
        for (String clientId : timedOut) {
            log.warn("[Reconnection] Client {} heartbeat timeout detected, deactivating", clientId);
            streamingService.deactivateClient(clientId);
        }
        return timedOut;
    }

    /**
     * Drop disconnected sessions idle beyond the retention period, and expired missed events.
     *
     * @return ids of sessions removed
     */
    List<String> cleanupExpiredSessions() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            synchronized (session) {
                if (session.disconnectedAt != null
                        && Duration.between(session.lastSeen, now).compareTo(config.missedEventRetention()) > 0) {
                    expired.add(session.clientId);
                    continue;
                }
                int purged = purgeExpired(session, now);
                if (purged > 0) {
                    log.info("[Reconnection] Cleaned up {} old missed events for {}", purged, session.clientId);
                }
            }
        }
        for (String clientId : expired) {
            discard(clientId);
            log.info("[Reconnection] Cleaned up expired session for client {}", clientId);
        }
        return expired;
    }

    private int purgeExpired(ClientSession session, Instant now) {
        Instant cutoff = now.minus(config.missedEventRetention());
        int purged = 0;
        while (!session.missedEvents.isEmpty() && session.missedEvents.peekFirst().missedAt().isBefore(cutoff)) {
            session.missedEvents.removeFirst();
            purged++;
        }
        return purged;
    }

    private void markDisconnected(ClientSession session) {
        if (session.disconnectedAt == null) {
            Instant now = clock.instant();
            session.disconnectedAt = now;
            session.lastSeen = now;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // INTROSPECTION
    // ═══════════════════════════════════════════════════════════════

    public Optional<SessionInfo> getSessionInfo(String clientId) {
        ClientSession session = sessions.get(clientId);
        return session == null ? Optional.empty() : Optional.of(toInfo(session, clock.instant()));
    }

    public SessionsSnapshot getSessionInfo() {
        Instant now = clock.instant();
        Map<String, SessionInfo> infos = new TreeMap<>();
        int disconnected = 0;
        for (ClientSession session : sessions.values()) {
            SessionInfo info = toInfo(session, now);
            infos.put(info.clientId(), info);
            if (info.disconnectedAt() != null) {
                disconnected++;
            }
        }
        return new SessionsSnapshot(infos.size(), disconnected, config.gracePeriod().toSeconds(),
            config.maxMissedEvents(), infos);
    }

    public int missedEventCount(String clientId) {
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return 0;
        }
        synchronized (session) {
            return session.missedEvents.size();
        }
    }

    private SessionInfo toInfo(ClientSession session, Instant now) {
        long sequence = streamingService.getClient(session.clientId)
            .map(ClientInfo::sequenceNumber)
            .orElse(session.sequenceNumber);
        synchronized (session) {
            boolean eligible = session.disconnectedAt == null
                || Duration.between(session.disconnectedAt, now).compareTo(config.gracePeriod()) <= 0;
            return new SessionInfo(
                session.clientId,
                session.lastSeen,
                session.lastHeartbeat,
                session.disconnectedAt,
                sequence,
                session.missedEvents.size(),
                session.reconnections,
                eligible);
        }
    }

    public void setMetrics(StreamingMetrics metrics) {
        this.metrics = metrics != null ? metrics : StreamingMetrics.NOOP;
    }

    /**
     * Retained session. Guarded by its own monitor.
     */
    private static final class ClientSession {
        final String clientId;
        final Deque<MissedEvent> missedEvents = new ArrayDeque<>();
        Instant lastSeen;
        Instant lastHeartbeat;
        Instant disconnectedAt;
        long sequenceNumber;
        int reconnections;
        boolean trimWarned;

        ClientSession(String clientId, long sequenceNumber, Instant now) {
            this.clientId = clientId;
            this.sequenceNumber = sequenceNumber;
            this.lastSeen = now;
        }
    }
}
