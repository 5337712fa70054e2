package in.leanvibe.service.streaming;

import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.domain.event.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-client event batching between filtering and transmission.
 *
 * Batching disabled: every event is returned immediately as a singleton batch.
 * Batching enabled: events are buffered until either
 * - the buffer reaches {@link #MAX_BATCH_SIZE} (flushed synchronously to the caller), or
 * - the client's flush timer fires {@code batchInterval} after the first buffered event
 *   (flushed to the {@link FlushListener}).
 *
 * A client has at most one outstanding timer. The window is anchored to the first
 * buffered event; later events never reschedule it.
 */
public class EventBatcher {
    private static final Logger log = LoggerFactory.getLogger(EventBatcher.class);

    public static final int MAX_BATCH_SIZE = 20;

    /**
     * Receives batches flushed by a timer.
     */
    @FunctionalInterface
    public interface FlushListener {
        void onFlush(String clientId, List<StreamEvent> batch);
    }

    private final ScheduledExecutorService timerExecutor;
    private final FlushListener flushListener;
    private final Map<String, PendingBatch> pending = new ConcurrentHashMap<>();

    public EventBatcher(ScheduledExecutorService timerExecutor, FlushListener flushListener) {
        this.timerExecutor = timerExecutor;
        this.flushListener = flushListener;
    }

    /**
     * Add an event to the client's batch.
     *
     * @return the batch to send now, or empty if the event was buffered
     */
    public Optional<List<StreamEvent>> addEvent(String clientId, StreamEvent event, ClientPreferences prefs) {
        if (!prefs.enableBatching()) {
            return Optional.of(List.of(event));
        }

        PendingBatch batch = pending.computeIfAbsent(clientId, k -> new PendingBatch());
        synchronized (batch) {
            batch.events.add(event);

            if (batch.events.size() >= MAX_BATCH_SIZE) {
                batch.cancelTimer();
                log.debug("[EventBatcher] Size flush for {} ({} events)", clientId, batch.events.size());
                return Optional.of(batch.drain());
            }

            if (batch.timer == null) {
                scheduleFlush(clientId, batch, prefs.batchIntervalMs());
            }
            return Optional.empty();
        }
    }

    /**
     * Drop the client's buffered events and cancel its timer.
     */
    public void cancel(String clientId) {
        PendingBatch batch = pending.remove(clientId);
        if (batch == null) {
            return;
        }
        synchronized (batch) {
            batch.cancelTimer();
            int dropped = batch.events.size();
            batch.events.clear();
            if (dropped > 0) {
                log.debug("[EventBatcher] Discarded {} buffered events for {}", dropped, clientId);
            }
        }
    }

    public void cancelAll() {
        for (String clientId : new ArrayList<>(pending.keySet())) {
            cancel(clientId);
        }
    }

    public int pendingCount(String clientId) {
        PendingBatch batch = pending.get(clientId);
        if (batch == null) {
            return 0;
        }
        synchronized (batch) {
            return batch.events.size();
        }
    }

    public boolean hasPendingTimer(String clientId) {
        PendingBatch batch = pending.get(clientId);
        if (batch == null) {
            return false;
        }
        synchronized (batch) {
            return batch.timer != null;
        }
    }

    private void scheduleFlush(String clientId, PendingBatch batch, long delayMs) {
        long token = ++batch.timerToken;
        try {
            batch.timer = timerExecutor.schedule(
                () -> onTimer(clientId, batch, token), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // executor shut down: events stay buffered until the next size flush or cancel
            log.warn("[EventBatcher] Cannot schedule flush for {}: {}", clientId, e.toString());
        }
    }

    private void onTimer(String clientId, PendingBatch batch, long token) {
        List<StreamEvent> events;
        synchronized (batch) {
            if (batch.timerToken != token || batch.timer == null) {
                return;  // superseded by a size flush or cancelled
            }
            batch.timer = null;
            events = batch.drain();
        }

        if (events.isEmpty()) {
            return;
        }

        try {
            flushListener.onFlush(clientId, events);
        } catch (Exception e) {
            log.error("[EventBatcher] Flush listener failed for {}: {}", clientId, e.getMessage(), e);
        }
    }

    private static final class PendingBatch {
        final List<StreamEvent> events = new ArrayList<>();
        ScheduledFuture<?> timer;
        long timerToken;

        List<StreamEvent> drain() {
            List<StreamEvent> out = List.copyOf(events);
            events.clear();
            return out;
        }

        void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
    }
}
