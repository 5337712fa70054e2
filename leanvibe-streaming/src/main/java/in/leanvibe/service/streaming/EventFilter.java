package in.leanvibe.service.streaming;

import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.domain.event.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Decides whether an event is eligible for a client.
 *
 * Checks, in order (first failure wins):
 * 1. Channel subscription (ALL matches everything)
 * 2. Minimum priority
 * 3. Rate limit: sliding 1-second window of accepted events per client
 * 4. Custom filters: exclude_file_patterns, min_confidence
 *
 * The only state is the per-client rate window.
 */
public class EventFilter {
    private static final Logger log = LoggerFactory.getLogger(EventFilter.class);

    public static final String EXCLUDE_FILE_PATTERNS = "exclude_file_patterns";
    public static final String MIN_CONFIDENCE = "min_confidence";

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final Map<String, Deque<Long>> rateWindows = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public EventFilter() {
        this(System::nanoTime);
    }

    EventFilter(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public boolean shouldDeliver(StreamEvent event, ClientPreferences prefs) {
        if (!prefs.subscribesTo(event.channel())) {
            return false;
        }
        if (!event.priority().isAtLeast(prefs.minPriority())) {
            return false;
        }
        if (!tryAcquireRate(prefs.clientId(), prefs.maxEventsPerSecond())) {
            log.debug("[EventFilter] Rate limit reached for {} ({}/s), dropping {}",
                prefs.clientId(), prefs.maxEventsPerSecond(), event.type());
            return false;
        }
        return passesCustomFilters(event, prefs.customFilters());
    }

    /**
     * Channel, priority and custom filters only. Does not touch the rate window;
     * used to decide whether an offline client missed an event.
     */
    public boolean matchesPreferences(StreamEvent event, ClientPreferences prefs) {
        return prefs.subscribesTo(event.channel())
            && event.priority().isAtLeast(prefs.minPriority())
            && passesCustomFilters(event, prefs.customFilters());
    }

    public void forgetClient(String clientId) {
        rateWindows.remove(clientId);
    }

    private boolean tryAcquireRate(String clientId, int maxEventsPerSecond) {
        Deque<Long> window = rateWindows.computeIfAbsent(clientId, k -> new ArrayDeque<>());
        long now = nanoClock.getAsLong();

        synchronized (window) {
            while (!window.isEmpty() && now - window.peekFirst() >= WINDOW_NANOS) {
                window.pollFirst();
            }
            if (window.size() >= maxEventsPerSecond) {
                return false;
            }
            window.addLast(now);
            return true;
        }
    }

    private boolean passesCustomFilters(StreamEvent event, Map<String, Map<String, Object>> customFilters) {
        for (Map.Entry<String, Map<String, Object>> filter : customFilters.entrySet()) {
            Map<String, Object> params = filter.getValue() == null ? Map.of() : filter.getValue();
            switch (filter.getKey()) {
                case EXCLUDE_FILE_PATTERNS -> {
                    if (matchesExcludedPattern(event.filePath(), params.get("patterns"))) {
                        return false;
                    }
                }
                case MIN_CONFIDENCE -> {
                    Double confidence = event.confidenceScore();
                    if (confidence != null && confidence < threshold(params.get("threshold"))) {
                        return false;
                    }
                }
                default -> log.debug("[EventFilter] Ignoring unknown custom filter '{}'", filter.getKey());
            }
        }
        return true;
    }

    private static boolean matchesExcludedPattern(String filePath, Object patterns) {
        if (filePath == null || !(patterns instanceof Collection)) {
            return false;
        }
        for (Object pattern : (Collection<?>) patterns) {
            if (pattern != null && filePath.contains(pattern.toString())) {
                return true;
            }
        }
        return false;
    }

    private static double threshold(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                log.warn("[EventFilter] Invalid min_confidence threshold '{}', ignoring", value);
            }
        }
        return 0.0;
    }
}
