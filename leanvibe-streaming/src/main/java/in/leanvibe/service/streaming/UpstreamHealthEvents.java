package in.leanvibe.service.streaming;

import in.leanvibe.domain.event.EventType;
import in.leanvibe.domain.event.StreamEvent;
import in.leanvibe.domain.event.StreamEvents;
import in.leanvibe.infrastructure.resilience.StrategySwitchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Publishes upstream strategy switches to clients on the SYSTEM channel:
 * a failover becomes {@code system_degraded}, a return to primary {@code system_recovered}.
 *
 * Register with {@code selector.onStrategySwitch(new UpstreamHealthEvents(service))}.
 */
public final class UpstreamHealthEvents implements Consumer<StrategySwitchEvent> {
    private static final Logger log = LoggerFactory.getLogger(UpstreamHealthEvents.class);

    static final Duration EMIT_TIMEOUT = Duration.ofMillis(100);

    private final EventStreamingService streamingService;

    public UpstreamHealthEvents(EventStreamingService streamingService) {
        this.streamingService = streamingService;
    }

    @Override
    public void accept(StrategySwitchEvent switchEvent) {
        StreamEvent event = toStreamEvent(switchEvent);
        try {
            if (!streamingService.tryEmitEvent(event, EMIT_TIMEOUT)) {
                log.warn("[UpstreamHealth] Queue full, {} notice for {} dropped",
                    event.type().wireName(), switchEvent.dependency());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[UpstreamHealth] Interrupted while emitting {} notice", event.type().wireName());
        }
    }

    static StreamEvent toStreamEvent(StrategySwitchEvent switchEvent) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependency", switchEvent.dependency());
        details.put("from_strategy", switchEvent.fromStrategy());
        details.put("to_strategy", switchEvent.toStrategy());
        details.put("health_score", switchEvent.healthScore());

        if (switchEvent.isFailover()) {
            return StreamEvents.system(EventType.SYSTEM_DEGRADED,
                switchEvent.dependency() + " degraded, switched to " + switchEvent.toStrategy(), details);
        }
        return StreamEvents.system(EventType.SYSTEM_RECOVERED,
            switchEvent.dependency() + " recovered, back on " + switchEvent.toStrategy(), details);
    }
}
