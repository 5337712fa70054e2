package in.leanvibe.infrastructure.resilience;

import in.leanvibe.config.ResilienceConfig;
import in.leanvibe.infrastructure.metrics.StreamingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Health-driven strategy failover for a {@link StrategyBackedDependency}.
 *
 * Each evaluation reads the dependency's health score:
 * - below {@code failoverThreshold}: switch to the next lower-ranked available strategy
 * - above {@code recoveryThreshold} while off primary and primary is available: switch back to primary
 * - otherwise: no change
 *
 * Evaluations run periodically once started, and immediately on {@link #reportDegraded()}.
 *
 * Usage:
 * <pre>
 * StrategySelector selector = new StrategySelector(inferenceBackend, ResilienceConfig.defaults());
 * selector.onStrategySwitch(event -&gt; log.warn("Switched: {}", event));
 * selector.start();
 * </pre>
 */
public class StrategySelector {
    private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

    private final StrategyBackedDependency dependency;
    private final ResilienceConfig config;
    private final List<Consumer<StrategySwitchEvent>> listeners = new CopyOnWriteArrayList<>();
    private volatile StreamingMetrics metrics = StreamingMetrics.NOOP;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "UpstreamHealthMonitor");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private ScheduledFuture<?> evaluationTask;

    public StrategySelector(StrategyBackedDependency dependency, ResilienceConfig config) {
        if (dependency.rankedStrategies().isEmpty()) {
            throw new IllegalArgumentException("Dependency " + dependency.name() + " has no strategies");
        }
        this.dependency = dependency;
        this.config = config;
    }

    /**
     * Start periodic health evaluation.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[StrategySelector] Already running");
            return;
        }
        long intervalMs = config.healthCheckInterval().toMillis();
        log.info("[StrategySelector] Starting health evaluation for {} (interval: {}s)",
            dependency.name(), config.healthCheckInterval().toSeconds());
        running = true;

        evaluationTask = scheduler.scheduleWithFixedDelay(
            this::performEvaluation,
            intervalMs,
            intervalMs,
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop periodic evaluation and release the scheduler thread.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[StrategySelector] Stopping health evaluation for {}", dependency.name());
        running = false;

        if (evaluationTask != null) {
            evaluationTask.cancel(false);
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Evaluate now instead of waiting for the next scheduled check.
     */
    public Optional<StrategySwitchEvent> reportDegraded() {
        log.debug("[StrategySelector] Degradation reported for {}, evaluating now", dependency.name());
        return evaluate();
    }

    /**
     * Read health and switch strategy if a threshold is crossed.
     *
     * @return the switch performed, if any
     */
    public synchronized Optional<StrategySwitchEvent> evaluate() {
        HealthReport report = dependency.health();
        String current = dependency.currentStrategy();
        List<String> ranked = dependency.rankedStrategies();
        String primary = ranked.get(0);

        if (report.score() < config.failoverThreshold()) {
            Optional<String> fallback = nextAvailableBelow(ranked, current, report);
            if (fallback.isEmpty()) {
                log.warn("[StrategySelector] {} health {} below {} on '{}', no lower-ranked strategy available",
                    dependency.name(), report.score(), config.failoverThreshold(), current);
                return Optional.empty();
            }
            return Optional.of(switchTo(current, fallback.get(), StrategySwitchEvent.Reason.FAILOVER, report.score()));
        }

        if (report.score() > config.recoveryThreshold()
                && !primary.equals(current)
                && report.isAvailable(primary)) {
            return Optional.of(switchTo(current, primary, StrategySwitchEvent.Reason.RECOVERY, report.score()));
        }

        return Optional.empty();
    }

    public String currentStrategy() {
        return dependency.currentStrategy();
    }

    private void performEvaluation() {
        try {
            evaluate();
        } catch (Exception e) {
            log.error("[StrategySelector] Error evaluating health for {}: {}",
                dependency.name(), e.getMessage(), e);
        }
    }

    private static Optional<String> nextAvailableBelow(List<String> ranked, String current, HealthReport report) {
        int index = ranked.indexOf(current);
        for (int i = index + 1; i < ranked.size(); i++) {
            if (report.isAvailable(ranked.get(i))) {
                return Optional.of(ranked.get(i));
            }
        }
        return Optional.empty();
    }

    private StrategySwitchEvent switchTo(String from, String to, StrategySwitchEvent.Reason reason, double score) {
        dependency.switchStrategy(to);

        if (reason == StrategySwitchEvent.Reason.FAILOVER) {
            log.warn("[StrategySelector] {} health {} below {}, failing over '{}' -> '{}'",
                dependency.name(), score, config.failoverThreshold(), from, to);
        } else {
            log.info("[StrategySelector] {} health {} above {}, returning to primary '{}' (was '{}')",
                dependency.name(), score, config.recoveryThreshold(), to, from);
        }
        metrics.recordStrategySwitch(dependency.name(), from, to);

        StrategySwitchEvent event = new StrategySwitchEvent(dependency.name(), from, to, reason, score, Instant.now());
        for (Consumer<StrategySwitchEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("[StrategySelector] Strategy switch listener failed: {}", e.getMessage(), e);
            }
        }
        return event;
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ════════════════════════════════════════════════════════════════════════

    public void onStrategySwitch(Consumer<StrategySwitchEvent> listener) {
        listeners.add(listener);
    }

    public void setMetrics(StreamingMetrics metrics) {
        this.metrics = metrics != null ? metrics : StreamingMetrics.NOOP;
    }
}
