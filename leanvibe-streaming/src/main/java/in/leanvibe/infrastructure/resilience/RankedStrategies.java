package in.leanvibe.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * {@link StrategyBackedDependency} scored from recent call outcomes.
 *
 * Health is the success ratio of the last {@link #WINDOW_SIZE} calls made on the
 * current strategy (1.0 with no calls yet). A strategy that was failed away from
 * stays unavailable for the cool-down period, so the selector does not switch
 * straight back to it.
 *
 * Usage:
 * <pre>
 * RankedStrategies inference = new RankedStrategies("inference", Duration.ofSeconds(30))
 *     .add("production", () -&gt; modelLoaded())
 *     .add("pragmatic", () -&gt; true)
 *     .add("canned", () -&gt; true);
 * </pre>
 */
public class RankedStrategies implements StrategyBackedDependency {
    private static final Logger log = LoggerFactory.getLogger(RankedStrategies.class);

    static final int WINDOW_SIZE = 20;

    private final String name;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, StrategyEntry> strategies = new LinkedHashMap<>();

    // Guarded by this
    private String current;
    private final Deque<Boolean> outcomes = new ArrayDeque<>();

    public RankedStrategies(String name, Duration cooldown) {
        this(name, cooldown, Clock.systemUTC());
    }

    RankedStrategies(String name, Duration cooldown, Clock clock) {
        this.name = name;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Append a strategy below those already added. The first one added is primary and starts current.
     */
    public synchronized RankedStrategies add(String strategy, BooleanSupplier availabilityProbe) {
        if (strategies.containsKey(strategy)) {
            throw new IllegalArgumentException("Duplicate strategy: " + strategy);
        }
        strategies.put(strategy, new StrategyEntry(availabilityProbe));
        if (current == null) {
            current = strategy;
        }
        return this;
    }

    public synchronized void recordOutcome(boolean success) {
        outcomes.addLast(success);
        if (outcomes.size() > WINDOW_SIZE) {
            outcomes.removeFirst();
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized List<String> rankedStrategies() {
        return List.copyOf(strategies.keySet());
    }

    @Override
    public synchronized HealthReport health() {
        Instant now = clock.instant();
        Map<String, Boolean> availability = new LinkedHashMap<>();
        for (Map.Entry<String, StrategyEntry> e : strategies.entrySet()) {
            availability.put(e.getKey(), e.getValue().isAvailable(now));
        }
        return new HealthReport(score(), availability);
    }

    @Override
    public synchronized String currentStrategy() {
        return current;
    }

    @Override
    public synchronized void switchStrategy(String strategy) {
        StrategyEntry target = strategies.get(strategy);
        if (target == null) {
            throw new IllegalArgumentException("Unknown strategy for " + name + ": " + strategy);
        }
        if (strategy.equals(current)) {
            return;
        }
        List<String> ranked = new ArrayList<>(strategies.keySet());
        if (ranked.indexOf(strategy) > ranked.indexOf(current)) {
            strategies.get(current).unavailableUntil = clock.instant().plus(cooldown);
        }
        log.info("[RankedStrategies] {} strategy '{}' -> '{}'", name, current, strategy);
        current = strategy;
        outcomes.clear();
    }

    private double score() {
        if (outcomes.isEmpty()) {
            return 1.0;
        }
        int successes = 0;
        for (Boolean outcome : outcomes) {
            if (outcome) {
                successes++;
            }
        }
        return (double) successes / outcomes.size();
    }

    private static final class StrategyEntry {
        final BooleanSupplier availabilityProbe;
        Instant unavailableUntil;

        StrategyEntry(BooleanSupplier availabilityProbe) {
            this.availabilityProbe = availabilityProbe;
        }

        boolean isAvailable(Instant now) {
            if (unavailableUntil != null && now.isBefore(unavailableUntil)) {
                return false;
            }
            return availabilityProbe.getAsBoolean();
        }
    }
}
