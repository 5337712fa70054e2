package in.leanvibe.infrastructure.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Circuit breaker plus fallback for calls into an upstream dependency.
 *
 * A failed or short-circuited call returns the fallback's value marked as degraded
 * and asks the strategy selector (if any) to re-evaluate immediately.
 */
public class UpstreamGuard {
    private static final Logger log = LoggerFactory.getLogger(UpstreamGuard.class);

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final StrategySelector strategySelector;  // nullable

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong successfulCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);
    private final AtomicLong degradedCalls = new AtomicLong(0);
    private volatile Instant lastSuccess;
    private volatile Instant lastFailure;
    private volatile Consumer<Boolean> outcomeListener;

    public UpstreamGuard(String name, CircuitBreaker circuitBreaker, StrategySelector strategySelector) {
        this.name = name;
        this.circuitBreaker = circuitBreaker;
        this.strategySelector = strategySelector;
    }

    public <T> GuardedResult<T> call(Supplier<T> operation, Supplier<T> fallback) {
        totalCalls.incrementAndGet();

        UpstreamResult<T> result = circuitBreaker.execute(operation);
        if (result.isSuccess()) {
            successfulCalls.incrementAndGet();
            lastSuccess = Instant.now();
            publishOutcome(true);
            return GuardedResult.ok(result.value(), currentStrategy());
        }

        if (result.status() == UpstreamResult.Status.FAILED) {
            failedCalls.incrementAndGet();
            lastFailure = Instant.now();
            log.warn("[UpstreamGuard] {} call failed: {}", name, result.error().getMessage());
            publishOutcome(false);
        }

        if (strategySelector != null) {
            try {
                strategySelector.reportDegraded();
            } catch (Exception e) {
                log.error("[UpstreamGuard] {} strategy re-evaluation failed: {}", name, e.getMessage(), e);
            }
        }

        T fallbackValue;
        try {
            fallbackValue = fallback.get();
        } catch (RuntimeException e) {
            log.error("[UpstreamGuard] {} fallback failed, service unavailable: {}", name, e.getMessage(), e);
            return GuardedResult.unavailable(currentStrategy());
        }

        degradedCalls.incrementAndGet();
        log.info("[UpstreamGuard] {} {} ({})", name, GuardedResult.DEGRADED_MESSAGE, result.status());
        return GuardedResult.degraded(fallbackValue, currentStrategy());
    }

    public GuardHealth health() {
        long total = totalCalls.get();
        long successful = successfulCalls.get();
        long degraded = degradedCalls.get();
        return new GuardHealth(
            name,
            circuitBreaker.getState(),
            currentStrategy(),
            total,
            successful,
            failedCalls.get(),
            degraded,
            total > 0 ? (double) successful / total : 0.0,
            total > 0 ? (double) degraded / total : 0.0,
            lastSuccess,
            lastFailure
        );
    }

    /**
     * Receives true/false for each call that reached the upstream (short-circuited calls excluded).
     */
    public void onOutcome(Consumer<Boolean> listener) {
        this.outcomeListener = listener;
    }

    private void publishOutcome(boolean success) {
        Consumer<Boolean> listener = outcomeListener;
        if (listener != null) {
            listener.accept(success);
        }
    }

    private String currentStrategy() {
        return strategySelector != null ? strategySelector.currentStrategy() : null;
    }

    /**
     * Health snapshot of a guarded dependency.
     */
    public record GuardHealth(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("circuit_state") CircuitState circuitState,
        @JsonProperty("current_strategy") String currentStrategy,
        @JsonProperty("total_calls") long totalCalls,
        @JsonProperty("successful_calls") long successfulCalls,
        @JsonProperty("failed_calls") long failedCalls,
        @JsonProperty("degraded_calls") long degradedCalls,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("degradation_rate") double degradationRate,
        @JsonProperty("last_success") Instant lastSuccess,
        @JsonProperty("last_failure") Instant lastFailure
    ) {
        public boolean isHealthy() {
            return circuitState == CircuitState.CLOSED;
        }
    }
}
