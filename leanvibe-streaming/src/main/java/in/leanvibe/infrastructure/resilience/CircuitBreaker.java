package in.leanvibe.infrastructure.resilience;

import in.leanvibe.infrastructure.metrics.StreamingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Circuit breaker around a fragile upstream dependency.
 *
 * Transitions:
 * <pre>
 * CLOSED    --(failureThreshold consecutive failures)--> OPEN
 * OPEN      --(recoveryTimeout elapsed, next call)-----> HALF_OPEN
 * HALF_OPEN --(trial succeeds)-------------------------> CLOSED
 * HALF_OPEN --(trial fails)----------------------------> OPEN
 * </pre>
 *
 * Only one trial call is admitted in HALF_OPEN; concurrent callers are
 * short-circuited until the trial completes.
 *
 * Usage:
 * <pre>
 * CircuitBreaker breaker = new CircuitBreaker("inference", 3, Duration.ofSeconds(30));
 * UpstreamResult&lt;String&gt; result = breaker.execute(() -&gt; backend.generate(prompt));
 * if (!result.isSuccess()) {
 *     // degrade
 * }
 * </pre>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private volatile StreamingMetrics metrics = StreamingMetrics.NOOP;

    // Guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount = 0;
    private Instant lastFailureTime;
    private boolean trialInFlight = false;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * Run {@code operation} if the circuit admits it.
     * Exceptions thrown by the operation are captured in the result, never rethrown.
     * An {@link Error} counts as a failure and is rethrown.
     */
    public <T> UpstreamResult<T> execute(Supplier<T> operation) {
        if (!tryAcquirePermission()) {
            log.debug("[CircuitBreaker] {} is {}, call rejected", name, getState());
            return UpstreamResult.shortCircuited();
        }

        T value;
        try {
            value = operation.get();
        } catch (RuntimeException e) {
            onFailure(e);
            return UpstreamResult.failed(e);
        } catch (Error e) {
            // counted so a HALF_OPEN trial is released, then propagated
            onFailure(e);
            throw e;
        }
        onSuccess();
        return UpstreamResult.success(value);
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getName() {
        return name;
    }

    public void setMetrics(StreamingMetrics metrics) {
        this.metrics = metrics != null ? metrics : StreamingMetrics.NOOP;
    }

    private synchronized boolean tryAcquirePermission() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (lastFailureTime != null
                        && Duration.between(lastFailureTime, clock.instant()).compareTo(recoveryTimeout) < 0) {
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
            default:
                return false;
        }
    }

    private synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            failureCount = 0;
            lastFailureTime = null;
            transitionTo(CircuitState.CLOSED);
            log.info("[CircuitBreaker] {} trial call succeeded, circuit CLOSED", name);
        } else {
            failureCount = 0;
        }
    }

    private synchronized void onFailure(Throwable error) {
        lastFailureTime = clock.instant();

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(CircuitState.OPEN);
            log.warn("[CircuitBreaker] {} trial call failed, circuit re-OPENED: {}", name, error.getMessage());
            return;
        }

        failureCount++;
        log.debug("[CircuitBreaker] {} failure {}/{}: {}", name, failureCount, failureThreshold, error.getMessage());
        if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
            log.warn("[CircuitBreaker] {} OPENED after {} consecutive failures", name, failureCount);
        }
    }

    private void transitionTo(CircuitState next) {
        state = next;
        metrics.updateCircuitState(name, next.name());
    }

    synchronized boolean isTrialInFlight() {
        return trialInFlight;
    }
}
