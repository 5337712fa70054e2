package in.leanvibe.config;

import in.leanvibe.util.Env;

import java.time.Duration;

/**
 * Circuit breaker and strategy failover settings for the upstream inference backend.
 */
public record ResilienceConfig(
    int failureThreshold,           // consecutive failures before the circuit opens
    Duration recoveryTimeout,       // OPEN -> HALF_OPEN after this long
    Duration healthCheckInterval,
    double failoverThreshold,       // health score below this -> next lower-ranked strategy
    double recoveryThreshold        // health score above this -> back to primary
) {
    public ResilienceConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (failoverThreshold >= recoveryThreshold) {
            throw new IllegalArgumentException("failoverThreshold must be below recoveryThreshold");
        }
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(3, Duration.ofSeconds(30), Duration.ofSeconds(30), 0.5, 0.8);
    }

    public static ResilienceConfig fromEnv() {
        ResilienceConfig d = defaults();
        return new ResilienceConfig(
            Env.getInt("CIRCUIT_FAILURE_THRESHOLD", d.failureThreshold()),
            Duration.ofSeconds(Env.getLong("CIRCUIT_RECOVERY_TIMEOUT_SECONDS", d.recoveryTimeout().toSeconds())),
            Duration.ofSeconds(Env.getLong("UPSTREAM_HEALTH_CHECK_INTERVAL_SECONDS", d.healthCheckInterval().toSeconds())),
            Env.getDouble("UPSTREAM_FAILOVER_THRESHOLD", d.failoverThreshold()),
            Env.getDouble("UPSTREAM_RECOVERY_THRESHOLD", d.recoveryThreshold())
        );
    }
}
