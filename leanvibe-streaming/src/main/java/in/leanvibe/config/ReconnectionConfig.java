package in.leanvibe.config;

import in.leanvibe.util.Env;

import java.time.Duration;

/**
 * Reconnection and session-retention settings.
 */
public record ReconnectionConfig(
    Duration gracePeriod,           // reconnect within this window to restore the session
    int maxAttempts,                // sync attempts per reconnection before giving up
    Duration initialRetryDelay,
    Duration maxRetryDelay,
    double backoffMultiplier,
    int maxMissedEvents,            // per-client missed-event buffer cap (oldest trimmed)
    Duration missedEventRetention,
    Duration heartbeatTimeout,
    Duration maintenanceInterval    // heartbeat sweep + expired-session cleanup
) {
    public ReconnectionConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (maxMissedEvents <= 0) {
            throw new IllegalArgumentException("maxMissedEvents must be positive: " + maxMissedEvents);
        }
    }

    public static ReconnectionConfig defaults() {
        return new ReconnectionConfig(
            Duration.ofMinutes(5),
            3,
            Duration.ofMillis(100),
            Duration.ofSeconds(1),
            2.0,
            1_000,
            Duration.ofHours(24),
            Duration.ofSeconds(60),
            Duration.ofSeconds(30)
        );
    }

    public static ReconnectionConfig fromEnv() {
        ReconnectionConfig d = defaults();
        return new ReconnectionConfig(
            Duration.ofSeconds(Env.getLong("RECONNECT_GRACE_PERIOD_SECONDS", d.gracePeriod().toSeconds())),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", d.maxAttempts()),
            Duration.ofMillis(Env.getLong("RECONNECT_INITIAL_DELAY_MS", d.initialRetryDelay().toMillis())),
            Duration.ofMillis(Env.getLong("RECONNECT_MAX_DELAY_MS", d.maxRetryDelay().toMillis())),
            Env.getDouble("RECONNECT_BACKOFF_MULTIPLIER", d.backoffMultiplier()),
            Env.getInt("RECONNECT_MAX_MISSED_EVENTS", d.maxMissedEvents()),
            Duration.ofHours(Env.getLong("MISSED_EVENT_RETENTION_HOURS", d.missedEventRetention().toHours())),
            Duration.ofSeconds(Env.getLong("HEARTBEAT_TIMEOUT_SECONDS", d.heartbeatTimeout().toSeconds())),
            Duration.ofSeconds(Env.getLong("SESSION_MAINTENANCE_INTERVAL_SECONDS", d.maintenanceInterval().toSeconds()))
        );
    }
}
