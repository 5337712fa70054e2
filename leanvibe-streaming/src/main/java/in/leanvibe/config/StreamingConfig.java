package in.leanvibe.config;

import in.leanvibe.util.Env;

import java.time.Duration;

/**
 * Settings for the event streaming engine and its HTTP/WebSocket front.
 */
public record StreamingConfig(
    int httpPort,
    String bindAddress,
    int queueCapacity,          // bounded ingestion queue; producers block when full
    long pollIntervalMs,        // delivery loop tick
    int maxEventsPerTick,       // events drained per tick before timers get a turn
    long shutdownTimeoutMs
) {
    public StreamingConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive: " + pollIntervalMs);
        }
        if (maxEventsPerTick <= 0) {
            throw new IllegalArgumentException("maxEventsPerTick must be positive: " + maxEventsPerTick);
        }
    }

    public static StreamingConfig defaults() {
        return new StreamingConfig(
            8765,       // HTTP + WebSocket port
            "0.0.0.0",
            10_000,     // queue capacity
            5,          // poll every 5ms
            500,        // drain at most 500 events per tick
            5_000       // 5s shutdown wait
        );
    }

    public static StreamingConfig fromEnv() {
        StreamingConfig d = defaults();
        return new StreamingConfig(
            Env.getInt("STREAMING_PORT", d.httpPort()),
            Env.get("STREAMING_BIND_ADDRESS", d.bindAddress()),
            Env.getInt("STREAMING_QUEUE_CAPACITY", d.queueCapacity()),
            Env.getLong("STREAMING_POLL_INTERVAL_MS", d.pollIntervalMs()),
            Env.getInt("STREAMING_MAX_EVENTS_PER_TICK", d.maxEventsPerTick()),
            Env.getLong("STREAMING_SHUTDOWN_TIMEOUT_MS", d.shutdownTimeoutMs())
        );
    }

    public Duration shutdownTimeout() {
        return Duration.ofMillis(shutdownTimeoutMs);
    }
}
