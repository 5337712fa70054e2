package in.leanvibe.domain.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.leanvibe.domain.event.EventPriority;
import in.leanvibe.domain.event.NotificationChannel;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Delivery preferences of one streaming client.
 *
 * Immutable; a client replaces its preferences wholesale.
 * Read by the filter and the batcher on every event.
 */
public record ClientPreferences(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("enabled_channels") Set<NotificationChannel> enabledChannels,
    @JsonProperty("min_priority") EventPriority minPriority,
    @JsonProperty("max_events_per_second") int maxEventsPerSecond,
    @JsonProperty("enable_batching") boolean enableBatching,
    @JsonProperty("batch_interval_ms") long batchIntervalMs,
    @JsonProperty("enable_compression") boolean enableCompression,
    @JsonProperty("custom_filters") Map<String, Map<String, Object>> customFilters
) {
    public static final int DEFAULT_MAX_EVENTS_PER_SECOND = 10;
    public static final long DEFAULT_BATCH_INTERVAL_MS = 100;

    public ClientPreferences {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        if (enabledChannels == null) {
            channels.add(NotificationChannel.ALL);
        } else {
            channels.addAll(enabledChannels);
        }
        enabledChannels = Collections.unmodifiableSet(channels);
        if (minPriority == null) {
            minPriority = EventPriority.LOW;
        }
        if (maxEventsPerSecond <= 0) {
            throw new IllegalArgumentException("maxEventsPerSecond must be positive: " + maxEventsPerSecond);
        }
        if (batchIntervalMs <= 0) {
            throw new IllegalArgumentException("batchIntervalMs must be positive: " + batchIntervalMs);
        }
        customFilters = customFilters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customFilters));
    }

    /**
     * Default preferences: all channels, LOW and above, 10 events/s,
     * no batching, compression enabled.
     */
    public static ClientPreferences defaults(String clientId) {
        return builder(clientId).build();
    }

    @JsonIgnore
    public Duration batchInterval() {
        return Duration.ofMillis(batchIntervalMs);
    }

    public boolean subscribesTo(NotificationChannel channel) {
        return enabledChannels.contains(NotificationChannel.ALL) || enabledChannels.contains(channel);
    }

    public Builder toBuilder() {
        return new Builder(clientId)
            .enabledChannels(enabledChannels)
            .minPriority(minPriority)
            .maxEventsPerSecond(maxEventsPerSecond)
            .enableBatching(enableBatching)
            .batchIntervalMs(batchIntervalMs)
            .enableCompression(enableCompression)
            .customFilters(customFilters);
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public static class Builder {
        private final String clientId;
        private Set<NotificationChannel> enabledChannels = EnumSet.of(NotificationChannel.ALL);
        private EventPriority minPriority = EventPriority.LOW;
        private int maxEventsPerSecond = DEFAULT_MAX_EVENTS_PER_SECOND;
        private boolean enableBatching = false;
        private long batchIntervalMs = DEFAULT_BATCH_INTERVAL_MS;
        private boolean enableCompression = true;
        private final Map<String, Map<String, Object>> customFilters = new LinkedHashMap<>();

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder enabledChannels(Set<NotificationChannel> channels) {
            this.enabledChannels = channels.isEmpty()
                ? EnumSet.noneOf(NotificationChannel.class)
                : EnumSet.copyOf(channels);
            return this;
        }

        public Builder channels(NotificationChannel first, NotificationChannel... rest) {
            this.enabledChannels = EnumSet.of(first, rest);
            return this;
        }

        public Builder minPriority(EventPriority minPriority) {
            this.minPriority = minPriority;
            return this;
        }

        public Builder maxEventsPerSecond(int maxEventsPerSecond) {
            this.maxEventsPerSecond = maxEventsPerSecond;
            return this;
        }

        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        public Builder batchIntervalMs(long batchIntervalMs) {
            this.batchIntervalMs = batchIntervalMs;
            return this;
        }

        public Builder batchInterval(Duration batchInterval) {
            this.batchIntervalMs = batchInterval.toMillis();
            return this;
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        public Builder customFilters(Map<String, Map<String, Object>> filters) {
            this.customFilters.clear();
            this.customFilters.putAll(filters);
            return this;
        }

        public Builder customFilter(String name, Map<String, Object> params) {
            this.customFilters.put(name, params);
            return this;
        }

        public ClientPreferences build() {
            return new ClientPreferences(clientId, enabledChannels, minPriority, maxEventsPerSecond,
                enableBatching, batchIntervalMs, enableCompression, customFilters);
        }
    }
}
