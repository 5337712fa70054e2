package in.leanvibe.infrastructure.resilience;

import java.util.Map;

/**
 * Health of a strategy-backed dependency.
 *
 * @param score        0.0 (unusable) to 1.0 (fully healthy), for the current strategy
 * @param availability strategy name to whether it can be switched to; missing means unavailable
 */
public record HealthReport(double score, Map<String, Boolean> availability) {

    public HealthReport {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        availability = availability == null ? Map.of() : Map.copyOf(availability);
    }

    public boolean isAvailable(String strategy) {
        return Boolean.TRUE.equals(availability.get(strategy));
    }
}
