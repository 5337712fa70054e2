package in.leanvibe.infrastructure.resilience;

import java.time.Instant;

/**
 * Published by {@link StrategySelector} after each strategy switch.
 */
public record StrategySwitchEvent(
    String dependency,
    String fromStrategy,
    String toStrategy,
    Reason reason,
    double healthScore,
    Instant timestamp
) {
    public enum Reason {
        FAILOVER,   // Health dropped below the failover threshold
        RECOVERY    // Health rose above the recovery threshold, back to primary
    }

    public boolean isFailover() {
        return reason == Reason.FAILOVER;
    }
}
