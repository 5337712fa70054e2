package in.leanvibe.infrastructure.resilience;

/**
 * Circuit breaker state.
 */
public enum CircuitState {
    CLOSED,     // Calls pass through, failures are counted
    OPEN,       // Calls are rejected until the recovery timeout elapses
    HALF_OPEN   // One trial call decides between CLOSED and OPEN
}
