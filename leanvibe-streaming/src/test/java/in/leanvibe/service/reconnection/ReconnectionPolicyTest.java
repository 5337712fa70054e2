package in.leanvibe.service.reconnection;

import in.leanvibe.config.ReconnectionConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Exhaustion after max attempts
 * - Reset on success
 * - Builder validation
 */
class ReconnectionPolicyTest {

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder().build();

        assertTrue(policy.shouldRetry(), "Should allow initial attempt");
        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertFalse(policy.isExhausted(), "Not exhausted initially");
        assertNull(policy.getLastAttemptTime(), "No attempts made yet");
        assertEquals(Duration.ofMillis(100), policy.getNextDelay(), "Default initial delay is 100ms");
        assertEquals(3, policy.getMaxAttempts(), "Default is 3 attempts");
    }

    @Test
    void testExponentialBackoffCapped() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(300))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofMillis(200), policy.getNextDelay(), "100 * 2");

        policy.recordFailure();
        assertEquals(Duration.ofMillis(300), policy.getNextDelay(), "400 capped at 300");

        policy.recordFailure();
        assertEquals(Duration.ofMillis(300), policy.getNextDelay(), "Still capped");
        assertNotNull(policy.getLastAttemptTime());
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder().maxAttempts(3).build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Two of three attempts used");

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "All attempts used");
        assertTrue(policy.isExhausted());
    }

    @Test
    void testSuccessResets() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder().maxAttempts(2).build();
        policy.recordFailure();
        policy.recordFailure();

        policy.recordSuccess();

        assertTrue(policy.shouldRetry(), "Success resets exhaustion");
        assertEquals(0, policy.getAttemptCount());
        assertEquals(Duration.ofMillis(100), policy.getNextDelay(), "Delay back to initial");
        assertNull(policy.getLastAttemptTime());
    }

    @Test
    void testForSessionSyncUsesConfig() {
        ReconnectionConfig config = new ReconnectionConfig(
            Duration.ofMinutes(5), 5, Duration.ofMillis(50), Duration.ofMillis(400), 3.0,
            100, Duration.ofHours(1), Duration.ofSeconds(60), Duration.ofSeconds(30));

        ReconnectionPolicy policy = ReconnectionPolicy.forSessionSync(config);

        assertEquals(5, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(50), policy.getNextDelay());
        policy.recordFailure();
        assertEquals(Duration.ofMillis(150), policy.getNextDelay(), "50 * 3");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().initialDelay(Duration.ZERO), "Zero initial delay");
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxDelay(Duration.ofMillis(-1)), "Negative max delay");
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(0.5), "Shrinking backoff");
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(0), "No attempts");
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .initialDelay(Duration.ofSeconds(5))
                .maxDelay(Duration.ofSeconds(1))
                .build(),
            "Initial above max");
    }
}
