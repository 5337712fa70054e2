package in.leanvibe.infrastructure.resilience;

import in.leanvibe.infrastructure.metrics.StreamingMetrics;
import in.leanvibe.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for CircuitBreaker.
 *
 * Tests:
 * - Opens after the failure threshold
 * - Short-circuits while open
 * - Single trial call after the recovery timeout
 * - Trial outcome closes or re-opens the circuit
 * - Errors release the trial slot and propagate
 */
class CircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofSeconds(30);

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        breaker = new CircuitBreaker("inference", 3, RECOVERY, clock);
    }

    private UpstreamResult<String> fail() {
        return breaker.execute(() -> {
            throw new IllegalStateException("model not loaded");
        });
    }

    private UpstreamResult<String> succeed() {
        return breaker.execute(() -> "ok");
    }

    private void tripBreaker() {
        for (int i = 0; i < 3; i++) {
            fail();
        }
    }

    @Test
    void testInitialStateClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertNull(breaker.getLastFailureTime());
    }

    @Test
    void testSuccessReturnsValue() {
        UpstreamResult<String> result = succeed();

        assertTrue(result.isSuccess());
        assertEquals("ok", result.value());
    }

    @Test
    void testFailureCapturedNotThrown() {
        UpstreamResult<String> result = fail();

        assertEquals(UpstreamResult.Status.FAILED, result.status());
        assertEquals("model not loaded", result.error().getMessage());
        assertEquals(1, breaker.getFailureCount());
        assertEquals(clock.instant(), breaker.getLastFailureTime());
    }

    @Test
    void testOpensAtThreshold() {
        fail();
        fail();
        assertEquals(CircuitState.CLOSED, breaker.getState(), "Two failures below threshold of 3");

        fail();
        assertEquals(CircuitState.OPEN, breaker.getState(), "Third consecutive failure opens");
    }

    @Test
    void testSuccessResetsFailureCount() {
        fail();
        fail();
        succeed();
        fail();

        assertEquals(1, breaker.getFailureCount(), "Count restarted after success");
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testOpenCircuitShortCircuits() {
        tripBreaker();
        int[] calls = {0};

        UpstreamResult<String> result = breaker.execute(() -> {
            calls[0]++;
            return "ok";
        });

        assertEquals(UpstreamResult.Status.SHORT_CIRCUITED, result.status());
        assertEquals(0, calls[0], "Operation not invoked while open");
    }

    @Test
    void testStaysOpenBeforeRecoveryTimeout() {
        tripBreaker();
        clock.advance(RECOVERY.minusSeconds(1));

        assertEquals(UpstreamResult.Status.SHORT_CIRCUITED, succeed().status());
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void testTrialSuccessCloses() {
        tripBreaker();
        clock.advance(RECOVERY);

        UpstreamResult<String> result = succeed();

        assertTrue(result.isSuccess(), "Trial admitted after recovery timeout");
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertFalse(breaker.isTrialInFlight());
    }

    @Test
    void testTrialFailureReopens() {
        tripBreaker();
        clock.advance(RECOVERY.plusSeconds(1));

        fail();

        assertEquals(CircuitState.OPEN, breaker.getState(), "Failed trial re-opens");
        assertEquals(UpstreamResult.Status.SHORT_CIRCUITED, succeed().status(),
            "Recovery timeout restarts from the failed trial");
    }

    @Test
    void testOnlyOneTrialAdmitted() {
        tripBreaker();
        clock.advance(RECOVERY);
        AtomicReference<UpstreamResult<String>> concurrent = new AtomicReference<>();

        UpstreamResult<String> trial = breaker.execute(() -> {
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertTrue(breaker.isTrialInFlight());
            concurrent.set(succeed());
            return "trial";
        });

        assertTrue(trial.isSuccess());
        assertEquals(UpstreamResult.Status.SHORT_CIRCUITED, concurrent.get().status(),
            "Second caller rejected while the trial is in flight");
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testInvalidThresholdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, RECOVERY));
    }

    @Test
    void testTransitionsReportedToMetrics() {
        StreamingMetrics metrics = mock(StreamingMetrics.class);
        breaker.setMetrics(metrics);

        tripBreaker();

        verify(metrics).updateCircuitState("inference", "OPEN");
    }

    @Test
    void testErrorDuringTrialReleasesCircuit() {
        tripBreaker();
        clock.advance(RECOVERY.plusSeconds(1));

        assertThrows(NoClassDefFoundError.class, () -> breaker.execute(() -> {
            throw new NoClassDefFoundError("inference/Model");
        }), "Errors are not swallowed");

        assertFalse(breaker.isTrialInFlight(), "Trial slot released");
        assertEquals(CircuitState.OPEN, breaker.getState(), "Failed trial re-opens the circuit");

        clock.advance(RECOVERY.plusSeconds(1));
        assertTrue(succeed().isSuccess(), "Next trial admitted after the recovery timeout");
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }
}
