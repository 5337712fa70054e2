package in.leanvibe.infrastructure.resilience;

import in.leanvibe.config.ResilienceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StrategySelector.
 *
 * Tests:
 * - Failover to the next available lower-ranked strategy
 * - Recovery to primary above the recovery threshold
 * - Hysteresis band between the thresholds
 * - Listener isolation
 * - Periodic evaluation once started
 */
class StrategySelectorTest {

    private static final List<String> RANKED = List.of("production", "pragmatic", "fallback");
    private static final ResilienceConfig CONFIG =
        new ResilienceConfig(3, Duration.ofSeconds(30), Duration.ofSeconds(30), 0.5, 0.8);

    private StrategyBackedDependency dependency;
    private StrategySelector selector;
    private final List<StrategySwitchEvent> switches = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        dependency = mock(StrategyBackedDependency.class);
        when(dependency.name()).thenReturn("inference");
        when(dependency.rankedStrategies()).thenReturn(RANKED);
        selector = new StrategySelector(dependency, CONFIG);
        selector.onStrategySwitch(switches::add);
    }

    @AfterEach
    void tearDown() {
        selector.stop();
    }

    private void givenHealth(String current, double score, String... available) {
        Map<String, Boolean> availability = new HashMap<>();
        for (String strategy : available) {
            availability.put(strategy, true);
        }
        when(dependency.currentStrategy()).thenReturn(current);
        when(dependency.health()).thenReturn(new HealthReport(score, availability));
    }

    @Test
    void testFailoverToNextStrategy() {
        givenHealth("production", 0.3, "production", "pragmatic", "fallback");

        Optional<StrategySwitchEvent> result = selector.evaluate();

        assertTrue(result.isPresent(), "Score 0.3 below failover threshold 0.5");
        assertEquals("pragmatic", result.get().toStrategy());
        assertEquals("production", result.get().fromStrategy());
        assertTrue(result.get().isFailover());
        verify(dependency).switchStrategy("pragmatic");
        assertEquals(1, switches.size(), "Listener notified");
    }

    @Test
    void testFailoverSkipsUnavailableStrategy() {
        givenHealth("production", 0.1, "fallback");

        Optional<StrategySwitchEvent> result = selector.evaluate();

        assertEquals("fallback", result.orElseThrow().toStrategy(), "pragmatic unavailable, skipped");
    }

    @Test
    void testNoFailoverFromLastStrategy() {
        givenHealth("fallback", 0.0, "production", "pragmatic", "fallback");

        assertTrue(selector.evaluate().isEmpty(), "Nothing below the last strategy");
        verify(dependency, never()).switchStrategy(anyString());
    }

    @Test
    void testRecoveryToPrimary() {
        givenHealth("fallback", 0.9, "production", "pragmatic", "fallback");

        Optional<StrategySwitchEvent> result = selector.evaluate();

        assertEquals("production", result.orElseThrow().toStrategy(), "Straight back to primary");
        assertEquals(StrategySwitchEvent.Reason.RECOVERY, result.get().reason());
        verify(dependency).switchStrategy("production");
    }

    @Test
    void testNoRecoveryWhilePrimaryUnavailable() {
        givenHealth("pragmatic", 0.95, "pragmatic", "fallback");

        assertTrue(selector.evaluate().isEmpty(), "Primary still cooling down");
    }

    @Test
    void testNoChangeBetweenThresholds() {
        givenHealth("pragmatic", 0.6, "production", "pragmatic", "fallback");

        assertTrue(selector.evaluate().isEmpty(), "0.6 is inside the hysteresis band");
        assertTrue(switches.isEmpty());
    }

    @Test
    void testHealthyPrimaryStays() {
        givenHealth("production", 1.0, "production", "pragmatic", "fallback");

        assertTrue(selector.reportDegraded().isEmpty());
        verify(dependency, never()).switchStrategy(anyString());
    }

    @Test
    void testFailingListenerDoesNotBlockOthers() {
        List<StrategySwitchEvent> second = new CopyOnWriteArrayList<>();
        StrategySelector isolated = new StrategySelector(dependency, CONFIG);
        isolated.onStrategySwitch(event -> {
            throw new IllegalStateException("listener bug");
        });
        isolated.onStrategySwitch(second::add);
        givenHealth("production", 0.2, "production", "pragmatic");

        assertTrue(isolated.evaluate().isPresent());
        assertEquals(1, second.size(), "Second listener still called");
    }

    @Test
    void testDependencyWithoutStrategiesRejected() {
        StrategyBackedDependency empty = mock(StrategyBackedDependency.class);
        when(empty.rankedStrategies()).thenReturn(List.of());

        assertThrows(IllegalArgumentException.class, () -> new StrategySelector(empty, CONFIG));
    }

    @Test
    void testPeriodicEvaluation() throws Exception {
        ResilienceConfig fast = new ResilienceConfig(3, Duration.ofSeconds(30), Duration.ofMillis(50), 0.5, 0.8);
        StrategySelector periodic = new StrategySelector(dependency, fast);
        CountDownLatch switched = new CountDownLatch(1);
        periodic.onStrategySwitch(event -> switched.countDown());
        givenHealth("production", 0.2, "production", "pragmatic");

        periodic.start();
        try {
            assertTrue(periodic.isRunning());
            assertTrue(switched.await(2, TimeUnit.SECONDS), "Scheduled evaluation should fail over");
        } finally {
            periodic.stop();
        }
        assertFalse(periodic.isRunning());
    }
}
