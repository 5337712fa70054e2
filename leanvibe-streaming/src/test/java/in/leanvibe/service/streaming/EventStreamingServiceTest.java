package in.leanvibe.service.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import in.leanvibe.config.StreamingConfig;
import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.domain.event.EventType;
import in.leanvibe.domain.event.NotificationChannel;
import in.leanvibe.domain.event.StreamEvent;
import in.leanvibe.domain.event.StreamEvents;
import in.leanvibe.transport.RecordingTransport;
import in.leanvibe.transport.SendResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventStreamingService.
 *
 * Most tests call deliverEvent directly so delivery happens on the test thread;
 * the lifecycle tests go through the queue and the delivery loop.
 *
 * Tests:
 * - Fan-out with per-client filtering
 * - Per-client sequence numbering
 * - Failure isolation between clients
 * - Missed-event tracking and reactivation
 * - Batching and compression on the wire
 * - Stats and lifecycle
 */
class EventStreamingServiceTest {

    private static final StreamingConfig CONFIG = new StreamingConfig(0, "127.0.0.1", 100, 5, 500, 2_000);
    private static final Duration WAIT = Duration.ofSeconds(2);

    private EventStreamingService service;
    private final List<String> missed = new CopyOnWriteArrayList<>();
    private final List<String> deactivated = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        service = new EventStreamingService(CONFIG);
        service.setMissedEventListener(new MissedEventListener() {
            @Override
            public void onMissedEvent(String clientId, StreamEvent event) {
                missed.add(clientId + ":" + event.type().wireName());
            }

            @Override
            public void onClientDeactivated(String clientId) {
                deactivated.add(clientId);
            }
        });
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static ClientPreferences unlimited(String clientId) {
        return ClientPreferences.builder(clientId).maxEventsPerSecond(1000).enableCompression(false).build();
    }

    // ═══════════════════════════════════════════════════════════════
    // FAN-OUT
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testEventDeliveredToSubscribedClientsOnly() {
        RecordingTransport all = new RecordingTransport();
        RecordingTransport agentOnly = new RecordingTransport();
        service.registerClient("all", all, unlimited("all"));
        service.registerClient("agent", agentOnly,
            unlimited("agent").toBuilder().channels(NotificationChannel.AGENT).build());

        service.deliverEvent(StreamEvents.fileChange("src/a.py", "modified"));

        assertEquals(1, all.frames().size(), "Subscribed client receives the event");
        assertTrue(agentOnly.frames().isEmpty(), "Agent-only client filtered out");

        JsonNode message = all.messages().get(0);
        assertEquals("notification", message.get("message_type").asText());
        assertEquals("file_changed", message.get("event_type").asText());
        assertEquals("file_system", message.get("channel").asText());
        assertEquals("src/a.py", message.get("data").get("payload").get("file_path").asText());
    }

    @Test
    void testSequenceNumbersArePerClient() {
        RecordingTransport a = new RecordingTransport();
        RecordingTransport b = new RecordingTransport();
        service.registerClient("a", a, unlimited("a"));
        service.deliverEvent(StreamEvents.fileChange("one.py", "modified"));
        service.registerClient("b", b, unlimited("b"));
        service.deliverEvent(StreamEvents.fileChange("two.py", "modified"));
        service.deliverEvent(StreamEvents.fileChange("three.py", "modified"));

        assertEquals(List.of(1L, 2L, 3L), sequences(a), "Client a numbered 1..3");
        assertEquals(List.of(1L, 2L), sequences(b), "Client b numbered from 1");
        assertEquals(3, service.getClient("a").orElseThrow().sequenceNumber());
    }

    @Test
    void testRateLimitAppliedPerClient() {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, null);

        for (int i = 0; i < 15; i++) {
            service.deliverEvent(StreamEvents.fileChange("f" + i + ".py", "modified"));
        }

        assertEquals(ClientPreferences.DEFAULT_MAX_EVENTS_PER_SECOND, transport.frames().size(),
            "Default preferences allow 10 events per second");
    }

    // ═══════════════════════════════════════════════════════════════
    // FAILURE ISOLATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testClosedTransportDeactivatesOnlyThatClient() {
        RecordingTransport broken = new RecordingTransport();
        RecordingTransport healthy = new RecordingTransport();
        service.registerClient("broken", broken, unlimited("broken"));
        service.registerClient("healthy", healthy, unlimited("healthy"));
        broken.close();

        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));
        service.deliverEvent(StreamEvents.fileChange("b.py", "modified"));

        assertEquals(2, healthy.frames().size(), "Healthy client unaffected");
        assertFalse(service.getClient("broken").orElseThrow().active(), "Broken client marked inactive");
        assertTrue(service.isRegistered("broken"), "State retained for reconnection");
        assertEquals(1, service.getStats().failedDeliveries(), "Only the first send fails, then it is inactive");
        assertEquals(List.of("broken:file_changed", "broken:file_changed"), missed,
            "The event whose send failed and the next one are both tracked as missed");
        assertEquals(List.of("broken"), deactivated, "Listener told once about the drop");
        assertEquals(0, service.getClient("broken").orElseThrow().sequenceNumber(),
            "Failed send does not consume a sequence number");
    }

    // ═══════════════════════════════════════════════════════════════
    // MISSED EVENTS AND REACTIVATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testInactiveClientEventsReportedAsMissed() {
        service.registerClient("ios", new RecordingTransport(),
            unlimited("ios").toBuilder().channels(NotificationChannel.VIOLATIONS).build());
        assertTrue(service.deactivateClient("ios"));
        assertFalse(service.deactivateClient("ios"), "Second deactivate is a no-op");
        assertEquals(List.of("ios"), deactivated);

        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));
        service.deliverEvent(StreamEvents.violation("v1", "naming", "error", "a.py", "bad name"));

        assertEquals(List.of("ios:violation_detected"), missed, "Only events matching preferences are missed");
        assertEquals(1, service.getStats().missedEventsTracked());
    }

    @Test
    void testReactivationContinuesSequence() {
        RecordingTransport first = new RecordingTransport();
        service.registerClient("ios", first, unlimited("ios"));
        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));
        service.deliverEvent(StreamEvents.fileChange("b.py", "modified"));
        service.deactivateClient("ios");

        RecordingTransport second = new RecordingTransport();
        SendResult result = service.reactivateClient("ios", second, Map.of("status", "restored"));

        assertEquals(SendResult.OK, result);
        assertTrue(service.getClient("ios").orElseThrow().active(), "Active after successful sync");

        JsonNode sync = second.messages().get(0);
        assertEquals("session_restored", sync.get("message_type").asText());
        assertEquals(3, sync.get("sequence_number").asLong(), "Sync message takes the next number");
        assertEquals(2, sync.get("data").get("last_sequence_number").asLong());
        assertEquals("restored", sync.get("data").get("status").asText());

        service.deliverEvent(StreamEvents.fileChange("c.py", "modified"));
        assertEquals(List.of(3L, 4L), sequences(second), "Numbering continues on the new transport");
        assertEquals(2, first.frames().size(), "Old transport not used after rebinding");
    }

    @Test
    void testFailedReactivationStaysInactive() {
        service.registerClient("ios", new RecordingTransport(), unlimited("ios"));
        service.deactivateClient("ios");
        RecordingTransport flaky = new RecordingTransport();
        flaky.failNextSends(1);

        SendResult result = service.reactivateClient("ios", flaky, Map.of());

        assertEquals(SendResult.TRANSPORT_CLOSED, result);
        assertFalse(service.getClient("ios").orElseThrow().active());
    }

    @Test
    void testReactivateUnknownClientRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> service.reactivateClient("ghost", new RecordingTransport(), Map.of()));
    }

    // ═══════════════════════════════════════════════════════════════
    // BATCHING AND COMPRESSION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testBatchingBuffersUntilSizeFlush() {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport,
            unlimited("c1").toBuilder().enableBatching(true).batchIntervalMs(60_000).build());

        for (int i = 0; i < 3; i++) {
            service.deliverEvent(StreamEvents.fileChange("f" + i + ".py", "modified"));
        }
        assertTrue(transport.frames().isEmpty(), "Events buffered");
        assertEquals(3, service.pendingBatchSize("c1"));

        for (int i = 3; i < EventBatcher.MAX_BATCH_SIZE; i++) {
            service.deliverEvent(StreamEvents.fileChange("f" + i + ".py", "modified"));
        }

        assertEquals(1, transport.frames().size(), "One batch message for 20 events");
        JsonNode batch = transport.messages().get(0);
        assertEquals("batch_notification", batch.get("message_type").asText());
        assertEquals(20, batch.get("data").get("batch_size").asInt());
        assertEquals(20, batch.get("batch_info").get("event_count").asInt());
        assertEquals("f0.py", batch.get("data").get("events").get(0).get("payload").get("file_path").asText());
        assertEquals(1, batch.get("sequence_number").asLong(), "Whole batch takes one sequence number");
    }

    @Test
    void testBatchTimerFlushesOnDeliveryThread() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport,
            unlimited("c1").toBuilder().enableBatching(true).batchIntervalMs(50).build());

        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));
        service.deliverEvent(StreamEvents.fileChange("b.py", "modified"));

        assertTrue(transport.awaitFrames(1, WAIT), "Timer flush should send the batch");
        assertEquals("batch_notification", transport.messages().get(0).get("message_type").asText());
    }

    @Test
    void testLargeMessageCompressedWhenOptedIn() {
        RecordingTransport compressed = new RecordingTransport();
        RecordingTransport plain = new RecordingTransport();
        service.registerClient("zip", compressed,
            unlimited("zip").toBuilder().enableCompression(true).build());
        service.registerClient("plain", plain, unlimited("plain"));

        service.deliverEvent(StreamEvents.fileChange("src/module/".repeat(200) + "a.py", "modified"));

        assertTrue(compressed.frames().get(0).binary(), "Large payload sent as gzip binary frame");
        assertFalse(plain.frames().get(0).binary(), "Client without compression gets text");
        assertEquals(compressed.messages().get(0).get("data"), plain.messages().get(0).get("data"),
            "Same content either way");
        assertEquals(1, service.getStats().compressedMessages());
    }

    // ═══════════════════════════════════════════════════════════════
    // CLIENT MANAGEMENT
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testRegisterWithNullPreferencesUsesDefaults() {
        ClientInfo info = service.registerClient("c1", new RecordingTransport(), null);

        assertEquals(ClientPreferences.defaults("c1"), info.preferences());
        assertTrue(info.active());
        assertEquals(0, info.sequenceNumber());
    }

    @Test
    void testReRegisterResetsState() {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, unlimited("c1"));
        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));

        ClientInfo info = service.registerClient("c1", new RecordingTransport(), unlimited("c1"));

        assertEquals(0, info.sequenceNumber(), "Fresh sequence after re-registration");
        assertEquals(1, service.getClientInfo().size());
    }

    @Test
    void testUpdatePreferences() {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, unlimited("c1"));

        assertTrue(service.updateClientPreferences("c1",
            unlimited("c1").toBuilder().channels(NotificationChannel.AGENT).build()));
        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));

        assertTrue(transport.frames().isEmpty(), "New preferences applied");
        assertFalse(service.updateClientPreferences("ghost", unlimited("ghost")), "Unknown client");
        assertThrows(IllegalArgumentException.class,
            () -> service.updateClientPreferences("c1", unlimited("other")), "Client id mismatch");
    }

    @Test
    void testUnregisterStopsDelivery() {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, unlimited("c1"));
        service.unregisterClient("c1");

        service.deliverEvent(StreamEvents.fileChange("a.py", "modified"));

        assertTrue(transport.frames().isEmpty());
        assertFalse(service.isRegistered("c1"));
        assertTrue(service.getClient("c1").isEmpty());
        assertEquals(0, service.getStats().connectedClients());
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE AND STATS
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testEmittedEventsFlowThroughDeliveryLoop() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, unlimited("c1"));
        service.start();

        service.emitFileChange("a.py", "modified", null);
        service.emitAgentEvent("s1", EventType.AGENT_STARTED, "explain");
        service.emitViolationDetected("v1", "naming", "warning", "a.py", "bad");
        service.emitAnalysisCompleted("ast", "a.py", 0.2);

        assertTrue(transport.awaitFrames(4, WAIT), "All four events delivered");
        StatsSnapshot stats = service.getStats();
        assertEquals(4, stats.totalEventsSent());
        assertEquals(1L, stats.eventsByType().get("agent_started"));
        assertEquals(4L, stats.eventsByPriority().get("medium"), "All four factories emit MEDIUM");
        assertEquals(4, stats.messagesDelivered());
        assertEquals(1, stats.connectedClients());
    }

    @Test
    void testStartAndStopAreIdempotent() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        service.registerClient("c1", transport, unlimited("c1"));

        service.start();
        service.start();
        assertTrue(service.isRunning());

        service.stop();
        service.stop();
        assertFalse(service.isRunning());

        service.emitEvent(StreamEvents.fileChange("a.py", "modified"));
        assertFalse(transport.awaitFrames(1, Duration.ofMillis(200)), "Nothing delivered after stop");
        assertEquals(1, service.getStats().queueDepth(), "Event stays queued");
    }

    @Test
    void testTryEmitFailsWhenQueueFull() throws Exception {
        EventStreamingService small = new EventStreamingService(new StreamingConfig(0, "127.0.0.1", 1, 5, 500, 2_000));
        try {
            StreamEvent event = StreamEvents.fileChange("a.py", "modified");
            assertTrue(small.tryEmitEvent(event, Duration.ofMillis(10)));
            assertFalse(small.tryEmitEvent(event, Duration.ofMillis(10)), "Capacity 1, loop not running");
            assertEquals(1, small.getStats().totalEventsSent(), "Dropped event not counted");
        } finally {
            small.shutdown();
        }
    }

    private static List<Long> sequences(RecordingTransport transport) {
        return transport.messages().stream().map(m -> m.get("sequence_number").asLong()).toList();
    }
}
