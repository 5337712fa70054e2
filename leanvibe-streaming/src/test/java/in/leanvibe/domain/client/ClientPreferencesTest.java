package in.leanvibe.domain.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.leanvibe.domain.event.EventPriority;
import in.leanvibe.domain.event.NotificationChannel;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClientPreferencesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testDefaults() {
        ClientPreferences prefs = ClientPreferences.defaults("ios-1");

        assertEquals(Set.of(NotificationChannel.ALL), prefs.enabledChannels(), "All channels by default");
        assertEquals(EventPriority.LOW, prefs.minPriority(), "LOW and above by default");
        assertEquals(10, prefs.maxEventsPerSecond(), "10 events/s by default");
        assertFalse(prefs.enableBatching(), "Batching off by default");
        assertEquals(100, prefs.batchIntervalMs(), "100ms batch interval by default");
        assertTrue(prefs.enableCompression(), "Compression on by default");
        assertTrue(prefs.customFilters().isEmpty(), "No custom filters by default");
    }

    @Test
    void testEmptyChannelSetSubscribesToNothing() {
        ClientPreferences prefs = ClientPreferences.builder("c").enabledChannels(Set.of()).build();

        assertTrue(prefs.enabledChannels().isEmpty(), "Empty channel set is kept as given");
        for (NotificationChannel channel : NotificationChannel.values()) {
            assertFalse(prefs.subscribesTo(channel), "Unsubscribed client must not match " + channel);
        }
    }

    @Test
    void testMissingChannelSetMeansAll() {
        ClientPreferences prefs = new ClientPreferences("c", null, null, 10, false, 100, true, null);

        assertEquals(Set.of(NotificationChannel.ALL), prefs.enabledChannels(), "Null channel set defaults to ALL");
        assertTrue(prefs.subscribesTo(NotificationChannel.AGENT));
    }

    @Test
    void testEmptyChannelSetFromJsonIsKept() throws Exception {
        ClientPreferences prefs = MAPPER.readValue(
            "{\"client_id\":\"c\",\"enabled_channels\":[],\"max_events_per_second\":10,\"batch_interval_ms\":100}",
            ClientPreferences.class);

        assertTrue(prefs.enabledChannels().isEmpty(), "Explicit empty list survives deserialization");
        assertFalse(prefs.subscribesTo(NotificationChannel.SYSTEM));
    }

    @Test
    void testSubscribesToListedChannelsOnly() {
        ClientPreferences prefs = ClientPreferences.builder("c")
            .channels(NotificationChannel.AGENT, NotificationChannel.SYSTEM)
            .build();

        assertTrue(prefs.subscribesTo(NotificationChannel.SYSTEM));
        assertFalse(prefs.subscribesTo(NotificationChannel.FILE_SYSTEM));
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ClientPreferences.builder("c").maxEventsPerSecond(0).build(), "Rate must be positive");
        assertThrows(IllegalArgumentException.class,
            () -> ClientPreferences.builder("c").batchIntervalMs(0).build(), "Interval must be positive");
        assertThrows(IllegalArgumentException.class,
            () -> ClientPreferences.defaults(" "), "Client id required");
    }

    @Test
    void testJsonRoundTripUsesSnakeCase() throws Exception {
        ClientPreferences prefs = ClientPreferences.builder("c")
            .channels(NotificationChannel.VIOLATIONS)
            .minPriority(EventPriority.HIGH)
            .enableBatching(true)
            .build();

        String json = MAPPER.writeValueAsString(prefs);
        assertTrue(json.contains("\"enabled_channels\":[\"violations\"]"), json);
        assertTrue(json.contains("\"min_priority\":\"high\""), json);
        assertFalse(json.contains("batchInterval"), "Derived duration not serialized");

        assertEquals(prefs, MAPPER.readValue(json, ClientPreferences.class));
    }
}
