package in.leanvibe.transport.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.service.reconnection.ReconnectionCoordinator;
import in.leanvibe.service.reconnection.ReconnectionExhaustedException;
import in.leanvibe.service.reconnection.ReconnectionResult;
import in.leanvibe.service.streaming.EventStreamingService;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Undertow WebSocket endpoint for streaming clients.
 *
 * Connect with {@code /ws/events?client_id=<id>}. A client id with retained state
 * is treated as a reconnection; otherwise a new client is registered with default
 * preferences.
 *
 * Client actions (JSON text frames):
 * <pre>
 * {"action": "preferences", "preferences": {"enabled_channels": ["agent"], "min_priority": "high"}}
 * {"action": "ping", "nonce": "abc"}
 * {"action": "heartbeat"}
 * </pre>
 * Replies are {@code ack}, {@code pong} or {@code error} control messages. Partial
 * preference objects are merged onto the client's current preferences.
 *
 * A dropped connection keeps the client's state for reconnection.
 */
public final class StreamingWsEndpoint {
    private static final Logger log = LoggerFactory.getLogger(StreamingWsEndpoint.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static final String TYPE_ACK = "ack";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_PONG = "pong";

    private final EventStreamingService streamingService;
    private final ReconnectionCoordinator reconnection;

    // Channel -> client id, and the channel currently bound to each client id
    private final ConcurrentMap<WebSocketChannel, String> channelClients = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, WebSocketChannel> currentChannels = new ConcurrentHashMap<>();

    // Session setup sends blocking frames and may back off between attempts: keep it off the IO thread
    private final ExecutorService sessionExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ws-session-setup");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong controlSeq = new AtomicLong(0);

    public StreamingWsEndpoint(EventStreamingService streamingService, ReconnectionCoordinator reconnection) {
        this.streamingService = streamingService;
        this.reconnection = reconnection;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String clientId = parseQuery(exchange.getQueryString()).get("client_id");
                if (clientId == null || clientId.isBlank()) {
                    log.warn("[WS] Connection rejected: missing client_id from {}", channel.getSourceAddress());
                    sendError(channel, "Missing client_id");
                    closeQuietly(channel);
                    return;
                }

                channelClients.put(channel, clientId);
                WebSocketChannel previous = currentChannels.put(clientId, channel);
                if (previous != null && previous != channel) {
                    log.info("[WS] Client {} opened a new connection, closing the previous one", clientId);
                    closeQuietly(previous);
                }

                channel.addCloseTask(ch -> handleDisconnect(ch));
                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleClientMessage(ch, message.getData());
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] Error on connection of client {}: {}", channelClients.get(ch), error.toString());
                        super.onError(ch, error);
                    }
                });
                channel.resumeReceives();

                log.info("[WS] Connected: {} (client={})", channel.getSourceAddress(), clientId);
                sessionExecutor.execute(() -> openSession(clientId, channel));
            }
        });
    }

    /**
     * Restore the client's retained session, or register it as new.
     */
    void openSession(String clientId, WebSocketChannel channel) {
        UndertowClientTransport transport = new UndertowClientTransport(channel);
        try {
            if (streamingService.isRegistered(clientId)) {
                ReconnectionResult result = reconnection.clientReconnected(clientId, transport);
                if (result.sessionRestored()) {
                    ObjectNode payload = ackPayload("connect", clientId);
                    payload.put("session_restored", true);
                    payload.put("missed_events_count", result.missedEventsCount());
                    payload.put("last_sequence_number", result.lastSequenceNumber());
                    sendDirect(channel, TYPE_ACK, payload);
                    return;
                }
            }

            ObjectNode payload = ackPayload("connect", clientId);
            payload.put("session_restored", false);
            sendDirect(channel, TYPE_ACK, payload);

            ClientInfo info = streamingService.registerClient(clientId, transport, null);
            reconnection.registerSession(clientId, info);
        } catch (ReconnectionExhaustedException e) {
            log.error("[WS] {}", e.getMessage());
            sendError(channel, "Reconnection failed, please reconnect");
            closeQuietly(channel);
        } catch (Exception e) {
            log.error("[WS] Failed to open session for client {}: {}", clientId, e.getMessage(), e);
            sendError(channel, "Session setup failed");
            closeQuietly(channel);
        }
    }

    void handleClientMessage(WebSocketChannel channel, String raw) {
        String clientId = channelClients.get(channel);
        if (clientId == null) {
            sendError(channel, "Unknown connection");
            return;
        }

        ClientMessage msg;
        try {
            msg = MAPPER.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            sendError(channel, "Invalid JSON: " + e.getOriginalMessage());
            return;
        }
        if (msg.action == null) {
            sendError(channel, "Missing 'action'");
            return;
        }

        switch (msg.action) {
            case "preferences" -> handlePreferences(channel, clientId, msg.preferences);
            case "ping" -> {
                reconnection.heartbeat(clientId);
                ObjectNode payload = MAPPER.createObjectNode();
                payload.put("nonce", msg.nonce == null ? "" : msg.nonce);
                payload.put("pong", true);
                sendDirect(channel, TYPE_PONG, payload);
            }
            case "heartbeat" -> {
                reconnection.heartbeat(clientId);
                sendDirect(channel, TYPE_ACK, ackPayload("heartbeat", clientId));
            }
            default -> sendError(channel, "Unknown action: " + msg.action);
        }
    }

    private void handlePreferences(WebSocketChannel channel, String clientId, JsonNode update) {
        if (update == null || !update.isObject()) {
            sendError(channel, "'preferences' must be an object");
            return;
        }

        ClientPreferences current = streamingService.getClient(clientId)
            .map(ClientInfo::preferences)
            .orElse(ClientPreferences.defaults(clientId));

        ClientPreferences updated;
        try {
            ObjectNode merged = MAPPER.valueToTree(current);
            merged.setAll((ObjectNode) update);
            merged.put("client_id", clientId);
            updated = MAPPER.treeToValue(merged, ClientPreferences.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            sendError(channel, "Invalid preferences: " + e.getMessage());
            return;
        }

        if (!streamingService.updateClientPreferences(clientId, updated)) {
            sendError(channel, "Client not registered");
            return;
        }
        ObjectNode payload = ackPayload("preferences", clientId);
        payload.set("preferences", MAPPER.valueToTree(updated));
        sendDirect(channel, TYPE_ACK, payload);
    }

    private void handleDisconnect(WebSocketChannel channel) {
        String clientId = channelClients.remove(channel);
        if (clientId == null) {
            return;
        }
        // A superseded connection closing must not deactivate its replacement
        if (currentChannels.remove(clientId, channel)) {
            reconnection.clientDisconnected(clientId);
            log.info("[WS] Disconnected: {} (client={})", channel.getSourceAddress(), clientId);
        }
    }

    private ObjectNode ackPayload(String action, String clientId) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("action", action);
        payload.put("client_id", clientId);
        return payload;
    }

    private void sendError(WebSocketChannel channel, String error) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("error", error);
        sendDirect(channel, TYPE_ERROR, payload);
    }

    private void sendDirect(WebSocketChannel channel, String type, JsonNode payload) {
        try {
            String json = MAPPER.writeValueAsString(
                new ServerMessage(type, payload, Instant.now().toString(), controlSeq.incrementAndGet()));
            WebSockets.sendText(json, channel, null);
        } catch (JsonProcessingException e) {
            log.warn("[WS] Failed to serialize {} message: {}", type, e.toString());
        }
    }

    private static void closeQuietly(WebSocketChannel channel) {
        try {
            channel.sendClose();
        } catch (IOException e) {
            log.debug("[WS] Close of {} failed: {}", channel.getSourceAddress(), e.toString());
        }
    }

    /**
     * Parse a raw query string: {@code client_id=abc&foo=bar} -> {client_id: abc, foo: bar}.
     */
    static Map<String, String> parseQuery(String query) {
        Map<String, String> m = new HashMap<>();
        if (query == null || query.isBlank()) return m;

        for (String part : query.split("&")) {
            if (part.isBlank()) continue;
            String[] kv = part.split("=", 2);
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            String v = kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            m.put(k, v);
        }
        return m;
    }

    public int getConnectionCount() {
        return channelClients.size();
    }

    /**
     * Close every connection and stop the session setup pool.
     */
    public void shutdown() {
        for (WebSocketChannel channel : channelClients.keySet()) {
            closeQuietly(channel);
        }
        sessionExecutor.shutdown();
        try {
            if (!sessionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sessionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Message models
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClientMessage {
        public String action;
        public JsonNode preferences;
        public String nonce;
    }

    public record ServerMessage(String type, JsonNode payload, String ts, long seq) {
    }
}
