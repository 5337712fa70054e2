package in.leanvibe.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.infrastructure.resilience.UpstreamGuard;
import in.leanvibe.service.reconnection.ReconnectionCoordinator;
import in.leanvibe.service.streaming.EventStreamingService;
import in.leanvibe.service.streaming.StatsSnapshot;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for streaming introspection endpoints:
 * - GET /api/streaming/stats    - Aggregate delivery counters
 * - GET /api/streaming/clients  - Per-client connection state and preferences
 * - GET /api/streaming/sessions - Retained reconnection sessions
 * - GET /health                 - Liveness plus upstream dependency health
 */
public final class StreamingAdminHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamingAdminHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final EventStreamingService streamingService;
    private final ReconnectionCoordinator reconnection;
    private final List<UpstreamGuard> upstreams;

    public StreamingAdminHandler(EventStreamingService streamingService,
                                 ReconnectionCoordinator reconnection,
                                 List<UpstreamGuard> upstreams) {
        this.streamingService = streamingService;
        this.reconnection = reconnection;
        this.upstreams = List.copyOf(upstreams);
    }

    /**
     * GET /api/streaming/stats
     */
    public void getStats(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, streamingService.getStats());
        } catch (Exception e) {
            log.error("Failed to get streaming stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get streaming stats: " + e.getMessage());
        }
    }

    /**
     * GET /api/streaming/clients
     */
    public void getClients(HttpServerExchange exchange) {
        try {
            Map<String, ClientInfo> clients = streamingService.getClientInfo();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("total_clients", clients.size());
            body.put("active_clients", clients.values().stream().filter(ClientInfo::active).count());
            body.put("clients", clients);
            sendJson(exchange, StatusCodes.OK, body);
        } catch (Exception e) {
            log.error("Failed to get streaming clients: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get streaming clients: " + e.getMessage());
        }
    }

    /**
     * GET /api/streaming/sessions
     */
    public void getSessions(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, reconnection.getSessionInfo());
        } catch (Exception e) {
            log.error("Failed to get reconnection sessions: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get sessions: " + e.getMessage());
        }
    }

    /**
     * GET /health
     *
     * 200 with status "healthy" or "degraded" while the delivery loop runs; 503 otherwise.
     */
    public void getHealth(HttpServerExchange exchange) {
        try {
            List<UpstreamGuard.GuardHealth> upstreamHealth = new ArrayList<>();
            boolean degraded = false;
            for (UpstreamGuard guard : upstreams) {
                UpstreamGuard.GuardHealth health = guard.health();
                upstreamHealth.add(health);
                if (!health.isHealthy()) {
                    degraded = true;
                }
            }

            boolean running = streamingService.isRunning();
            String status = !running ? "unavailable" : degraded ? "degraded" : "healthy";
            StatsSnapshot stats = streamingService.getStats();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", status);
            body.put("timestamp", Instant.now());
            body.put("streaming_running", running);
            body.put("connected_clients", stats.connectedClients());
            body.put("queue_depth", stats.queueDepth());
            body.put("upstreams", upstreamHealth);

            sendJson(exchange, running ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE, body);
        } catch (Exception e) {
            log.error("Failed to get health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get health: " + e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws JsonProcessingException {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
