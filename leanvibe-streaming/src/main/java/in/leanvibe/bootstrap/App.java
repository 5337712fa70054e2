package in.leanvibe.bootstrap;

import in.leanvibe.config.ReconnectionConfig;
import in.leanvibe.config.ResilienceConfig;
import in.leanvibe.config.StreamingConfig;
import in.leanvibe.domain.event.EventType;
import in.leanvibe.domain.event.StreamEvents;
import in.leanvibe.infrastructure.metrics.PrometheusMetricsHandler;
import in.leanvibe.infrastructure.metrics.PrometheusStreamingMetrics;
import in.leanvibe.infrastructure.resilience.CircuitBreaker;
import in.leanvibe.infrastructure.resilience.RankedStrategies;
import in.leanvibe.infrastructure.resilience.StrategySelector;
import in.leanvibe.infrastructure.resilience.UpstreamGuard;
import in.leanvibe.service.reconnection.ReconnectionCoordinator;
import in.leanvibe.service.streaming.EventStreamingService;
import in.leanvibe.service.streaming.UpstreamHealthEvents;
import in.leanvibe.transport.http.StreamingAdminHandler;
import in.leanvibe.transport.ws.StreamingWsEndpoint;
import in.leanvibe.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * LeanVibe event streaming server.
 *
 * Endpoints:
 * - WS  /ws/events?client_id=...    - Event stream
 * - GET /api/streaming/stats        - Delivery counters
 * - GET /api/streaming/clients      - Connected clients
 * - GET /api/streaming/sessions     - Reconnection sessions
 * - GET /health                     - Health
 * - GET /metrics                    - Prometheus
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LeanVibe Event Streaming Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        StreamingConfig streamingConfig = StreamingConfig.fromEnv();
        ReconnectionConfig reconnectionConfig = ReconnectionConfig.fromEnv();
        ResilienceConfig resilienceConfig = ResilienceConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusStreamingMetrics metrics = new PrometheusStreamingMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Event Streaming Engine + Reconnection
        // ═══════════════════════════════════════════════════════════════
        EventStreamingService streamingService = new EventStreamingService(streamingConfig);
        streamingService.setMetrics(metrics);

        ReconnectionCoordinator reconnection = new ReconnectionCoordinator(streamingService, reconnectionConfig);
        reconnection.setMetrics(metrics);
        streamingService.setMissedEventListener(reconnection);
        log.info("✓ Streaming engine initialized (queue capacity: {}, grace period: {}s)",
            streamingConfig.queueCapacity(), reconnectionConfig.gracePeriod().toSeconds());

        // ═══════════════════════════════════════════════════════════════
        // Upstream Resilience (inference backend)
        // ═══════════════════════════════════════════════════════════════
        RankedStrategies inference = new RankedStrategies("inference", resilienceConfig.recoveryTimeout());
        for (String strategy : Env.get("INFERENCE_STRATEGIES", "production,pragmatic,fallback").split(",")) {
            if (!strategy.isBlank()) {
                inference.add(strategy.trim(), () -> true);
            }
        }

        CircuitBreaker breaker = new CircuitBreaker("inference",
            resilienceConfig.failureThreshold(), resilienceConfig.recoveryTimeout());
        breaker.setMetrics(metrics);

        StrategySelector selector = new StrategySelector(inference, resilienceConfig);
        selector.setMetrics(metrics);
        selector.onStrategySwitch(new UpstreamHealthEvents(streamingService));

        UpstreamGuard inferenceGuard = new UpstreamGuard("inference", breaker, selector);
        inferenceGuard.onOutcome(inference::recordOutcome);
        log.info("✓ Upstream guard initialized (strategies: {})", inference.rankedStrategies());

        // ═══════════════════════════════════════════════════════════════
        // HTTP + WebSocket
        // ═══════════════════════════════════════════════════════════════
        StreamingWsEndpoint wsEndpoint = new StreamingWsEndpoint(streamingService, reconnection);
        StreamingAdminHandler adminHandler =
            new StreamingAdminHandler(streamingService, reconnection, List.of(inferenceGuard));
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        int port = streamingConfig.httpPort();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", adminHandler::getHealth)
            .get("/api/streaming/stats", adminHandler::getStats)
            .get("/api/streaming/clients", adminHandler::getClients)
            .get("/api/streaming/sessions", adminHandler::getSessions)
            .get("/ws/events", wsEndpoint.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "LeanVibe Event Streaming\n\n" +
                    "API: GET /health, /api/streaming/stats, /api/streaming/clients, /api/streaming/sessions\n" +
                    "WS:  ws://localhost:" + port + "/ws/events?client_id=<id>\n"
                );
            });

        // ═══════════════════════════════════════════════════════════════
        // Start
        // ═══════════════════════════════════════════════════════════════
        streamingService.start();
        reconnection.start();
        selector.start();

        Undertow server = Undertow.builder()
            .addHttpListener(port, streamingConfig.bindAddress())
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ LeanVibe event streaming started on http://{}:{}/", streamingConfig.bindAddress(), port);

        try {
            streamingService.emitEvent(StreamEvents.system(EventType.SYSTEM_READY,
                "Event streaming ready", Map.of("port", port)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down LeanVibe event streaming...");
            wsEndpoint.shutdown();
            server.stop();
            selector.stop();
            reconnection.stop();
            streamingService.shutdown();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }

    private App() {}
}
