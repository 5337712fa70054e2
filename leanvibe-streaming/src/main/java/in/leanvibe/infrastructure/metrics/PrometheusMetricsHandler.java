package in.leanvibe.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.Set;
import java.util.TreeSet;

/**
 * Serves the streaming engine's registry at /metrics.
 *
 * Scrapers may restrict the output with repeated {@code name[]} parameters
 * ({@code /metrics?name[]=streaming_connected_clients}); the format follows the
 * Accept header (text 0.0.4 unless OpenMetrics is asked for).
 *
 * <pre>
 * # HELP streaming_messages_delivered_total Total number of messages delivered to clients
 * # TYPE streaming_messages_delivered_total counter
 * streaming_messages_delivered_total{message_type="notification",compressed="false",} 1234.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));

        Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, samples);
        } catch (IOException e) {
            log.error("[Metrics] Failed to export streaming metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
        log.debug("[Metrics] Served metrics ({} chars, names: {})", writer.getBuffer().length(),
            names.isEmpty() ? "all" : names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new TreeSet<>();
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        if (values != null) {
            for (String value : values) {
                if (!value.isBlank()) {
                    names.add(value.trim());
                }
            }
        }
        return names;
    }
}
