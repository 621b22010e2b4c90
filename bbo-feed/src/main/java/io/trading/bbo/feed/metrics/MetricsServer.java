package io.trading.bbo.feed.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.bbo.feed.config.FeedConfig;
import io.trading.bbo.feed.connector.FeedConnector;
import io.trading.bbo.marketdata.bbo.BboAggregator;
import io.trading.bbo.marketdata.model.BestBidOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * HTTP server for exposing Prometheus metrics and a small JSON API.
 * Serves /metrics, /health, /api/bbo and /api/status.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final FeedConfig config;
    private final FeedConnector connector;
    private final BboAggregator aggregator;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(int port, FeedMetrics metrics, FeedConfig config, FeedConnector connector, BboAggregator aggregator) {
        this.port = port;
        this.config = config;
        this.connector = connector;
        this.aggregator = aggregator;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/bbo", handleBbo());
        server.createContext("/api/status", handleStatus());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  Health:     http://localhost:{}/health", boundPort);
        LOGGER.info("  API BBO:    http://localhost:{}/api/bbo", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
    }

    /**
     * Gets the bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                sendResponse(exchange, 500, "text/plain", "Internal server error");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                boolean healthy = connector.isConnected();
                HealthResponse health = new HealthResponse(
                    healthy,
                    healthy ? "Feed connected" : connector.getName() + " disconnected"
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                sendResponse(exchange, healthy ? 200 : 503, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleBbo() {
        return exchange -> {
            try {
                BestBidOffer snapshot = aggregator.snapshot();
                BboResponse bbo = new BboResponse(
                    config.symbol(),
                    snapshot.bestBid().toPlainString(),
                    snapshot.bestOffer().toPlainString(),
                    snapshot.bidAmountRemaining().toPlainString(),
                    snapshot.askAmountRemaining().toPlainString()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(bbo);
                sendResponse(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling bbo request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                StatusResponse status = new StatusResponse(
                    config.symbol(),
                    config.streamUri().toString(),
                    connector.isConnected(),
                    System.currentTimeMillis() - startTime,
                    connector.getMessageCount(),
                    connector.getErrorCount(),
                    aggregator.getIgnoredQuoteCount(),
                    config.outputFormat().name()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
                sendResponse(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            server = null;
            LOGGER.info("HTTP server stopped");
        }
    }

    private record HealthResponse(boolean healthy, String message) {}
    private record BboResponse(String symbol, String bestBid, String bestOffer,
                               String bidAmountRemaining, String askAmountRemaining) {}
    private record StatusResponse(String symbol, String streamUri, boolean connected, long uptimeMs,
                                  long totalMessages, long errors, long ignoredQuotes, String outputFormat) {}
}
