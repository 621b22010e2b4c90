package io.trading.bbo.feed.core;

import io.trading.bbo.feed.config.FeedConfig;
import io.trading.bbo.feed.connector.GeminiConnector;
import io.trading.bbo.feed.dispatch.MarketEventDispatcher;
import io.trading.bbo.feed.metrics.FeedMetrics;
import io.trading.bbo.feed.metrics.MetricsServer;
import io.trading.bbo.feed.report.MarketDataReporter;
import io.trading.bbo.marketdata.bbo.BboAggregator;
import io.trading.bbo.marketdata.decoder.MarketMessageDecoder;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Main controller for the BBO feed.
 * Wires the decoder, aggregator, reporter and connector, and owns their lifecycle.
 */
public class FeedController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedController.class);

    private final FeedConfig config;
    private final FeedMetrics metrics;
    private final MarketDataReporter reporter;
    private final BboAggregator aggregator;
    private final ProcessingTimer processingTimer;
    private final GeminiConnector connector;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final ShutdownSignalBarrier shutdownBarrier;

    private volatile boolean closed = false;

    public FeedController(FeedConfig config) {
        this(config, MarketDataReporter.create(config.outputFormat()), new FeedMetrics());
    }

    FeedController(FeedConfig config, MarketDataReporter reporter, FeedMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.reporter = reporter;
        this.aggregator = new BboAggregator(snapshot -> {
            metrics.updateTopOfBook(snapshot);
            reporter.onBestBidOffer(snapshot);
        });
        this.processingTimer = new ProcessingTimer();

        MarketEventDispatcher dispatcher = new MarketEventDispatcher(aggregator, reporter, metrics);
        this.connector = new GeminiConnector(config, new MarketMessageDecoder(), dispatcher, metrics, processingTimer);
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), connector);
        this.metricsServer = config.metricsEnabled()
            ? new MetricsServer(config.metricsPort(), metrics, config, connector, aggregator)
            : null;
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Feed controller initialized: {}", connector.getName());
    }

    /**
     * Starts the metrics server, the health monitor and the connector.
     */
    public void start() throws IOException {
        LOGGER.info("Starting BBO feed...");

        if (metricsServer != null) {
            metricsServer.start();
        } else {
            LOGGER.info("Metrics server disabled");
        }
        healthMonitor.start();
        connector.connect();

        LOGGER.info("BBO feed started for {}", config.symbol());
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Feed running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the feed gracefully.
     */
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        LOGGER.info("Shutting down BBO feed...");

        logStatus();
        CloseHelper.closeAll(connector, healthMonitor, metricsServer);

        LOGGER.info("BBO feed shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current feed status.
     */
    public void logStatus() {
        LOGGER.info("=== Feed Status ===");
        LOGGER.info("{}: connected={}, messages={}, errors={}, ignoredQuotes={}",
            connector.getName(),
            connector.isConnected(),
            connector.getMessageCount(),
            connector.getErrorCount(),
            aggregator.getIgnoredQuoteCount()
        );
        LOGGER.info("Top of book: {}", aggregator.snapshot());
        for (Map.Entry<String, ProcessingTimer.TimerStats> entry : processingTimer.getAllStats().entrySet()) {
            ProcessingTimer.TimerStats stats = entry.getValue();
            if (stats.getCount() > 0) {
                LOGGER.info("  [{}] {}", entry.getKey(), stats);
            }
        }
        healthMonitor.logSummary();
        LOGGER.info("===================");
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public BboAggregator getAggregator() {
        return aggregator;
    }

    public GeminiConnector getConnector() {
        return connector;
    }
}
