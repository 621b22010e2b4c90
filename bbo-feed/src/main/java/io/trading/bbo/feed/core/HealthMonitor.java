package io.trading.bbo.feed.core;

import io.trading.bbo.feed.connector.FeedConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks the feed connection and logs message and error rates.
 * A connected feed that received nothing during a whole interval is reported as stale.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final FeedConnector connector;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;
    private volatile long disconnectCount = 0;
    private volatile long lastDisconnectTime = 0;
    private volatile long staleCount = 0;
    private long lastMessageCount = 0;
    private long lastErrorCount = 0;

    public HealthMonitor(long checkIntervalMs, FeedConnector connector) {
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive");
        }
        this.checkIntervalMs = checkIntervalMs;
        this.connector = connector;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Runs one check. Called by the scheduler; package-private for tests.
     */
    synchronized void performHealthCheck() {
        boolean connected = connector.isConnected();
        long messages = connector.getMessageCount();
        long errors = connector.getErrorCount();
        long newMessages = messages - lastMessageCount;
        long newErrors = errors - lastErrorCount;
        lastMessageCount = messages;
        lastErrorCount = errors;

        if (!connected) {
            disconnectCount++;
            lastDisconnectTime = System.currentTimeMillis();
            LOGGER.warn("[HealthMonitor] {} is disconnected", connector.getName());
            return;
        }

        if (newMessages == 0) {
            staleCount++;
            LOGGER.warn("[HealthMonitor] {} received no messages in the last {} ms", connector.getName(), checkIntervalMs);
            return;
        }

        double ratePerSecond = newMessages * 1000.0 / checkIntervalMs;
        LOGGER.info("[HealthMonitor] {}: connected, messages={} ({} msg/s), errors={} (+{})",
            connector.getName(),
            messages,
            String.format("%.1f", ratePerSecond),
            errors,
            newErrors
        );
    }

    /**
     * Logs a summary of connection statistics.
     */
    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        LOGGER.info("{}: connected={}, messages={}, errors={}, disconnectCount={}, staleCount={}, lastDisconnect={}",
            connector.getName(),
            connector.isConnected(),
            connector.getMessageCount(),
            connector.getErrorCount(),
            disconnectCount,
            staleCount,
            lastDisconnectTime
        );
        LOGGER.info("=============================");
    }

    public boolean isHealthy() {
        return connector.isConnected();
    }

    public long getDisconnectCount() {
        return disconnectCount;
    }

    public long getStaleCount() {
        return staleCount;
    }

    public long getLastDisconnectTime() {
        return lastDisconnectTime;
    }

    @Override
    public void close() {
        stop();
    }
}
