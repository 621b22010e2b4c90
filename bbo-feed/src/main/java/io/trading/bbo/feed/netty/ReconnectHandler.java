package io.trading.bbo.feed.netty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Schedules reconnection attempts with exponential backoff.
 * At most one attempt is pending at any time, so a handshake failure followed by
 * the channel going inactive does not double-schedule.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    static final long INITIAL_DELAY_MS = 1000;
    static final long MAX_DELAY_MS = 60000;
    static final double BACKOFF_MULTIPLIER = 1.5;

    private final String name;
    private final int maxRetries;
    private final Runnable connectAction;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private int retryCount = 0;
    private long currentDelay = INITIAL_DELAY_MS;
    private volatile boolean running = false;

    /**
     * Creates a new reconnect handler.
     *
     * @param name          Friendly name for logging
     * @param maxRetries    Maximum number of consecutive attempts (-1 for unlimited)
     * @param connectAction Action to perform when reconnecting
     */
    public ReconnectHandler(String name, int maxRetries, Runnable connectAction) {
        this.name = name;
        this.maxRetries = maxRetries;
        this.connectAction = connectAction;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-reconnect-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.info("{}: Reconnect handler started", name);
    }

    public synchronized void stop() {
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        pending.set(false);
        retryCount = 0;
        currentDelay = INITIAL_DELAY_MS;
        LOGGER.info("{}: Reconnect handler stopped", name);
    }

    /**
     * Schedules a reconnection attempt unless one is already pending.
     *
     * @return true if an attempt was scheduled
     */
    public synchronized boolean scheduleReconnect() {
        if (!running) {
            LOGGER.debug("{}: Reconnect handler not running, ignoring reconnect request", name);
            return false;
        }

        if (maxRetries >= 0 && retryCount >= maxRetries) {
            LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", name, maxRetries);
            stop();
            return false;
        }

        if (!pending.compareAndSet(false, true)) {
            LOGGER.debug("{}: Reconnect already pending", name);
            return false;
        }

        retryCount++;
        long delay = currentDelay;
        currentDelay = Math.min((long) (currentDelay * BACKOFF_MULTIPLIER), MAX_DELAY_MS);
        LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms", name, retryCount, delay);

        scheduler.schedule(this::attempt, delay, TimeUnit.MILLISECONDS);
        return true;
    }

    private void attempt() {
        pending.set(false);
        if (!running) {
            return;
        }
        try {
            LOGGER.info("{}: Attempting reconnection #{}", name, retryCount);
            connectAction.run();
        } catch (Exception e) {
            LOGGER.error("{}: Reconnect attempt failed", name, e);
            scheduleReconnect();
        }
    }

    /**
     * Resets the backoff (called on successful connection).
     */
    public synchronized void reset() {
        retryCount = 0;
        currentDelay = INITIAL_DELAY_MS;
        LOGGER.debug("{}: Reconnect state reset", name);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    synchronized long getCurrentDelay() {
        return currentDelay;
    }
}
