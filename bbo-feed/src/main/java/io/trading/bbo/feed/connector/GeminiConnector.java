package io.trading.bbo.feed.connector;

import io.trading.bbo.feed.config.FeedConfig;
import io.trading.bbo.feed.core.ProcessingTimer;
import io.trading.bbo.feed.dispatch.MarketEventDispatcher;
import io.trading.bbo.feed.metrics.FeedMetrics;
import io.trading.bbo.feed.netty.ReconnectHandler;
import io.trading.bbo.feed.netty.WebSocketClient;
import io.trading.bbo.marketdata.decoder.MarketDataDecodeException;
import io.trading.bbo.marketdata.decoder.MarketMessageDecoder;
import io.trading.bbo.marketdata.model.MarketMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gemini v1 market-data connector.
 * Connects to wss://api.gemini.com/v1/marketdata/{symbol}?top_of_book=true, decodes every
 * frame and dispatches its events. Frames arrive on a single Netty I/O thread, so messages
 * are processed one at a time in wire order.
 *
 * A frame that fails to decode is logged with its context, counted and skipped;
 * the stream keeps running.
 */
public class GeminiConnector implements FeedConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiConnector.class);

    private final FeedConfig config;
    private final String name;
    private final MarketMessageDecoder decoder;
    private final MarketEventDispatcher dispatcher;
    private final FeedMetrics metrics;
    private final ProcessingTimer processingTimer;
    private final AtomicLong messageCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);
    private final AtomicLong lastSocketSequence = new AtomicLong(-1);

    private volatile WebSocketClient client;
    private volatile ReconnectHandler reconnectHandler;

    public GeminiConnector(
        FeedConfig config,
        MarketMessageDecoder decoder,
        MarketEventDispatcher dispatcher,
        FeedMetrics metrics,
        ProcessingTimer processingTimer
    ) {
        this.config = config;
        this.name = "Gemini-" + config.symbol();
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.processingTimer = processingTimer;
    }

    @Override
    public synchronized void connect() {
        if (client != null) {
            LOGGER.warn("[{}] Connector already started", name);
            return;
        }

        URI uri = config.streamUri();

        reconnectHandler = new ReconnectHandler(name, config.reconnectMaxRetries(), () -> {
            metrics.recordReconnectAttempt();
            doConnect();
        });
        reconnectHandler.start();

        client = new WebSocketClient(
            uri,
            name,
            this::onMessage,
            this::onError,
            this::onConnected,
            this::onDisconnected,
            config.enableCompression()
        );

        LOGGER.info("[{}] Subscribing to {}", name, uri);
        doConnect();
    }

    @Override
    public synchronized void disconnect() {
        if (reconnectHandler != null) {
            reconnectHandler.stop();
            reconnectHandler = null;
        }
        if (client != null) {
            client.close();
            client = null;
        }
        metrics.setConnectionStatus(false);
        LOGGER.info("[{}] Disconnected", name);
    }

    @Override
    public boolean isConnected() {
        WebSocketClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public long getMessageCount() {
        return messageCount.get();
    }

    @Override
    public long getErrorCount() {
        return errorCount.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void close() {
        disconnect();
    }

    /**
     * Decodes and dispatches one raw frame. Empty frames are dropped by the transport.
     */
    void onMessage(byte[] raw) {
        messageCount.incrementAndGet();
        metrics.recordMessageReceived(raw.length);

        MarketMessage message;
        ProcessingTimer.TimingContext decodeTimer = processingTimer.start();
        try {
            message = decoder.decode(raw);
        } catch (MarketDataDecodeException e) {
            errorCount.incrementAndGet();
            metrics.recordDecodeError(e.getErrorKind());
            LOGGER.warn("[{}] Skipping malformed message #{} ({}, event index {}): {} | raw: {}",
                name, messageCount.get(), e.getErrorKind(), e.getEventIndex(), e.getMessage(), e.getRawSnippet());
            LOGGER.debug("[{}] Decode failure detail", name, e);
            return;
        }
        long decodeNanos = decodeTimer.stop();
        processingTimer.record(ProcessingTimer.STAGE_DECODE, decodeNanos);
        metrics.recordDecodeLatency(decodeNanos / 1_000.0);

        checkSequence(message.socketSequence());

        ProcessingTimer.TimingContext dispatchTimer = processingTimer.start();
        dispatcher.dispatch(message);
        processingTimer.record(ProcessingTimer.STAGE_DISPATCH, dispatchTimer.stop());
    }

    /**
     * Gemini numbers the messages of a connection 0, 1, 2...; anything else means messages were lost.
     */
    private void checkSequence(long socketSequence) {
        long previous = lastSocketSequence.getAndSet(socketSequence);
        if (previous >= 0 && socketSequence != previous + 1) {
            metrics.recordSequenceGap();
            LOGGER.warn("[{}] socket_sequence gap: expected {}, got {}", name, previous + 1, socketSequence);
        }
    }

    private void doConnect() {
        WebSocketClient current = client;
        if (current != null) {
            current.connect();
        }
    }

    private void onConnected() {
        lastSocketSequence.set(-1);
        metrics.setConnectionStatus(true);
        ReconnectHandler handler = reconnectHandler;
        if (handler != null) {
            handler.reset();
        }
        LOGGER.info("[{}] Connected", name);
    }

    private void onDisconnected() {
        metrics.setConnectionStatus(false);
        ReconnectHandler handler = reconnectHandler;
        if (handler != null && handler.isRunning()) {
            LOGGER.warn("[{}] Disconnected, scheduling reconnect...", name);
            handler.scheduleReconnect();
        }
    }

    private void onError(Throwable error) {
        errorCount.incrementAndGet();
        LOGGER.error("[{}] WebSocket error", name, error);
        ReconnectHandler handler = reconnectHandler;
        if (!isConnected() && handler != null && handler.isRunning()) {
            handler.scheduleReconnect();
        }
    }

    long getLastSocketSequence() {
        return lastSocketSequence.get();
    }
}
