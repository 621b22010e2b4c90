package io.trading.bbo.feed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.bbo.marketdata.decoder.MarketDataDecodeException.ErrorKind;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.MessageKind;

/**
 * Prometheus metrics collector for the BBO feed.
 *
 * Tracks:
 * - Raw messages received and their size
 * - Decode errors per error kind
 * - Decoded events per kind
 * - Trade notional distribution
 * - Current top of book
 * - Connection status, reconnect attempts and sequence gaps
 * - Decode latency
 */
public class FeedMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter messagesReceived;
    private final Counter decodeErrors;
    private final Counter eventsDecoded;
    private final Counter reconnectAttempts;
    private final Counter sequenceGaps;

    // Gauges
    private final Gauge connectionStatus;
    private final Gauge topOfBookPrice;
    private final Gauge topOfBookRemaining;

    // Summaries
    private final Summary decodeLatencyMicros;
    private final Summary tradeNotional;

    // Histogram (message size distribution)
    private final Histogram messageSize;

    /**
     * Creates metrics registered in the default registry, including JVM metrics.
     */
    public FeedMetrics() {
        this(CollectorRegistry.defaultRegistry, true);
    }

    /**
     * Creates metrics registered in the given registry.
     *
     * @param registry          Target registry
     * @param includeJvmMetrics Whether to also register GC, memory and thread collectors
     */
    public FeedMetrics(CollectorRegistry registry, boolean includeJvmMetrics) {
        this.registry = registry;
        if (includeJvmMetrics) {
            DefaultExports.register(registry);
        }

        this.messagesReceived = Counter.build()
            .name("feed_messages_received_total")
            .help("Total number of raw messages received from the exchange")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("feed_decode_errors_total")
            .help("Total number of messages rejected by the decoder")
            .labelNames("kind")
            .register(registry);

        this.eventsDecoded = Counter.build()
            .name("feed_events_total")
            .help("Total number of decoded events by kind")
            .labelNames("kind")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("feed_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .register(registry);

        this.sequenceGaps = Counter.build()
            .name("feed_sequence_gaps_total")
            .help("Total number of socket_sequence discontinuities")
            .register(registry);

        // 1 = connected, 0 = disconnected
        this.connectionStatus = Gauge.build()
            .name("feed_connection_status")
            .help("Connection status to the exchange (1 = connected, 0 = disconnected)")
            .register(registry);

        this.topOfBookPrice = Gauge.build()
            .name("feed_top_of_book_price")
            .help("Most recent top-of-book price per side")
            .labelNames("side")
            .register(registry);

        this.topOfBookRemaining = Gauge.build()
            .name("feed_top_of_book_remaining")
            .help("Most recent top-of-book remaining quantity per side")
            .labelNames("side")
            .register(registry);

        this.decodeLatencyMicros = Summary.build()
            .name("feed_decode_latency_microseconds")
            .help("Message decoding latency in microseconds")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);

        this.tradeNotional = Summary.build()
            .name("feed_trade_notional")
            .help("Notional value (amount x price) of reported trades")
            .register(registry);

        this.messageSize = Histogram.build()
            .name("feed_message_size_bytes")
            .help("Message size distribution in bytes")
            .buckets(100, 250, 500, 1000, 5000, 10000)
            .register(registry);
    }

    /**
     * Records a raw message received from the exchange.
     */
    public void recordMessageReceived(int sizeBytes) {
        messagesReceived.inc();
        messageSize.observe(sizeBytes);
    }

    public void recordDecodeError(ErrorKind kind) {
        decodeErrors.labels(kind.name()).inc();
    }

    public void recordEvent(MessageKind kind) {
        eventsDecoded.labels(kind.name()).inc();
    }

    public void recordTradeNotional(double notional) {
        tradeNotional.observe(notional);
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordSequenceGap() {
        sequenceGaps.inc();
    }

    public void setConnectionStatus(boolean connected) {
        connectionStatus.set(connected ? 1 : 0);
    }

    public void recordDecodeLatency(double latencyMicros) {
        decodeLatencyMicros.observe(latencyMicros);
    }

    /**
     * Publishes the current top of book.
     */
    public void updateTopOfBook(BestBidOffer snapshot) {
        topOfBookPrice.labels("bid").set(snapshot.bestBid().doubleValue());
        topOfBookPrice.labels("ask").set(snapshot.bestOffer().doubleValue());
        topOfBookRemaining.labels("bid").set(snapshot.bidAmountRemaining().doubleValue());
        topOfBookRemaining.labels("ask").set(snapshot.askAmountRemaining().doubleValue());
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getMessagesReceived() {
        return messagesReceived.get();
    }

    public double getDecodeErrors(ErrorKind kind) {
        return decodeErrors.labels(kind.name()).get();
    }

    public double getEvents(MessageKind kind) {
        return eventsDecoded.labels(kind.name()).get();
    }

    public double getSequenceGaps() {
        return sequenceGaps.get();
    }

    public double getConnectionStatus() {
        return connectionStatus.get();
    }
}
