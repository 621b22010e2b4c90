package io.trading.bbo.marketdata.bbo;

import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Folds quote events into a single best bid/offer record.
 *
 * A bid quote overwrites the bid price and remaining amount, an ask quote the ask pair,
 * and a quote with an unknown side changes nothing. Both fields of a side are written
 * under the same lock that {@link #snapshot()} copies them under, so a reader never sees
 * a new price paired with a stale remaining amount.
 *
 * Crossed books (bid at or above the offer) are passed through unchanged.
 */
public class BboAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BboAggregator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final BboListener listener;
    private final AtomicLong ignoredQuotes = new AtomicLong(0);

    // Guarded by lock
    private BigDecimal bestBid = BigDecimal.ZERO;
    private BigDecimal bestOffer = BigDecimal.ZERO;
    private BigDecimal bidAmountRemaining = BigDecimal.ZERO;
    private BigDecimal askAmountRemaining = BigDecimal.ZERO;

    /**
     * Creates an aggregator that reports every snapshot to the given listener.
     */
    public BboAggregator(BboListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    /**
     * Creates an aggregator without a reporting sink.
     */
    public BboAggregator() {
        this(snapshot -> { });
    }

    /**
     * Applies one quote and reports the resulting snapshot.
     *
     * @param quote The decoded quote
     * @return the snapshot after the update, unchanged if the quote's side is unknown
     */
    public BestBidOffer apply(Quote quote) {
        BestBidOffer snapshot;

        lock.lock();
        try {
            switch (quote.side()) {
                case BID -> {
                    bestBid = quote.price();
                    bidAmountRemaining = quote.remaining();
                }
                case ASK -> {
                    bestOffer = quote.price();
                    askAmountRemaining = quote.remaining();
                }
                case UNKNOWN -> ignoredQuotes.incrementAndGet();
            }
            snapshot = copy();
        } finally {
            lock.unlock();
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Applied {} -> {}", quote, snapshot);
        }
        listener.onBestBidOffer(snapshot);
        return snapshot;
    }

    /**
     * Returns the current snapshot without modifying anything.
     */
    public BestBidOffer snapshot() {
        lock.lock();
        try {
            return copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of quotes applied with an unknown side.
     */
    public long getIgnoredQuoteCount() {
        return ignoredQuotes.get();
    }

    private BestBidOffer copy() {
        return new BestBidOffer(bestBid, bestOffer, bidAmountRemaining, askAmountRemaining);
    }
}
