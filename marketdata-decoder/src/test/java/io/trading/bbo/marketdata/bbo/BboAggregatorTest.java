package io.trading.bbo.marketdata.bbo;

import io.trading.bbo.marketdata.decoder.MarketMessageDecoder;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.MarketEvent;
import io.trading.bbo.marketdata.model.MarketSide;
import io.trading.bbo.marketdata.model.Quote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BboAggregator.
 */
class BboAggregatorTest {

    private final List<BestBidOffer> reported = new ArrayList<>();
    private final BboAggregator aggregator = new BboAggregator(reported::add);

    @Test
    void testInitialSnapshotIsZero() {
        assertEquals(BestBidOffer.EMPTY, aggregator.snapshot());
        assertTrue(reported.isEmpty());
    }

    @Test
    void testBidQuoteUpdatesOnlyBidSide() {
        aggregator.apply(quote(MarketSide.ASK, "101", "3"));

        BestBidOffer snapshot = aggregator.apply(quote(MarketSide.BID, "99", "2"));

        assertEquals(new BigDecimal("99"), snapshot.bestBid());
        assertEquals(new BigDecimal("2"), snapshot.bidAmountRemaining());
        assertEquals(new BigDecimal("101"), snapshot.bestOffer());
        assertEquals(new BigDecimal("3"), snapshot.askAmountRemaining());
    }

    @Test
    void testAskQuoteUpdatesOnlyAskSide() {
        aggregator.apply(quote(MarketSide.BID, "99", "2"));

        BestBidOffer snapshot = aggregator.apply(quote(MarketSide.ASK, "101", "0.5"));

        assertEquals(new BigDecimal("99"), snapshot.bestBid());
        assertEquals(new BigDecimal("2"), snapshot.bidAmountRemaining());
        assertEquals(new BigDecimal("101"), snapshot.bestOffer());
        assertEquals(new BigDecimal("0.5"), snapshot.askAmountRemaining());
    }

    @Test
    void testLatestQuoteWinsEvenIfWorse() {
        aggregator.apply(quote(MarketSide.BID, "100", "1"));
        BestBidOffer snapshot = aggregator.apply(quote(MarketSide.BID, "98", "4"));

        assertEquals(new BigDecimal("98"), snapshot.bestBid());
        assertEquals(new BigDecimal("4"), snapshot.bidAmountRemaining());
    }

    @Test
    void testUnknownSideIsNoOpButStillReported() {
        aggregator.apply(quote(MarketSide.BID, "99", "2"));
        aggregator.apply(quote(MarketSide.ASK, "101", "3"));
        BestBidOffer before = aggregator.snapshot();

        BestBidOffer after = aggregator.apply(quote(MarketSide.UNKNOWN, "500", "9"));

        assertEquals(before, after);
        assertEquals(3, reported.size());
        assertEquals(before, reported.get(2));
        assertEquals(1, aggregator.getIgnoredQuoteCount());
    }

    @Test
    void testEveryApplyReportsExactlyOnce() {
        aggregator.apply(quote(MarketSide.BID, "1", "1"));
        aggregator.apply(quote(MarketSide.UNKNOWN, "2", "1"));
        aggregator.apply(quote(MarketSide.ASK, "3", "1"));

        assertEquals(3, reported.size());
        assertEquals(new BigDecimal("3"), reported.get(2).bestOffer());
    }

    @Test
    void testCrossedBookIsPassedThrough() {
        aggregator.apply(quote(MarketSide.ASK, "100", "1"));
        BestBidOffer snapshot = aggregator.apply(quote(MarketSide.BID, "105", "1"));

        assertTrue(snapshot.bestBid().compareTo(snapshot.bestOffer()) > 0);
    }

    @Test
    void testSequenceFromSingleMessage() {
        String message = """
            {"eventId": 1, "socket_sequence": 1, "events": [
                {"type": "change", "side": "bid", "price": "50000.00", "remaining": "1.5"},
                {"type": "change", "side": "ask", "price": "50010.00", "remaining": "0.8"}
            ]}
            """;

        for (MarketEvent event : new MarketMessageDecoder().decode(message).events()) {
            aggregator.apply((Quote) event);
        }

        BestBidOffer snapshot = aggregator.snapshot();
        assertEquals(0, new BigDecimal("50000.00").compareTo(snapshot.bestBid()));
        assertEquals(0, new BigDecimal("1.5").compareTo(snapshot.bidAmountRemaining()));
        assertEquals(0, new BigDecimal("50010.00").compareTo(snapshot.bestOffer()));
        assertEquals(0, new BigDecimal("0.8").compareTo(snapshot.askAmountRemaining()));
    }

    @Test
    void testConcurrentReadersNeverSeeTornSide() throws InterruptedException {
        // Each write keeps remaining == price, so a torn read shows up as a mismatch
        BboAggregator shared = new BboAggregator();
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicReference<BestBidOffer> torn = new AtomicReference<>();
        CountDownLatch readersDone = new CountDownLatch(4);

        for (int r = 0; r < 4; r++) {
            Thread reader = new Thread(() -> {
                try {
                    while (writing.get()) {
                        BestBidOffer s = shared.snapshot();
                        if (s.bestBid().compareTo(s.bidAmountRemaining()) != 0
                            || s.bestOffer().compareTo(s.askAmountRemaining()) != 0) {
                            torn.compareAndSet(null, s);
                        }
                    }
                } finally {
                    readersDone.countDown();
                }
            }, "bbo-reader-" + r);
            reader.setDaemon(true);
            reader.start();
        }

        for (int i = 1; i <= 50_000; i++) {
            String value = Integer.toString(i);
            shared.apply(quote(i % 2 == 0 ? MarketSide.BID : MarketSide.ASK, value, value));
        }
        writing.set(false);

        assertTrue(readersDone.await(10, TimeUnit.SECONDS));
        assertNull(torn.get(), () -> "Observed torn snapshot: " + torn.get());
    }

    private static Quote quote(MarketSide side, String price, String remaining) {
        return new Quote(new BigDecimal(price), "place", new BigDecimal(remaining), side, null);
    }
}
