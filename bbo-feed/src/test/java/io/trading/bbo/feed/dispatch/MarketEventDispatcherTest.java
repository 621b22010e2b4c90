package io.trading.bbo.feed.dispatch;

import io.prometheus.client.CollectorRegistry;
import io.trading.bbo.feed.metrics.FeedMetrics;
import io.trading.bbo.feed.report.RecordingReporter;
import io.trading.bbo.marketdata.bbo.BboAggregator;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.MarketMessage;
import io.trading.bbo.marketdata.model.MarketSide;
import io.trading.bbo.marketdata.model.MessageKind;
import io.trading.bbo.marketdata.model.Quote;
import io.trading.bbo.marketdata.model.Trade;
import io.trading.bbo.marketdata.model.TradeReport;
import io.trading.bbo.marketdata.model.UnknownEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketEventDispatcherTest {

    private RecordingReporter reporter;
    private BboAggregator aggregator;
    private FeedMetrics metrics;
    private MarketEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        reporter = new RecordingReporter();
        aggregator = new BboAggregator(reporter);
        metrics = new FeedMetrics(new CollectorRegistry(), false);
        dispatcher = new MarketEventDispatcher(aggregator, reporter, metrics);
    }

    @Test
    void testWireOrderPreserved() {
        Quote bid = quote(MarketSide.BID, "50000.00", "1.5");
        Trade trade = new Trade(new BigDecimal("50005.00"), new BigDecimal("0.1"), MarketSide.ASK);
        Quote ask = quote(MarketSide.ASK, "50010.00", "0.8");

        dispatcher.dispatch(new MarketMessage(1L, List.of(bid, trade, ask), null, null, 0L));

        List<Object> records = reporter.getRecords();
        assertEquals(3, records.size());
        assertInstanceOf(BestBidOffer.class, records.get(0));
        assertInstanceOf(TradeReport.class, records.get(1));
        assertInstanceOf(BestBidOffer.class, records.get(2));

        BestBidOffer last = (BestBidOffer) records.get(2);
        assertEquals(0, new BigDecimal("50000.00").compareTo(last.bestBid()));
        assertEquals(0, new BigDecimal("1.5").compareTo(last.bidAmountRemaining()));
        assertEquals(0, new BigDecimal("50010.00").compareTo(last.bestOffer()));
        assertEquals(0, new BigDecimal("0.8").compareTo(last.askAmountRemaining()));
    }

    @Test
    void testTradeReportedWithNotional() {
        Trade trade = new Trade(new BigDecimal("100.50"), new BigDecimal("2"), MarketSide.BID);

        dispatcher.dispatch(new MarketMessage(2L, List.of(trade), null, null, 0L));

        assertEquals(1, reporter.getTrades().size());
        assertEquals(0, new BigDecimal("201.00").compareTo(reporter.getTrades().get(0).notional()));
        assertTrue(reporter.getSnapshots().isEmpty(), "trades do not touch the book");
        assertEquals(BestBidOffer.EMPTY, aggregator.snapshot());
    }

    @Test
    void testUnknownEventsSkipped() {
        dispatcher.dispatch(new MarketMessage(3L, List.of(UnknownEvent.INSTANCE, UnknownEvent.INSTANCE), null, null, 0L));

        assertTrue(reporter.getRecords().isEmpty());
        assertEquals(2.0, metrics.getEvents(MessageKind.UNKNOWN));
    }

    @Test
    void testEmptyMessage() {
        dispatcher.dispatch(new MarketMessage(4L, List.of(), null, null, 0L));

        assertTrue(reporter.getRecords().isEmpty());
    }

    @Test
    void testEventCountsByKind() {
        Quote quote = quote(MarketSide.BID, "10", "1");
        Trade trade = new Trade(BigDecimal.TEN, BigDecimal.ONE, MarketSide.UNKNOWN);

        dispatcher.dispatch(new MarketMessage(5L, List.of(quote, quote, trade, UnknownEvent.INSTANCE), null, null, 0L));

        assertEquals(2.0, metrics.getEvents(MessageKind.CHANGE));
        assertEquals(1.0, metrics.getEvents(MessageKind.TRADE));
        assertEquals(1.0, metrics.getEvents(MessageKind.UNKNOWN));
    }

    @Test
    void testUnknownSideQuoteStillReportsSnapshot() {
        dispatcher.dispatch(new MarketMessage(6L, List.of(quote(MarketSide.UNKNOWN, "1", "1")), null, null, 0L));

        assertEquals(List.of(BestBidOffer.EMPTY), reporter.getSnapshots());
    }

    private static Quote quote(MarketSide side, String price, String remaining) {
        return new Quote(new BigDecimal(price), "place", new BigDecimal(remaining), side, null);
    }
}
