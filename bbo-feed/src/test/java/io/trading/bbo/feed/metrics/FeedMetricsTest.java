package io.trading.bbo.feed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.bbo.marketdata.decoder.MarketDataDecodeException.ErrorKind;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeedMetricsTest {

    private final CollectorRegistry registry = new CollectorRegistry();
    private final FeedMetrics metrics = new FeedMetrics(registry, false);

    @Test
    void testCounters() {
        metrics.recordMessageReceived(512);
        metrics.recordMessageReceived(128);
        metrics.recordDecodeError(ErrorKind.MALFORMED_EVENT_FIELD);
        metrics.recordEvent(MessageKind.TRADE);
        metrics.recordSequenceGap();

        assertEquals(2.0, metrics.getMessagesReceived());
        assertEquals(1.0, metrics.getDecodeErrors(ErrorKind.MALFORMED_EVENT_FIELD));
        assertEquals(0.0, metrics.getDecodeErrors(ErrorKind.MALFORMED_MESSAGE));
        assertEquals(1.0, metrics.getEvents(MessageKind.TRADE));
        assertEquals(1.0, metrics.getSequenceGaps());
    }

    @Test
    void testConnectionStatus() {
        metrics.setConnectionStatus(true);
        assertEquals(1.0, metrics.getConnectionStatus());

        metrics.setConnectionStatus(false);
        assertEquals(0.0, metrics.getConnectionStatus());
    }

    @Test
    void testTopOfBookGauges() {
        metrics.updateTopOfBook(new BestBidOffer(
            new BigDecimal("50000.00"),
            new BigDecimal("50010.00"),
            new BigDecimal("1.5"),
            new BigDecimal("0.8")
        ));

        assertEquals(50000.0, registry.getSampleValue("feed_top_of_book_price", new String[] {"side"}, new String[] {"bid"}));
        assertEquals(50010.0, registry.getSampleValue("feed_top_of_book_price", new String[] {"side"}, new String[] {"ask"}));
        assertEquals(0.8, registry.getSampleValue("feed_top_of_book_remaining", new String[] {"side"}, new String[] {"ask"}));
    }
}
