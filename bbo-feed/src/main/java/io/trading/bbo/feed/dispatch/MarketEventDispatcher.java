package io.trading.bbo.feed.dispatch;

import io.trading.bbo.feed.metrics.FeedMetrics;
import io.trading.bbo.feed.report.MarketDataReporter;
import io.trading.bbo.marketdata.bbo.BboAggregator;
import io.trading.bbo.marketdata.model.MarketEvent;
import io.trading.bbo.marketdata.model.MarketMessage;
import io.trading.bbo.marketdata.model.Quote;
import io.trading.bbo.marketdata.model.Trade;
import io.trading.bbo.marketdata.model.TradeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes the events of a decoded message, in wire order.
 * Trades go to the reporter with their notional value, quotes go to the BBO aggregator
 * (which reports the resulting snapshot), unknown events are counted and skipped.
 */
public class MarketEventDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketEventDispatcher.class);

    private final BboAggregator aggregator;
    private final MarketDataReporter reporter;
    private final FeedMetrics metrics;

    public MarketEventDispatcher(BboAggregator aggregator, MarketDataReporter reporter, FeedMetrics metrics) {
        this.aggregator = aggregator;
        this.reporter = reporter;
        this.metrics = metrics;
    }

    /**
     * Processes every event of the message before returning.
     */
    public void dispatch(MarketMessage message) {
        for (MarketEvent event : message.events()) {
            metrics.recordEvent(event.kind());

            if (event instanceof Trade trade) {
                TradeReport report = TradeReport.of(trade);
                metrics.recordTradeNotional(report.notional().doubleValue());
                reporter.onTrade(report);
            } else if (event instanceof Quote quote) {
                aggregator.apply(quote);
            } else {
                LOGGER.debug("Skipping unknown event in message {}", message.eventIdText());
            }
        }
    }
}
