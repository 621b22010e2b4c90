package io.trading.bbo.feed.report;

import io.trading.bbo.marketdata.bbo.BboListener;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.TradeReport;

/**
 * Sink for decoded market data. Receives immutable values only.
 */
public interface MarketDataReporter extends BboListener {

    /**
     * Called once per trade event.
     */
    void onTrade(TradeReport report);

    /**
     * Called once per quote event with the full snapshot after the update.
     */
    @Override
    void onBestBidOffer(BestBidOffer snapshot);

    /**
     * Creates the reporter for the given format, writing to standard output.
     */
    static MarketDataReporter create(OutputFormat format) {
        return switch (format) {
            case TEXT -> new TextReporter(System.out);
            case JSON -> new JsonLinesReporter(System.out);
        };
    }
}
