package io.trading.bbo.feed.report;

import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.Trade;
import io.trading.bbo.marketdata.model.TradeReport;

import java.io.PrintStream;

/**
 * Writes one human-readable line per trade and per top-of-book snapshot.
 *
 * <pre>
 * Trade[price=3626.73, amount=0.8, makerSide=BID] $2901.384
 * BestBidOffer[bestBid=3626.73, bestOffer=3627.01, bidAmountRemaining=1.6, askAmountRemaining=0.4]
 * </pre>
 */
public class TextReporter implements MarketDataReporter {

    private final PrintStream out;

    public TextReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onTrade(TradeReport report) {
        Trade trade = report.trade();
        out.println("Trade[price=" + trade.price().toPlainString()
            + ", amount=" + trade.amount().toPlainString()
            + ", makerSide=" + trade.makerSide()
            + "] $" + report.notional().toPlainString());
    }

    @Override
    public void onBestBidOffer(BestBidOffer snapshot) {
        out.println("BestBidOffer[bestBid=" + snapshot.bestBid().toPlainString()
            + ", bestOffer=" + snapshot.bestOffer().toPlainString()
            + ", bidAmountRemaining=" + snapshot.bidAmountRemaining().toPlainString()
            + ", askAmountRemaining=" + snapshot.askAmountRemaining().toPlainString()
            + "]");
    }
}
