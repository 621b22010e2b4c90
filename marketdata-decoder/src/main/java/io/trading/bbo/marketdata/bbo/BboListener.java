package io.trading.bbo.marketdata.bbo;

import io.trading.bbo.marketdata.model.BestBidOffer;

/**
 * Receives the full top-of-book snapshot after every quote applied to a {@link BboAggregator}.
 */
@FunctionalInterface
public interface BboListener {

    void onBestBidOffer(BestBidOffer snapshot);
}
