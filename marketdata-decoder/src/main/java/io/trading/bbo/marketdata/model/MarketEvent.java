package io.trading.bbo.marketdata.model;

/**
 * A single decoded element of a market-data message: a {@link Trade}, a {@link Quote}
 * or the {@link UnknownEvent} sentinel.
 */
public interface MarketEvent {

    /**
     * Returns the subtype of this event.
     */
    MessageKind kind();
}
