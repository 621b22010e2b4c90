package io.trading.bbo.marketdata.model;

import java.math.BigDecimal;

/**
 * A trade together with its notional value, as handed to reporting sinks.
 *
 * @param trade    The decoded trade
 * @param notional amount x price
 */
public record TradeReport(Trade trade, BigDecimal notional) {

    public TradeReport {
        if (trade == null) {
            throw new IllegalArgumentException("trade cannot be null");
        }
        if (notional == null) {
            throw new IllegalArgumentException("notional cannot be null");
        }
    }

    public static TradeReport of(Trade trade) {
        return new TradeReport(trade, trade.notional());
    }
}
