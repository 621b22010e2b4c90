package io.trading.bbo.marketdata.model;

import java.math.BigDecimal;

/**
 * Executed trade decoded from a "trade" event.
 *
 * @param price     Execution price
 * @param amount    Executed quantity
 * @param makerSide Side of the resting order that was matched, UNKNOWN if not sent
 */
public record Trade(
    BigDecimal price,
    BigDecimal amount,
    MarketSide makerSide
) implements MarketEvent {
    public Trade {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        if (makerSide == null) {
            throw new IllegalArgumentException("makerSide cannot be null");
        }
    }

    /**
     * Dollar value of the trade: amount x price.
     */
    public BigDecimal notional() {
        return amount.multiply(price);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.TRADE;
    }
}
