package io.trading.bbo.marketdata.model;

import java.math.BigDecimal;

/**
 * Price level change decoded from a "change" event.
 *
 * @param price     Price of the level
 * @param reason    Reason for the change ("place", "cancel", "trade", "top-of-book"...), empty if not sent
 * @param remaining Quantity remaining at the level, zero if not sent
 * @param side      Book side, UNKNOWN if not sent or not recognised
 * @param delta     Quantity change at the level, {@code null} when the field was absent
 */
public record Quote(
    BigDecimal price,
    String reason,
    BigDecimal remaining,
    MarketSide side,
    BigDecimal delta
) implements MarketEvent {
    public Quote {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (remaining == null) {
            throw new IllegalArgumentException("remaining cannot be null");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
    }

    /**
     * Returns whether a delta was present on the wire. A present zero delta is still present.
     */
    public boolean hasDelta() {
        return delta != null;
    }

    @Override
    public MessageKind kind() {
        return MessageKind.CHANGE;
    }
}
