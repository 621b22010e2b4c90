package io.trading.bbo.marketdata.model;

import java.math.BigDecimal;

/**
 * Immutable point-in-time view of the top of book.
 * All-zero values mean either nothing has been observed yet or the feed sent zeros;
 * the two cases are not distinguished.
 *
 * @param bestBid            Price of the most recent bid-side quote
 * @param bestOffer          Price of the most recent ask-side quote
 * @param bidAmountRemaining Remaining quantity of the most recent bid-side quote
 * @param askAmountRemaining Remaining quantity of the most recent ask-side quote
 */
public record BestBidOffer(
    BigDecimal bestBid,
    BigDecimal bestOffer,
    BigDecimal bidAmountRemaining,
    BigDecimal askAmountRemaining
) {
    public static final BestBidOffer EMPTY =
        new BestBidOffer(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public BestBidOffer {
        if (bestBid == null || bestOffer == null) {
            throw new IllegalArgumentException("prices cannot be null");
        }
        if (bidAmountRemaining == null || askAmountRemaining == null) {
            throw new IllegalArgumentException("remaining amounts cannot be null");
        }
    }
}
