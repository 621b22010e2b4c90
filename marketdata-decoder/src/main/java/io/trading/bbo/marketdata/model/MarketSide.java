package io.trading.bbo.marketdata.model;

/**
 * Side of the order book an event refers to.
 * UNKNOWN is a valid outcome for unexpected wire values, never an error.
 */
public enum MarketSide {
    BID,
    ASK,
    UNKNOWN;

    /**
     * Maps a wire side string. Matching is case-sensitive: only "bid" and "ask" are recognised.
     */
    public static MarketSide fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value) {
            case "bid" -> BID;
            case "ask" -> ASK;
            default -> UNKNOWN;
        };
    }
}
