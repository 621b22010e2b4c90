package io.trading.bbo.marketdata.model;

/**
 * Event subtype carried in the {@code type} field of each element of a message's events array.
 */
public enum MessageKind {
    TRADE,
    CHANGE,
    UNKNOWN;

    public static MessageKind fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value) {
            case "trade" -> TRADE;
            case "change" -> CHANGE;
            default -> UNKNOWN;
        };
    }
}
