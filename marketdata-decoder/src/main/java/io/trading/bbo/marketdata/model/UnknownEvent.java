package io.trading.bbo.marketdata.model;

/**
 * Placeholder for event subtypes this client does not understand. Carries no payload.
 */
public final class UnknownEvent implements MarketEvent {

    public static final UnknownEvent INSTANCE = new UnknownEvent();

    private UnknownEvent() {
    }

    @Override
    public MessageKind kind() {
        return MessageKind.UNKNOWN;
    }

    @Override
    public String toString() {
        return "UnknownEvent";
    }
}
