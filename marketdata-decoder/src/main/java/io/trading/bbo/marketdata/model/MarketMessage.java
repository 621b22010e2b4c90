package io.trading.bbo.marketdata.model;

import java.util.List;

/**
 * Decoded market-data message envelope.
 *
 * @param eventId        Exchange event id, an unsigned 64-bit value held in a long's bits
 *                       (see {@link #eventIdText()})
 * @param events         Decoded events in wire order
 * @param timestamp      Exchange timestamp in seconds, {@code null} if absent
 * @param timestampMs    Exchange timestamp in milliseconds, {@code null} if absent
 * @param socketSequence Per-connection sequence number (unsigned 32-bit value)
 */
public record MarketMessage(
    long eventId,
    List<MarketEvent> events,
    Long timestamp,
    Long timestampMs,
    long socketSequence
) {
    public static final long MAX_SOCKET_SEQUENCE = 0xFFFF_FFFFL;

    public MarketMessage {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (socketSequence < 0 || socketSequence > MAX_SOCKET_SEQUENCE) {
            throw new IllegalArgumentException("socketSequence out of unsigned 32-bit range: " + socketSequence);
        }
        events = List.copyOf(events);
    }

    /**
     * The event id in decimal, read as unsigned.
     */
    public String eventIdText() {
        return Long.toUnsignedString(eventId);
    }
}
