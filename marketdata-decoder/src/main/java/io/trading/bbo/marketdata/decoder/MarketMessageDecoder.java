package io.trading.bbo.marketdata.decoder;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.bbo.marketdata.decoder.MarketDataDecodeException.ErrorKind;
import io.trading.bbo.marketdata.model.MarketEvent;
import io.trading.bbo.marketdata.model.MarketMessage;
import io.trading.bbo.marketdata.model.MarketSide;
import io.trading.bbo.marketdata.model.MessageKind;
import io.trading.bbo.marketdata.model.Quote;
import io.trading.bbo.marketdata.model.Trade;
import io.trading.bbo.marketdata.model.UnknownEvent;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for Gemini v1 market-data messages.
 *
 * Decoding runs in two phases: the raw bytes are read into a generic Jackson tree, then
 * every field is projected into the domain model with an explicit default-or-fail rule.
 * Prices and quantities arrive as JSON strings and are parsed to {@link BigDecimal}; values whose
 * exponent or digit count falls outside {@link #MAX_DECIMAL_SCALE} / {@link #MAX_DECIMAL_PRECISION}
 * are rejected, so arithmetic on any decoded message cannot overflow.
 *
 * Message format:
 * <pre>
 * {"type":"update","eventId":5375461993,"socket_sequence":1,"timestamp":1547760288,
 *  "timestampms":1547760288001,
 *  "events":[{"type":"change","side":"bid","price":"3626.73","remaining":"1.6","delta":"0.8",
 *             "reason":"place"},
 *            {"type":"trade","tid":5375461993,"price":"3626.73","amount":"0.8","makerSide":"bid"}]}
 * </pre>
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public class MarketMessageDecoder {

    private static final String FIELD_EVENTS = "events";
    private static final String FIELD_EVENT_ID = "eventId";
    private static final String FIELD_SOCKET_SEQUENCE = "socket_sequence";
    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_TIMESTAMP_MS = "timestampms";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_PRICE = "price";
    private static final String FIELD_AMOUNT = "amount";
    private static final String FIELD_MAKER_SIDE = "makerSide";
    private static final String FIELD_REASON = "reason";
    private static final String FIELD_REMAINING = "remaining";
    private static final String FIELD_SIDE = "side";
    private static final String FIELD_DELTA = "delta";

    private static final int MESSAGE_LEVEL = -1;
    private static final int UNSIGNED_LONG_BITS = 64;

    /**
     * Largest accepted absolute scale of a wire decimal.
     */
    public static final int MAX_DECIMAL_SCALE = 1_000;

    /**
     * Largest accepted number of significant digits of a wire decimal.
     */
    public static final int MAX_DECIMAL_PRECISION = 100;

    private final ObjectMapper objectMapper;

    public MarketMessageDecoder() {
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Decodes one raw WebSocket frame.
     *
     * @param raw UTF-8 encoded JSON document
     * @return the decoded message
     * @throws MarketDataDecodeException if the message or one of its events is malformed
     */
    public MarketMessage decode(byte[] raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new MarketDataDecodeException(ErrorKind.MALFORMED_MESSAGE,
                "Invalid JSON: " + e.getMessage(), MESSAGE_LEVEL, asText(raw), e);
        }
        return decodeTree(root, raw);
    }

    /**
     * Decodes one message already held as text.
     */
    public MarketMessage decode(String raw) {
        return decode(raw.getBytes(StandardCharsets.UTF_8));
    }

    private MarketMessage decodeTree(JsonNode root, byte[] raw) {
        if (root == null || !root.isObject()) {
            throw messageError("Message is not a JSON object", raw);
        }

        JsonNode eventsNode = root.get(FIELD_EVENTS);
        if (eventsNode == null || !eventsNode.isArray()) {
            throw messageError("Missing or non-array '" + FIELD_EVENTS + "'", raw);
        }

        long eventId = requireUnsigned(root, FIELD_EVENT_ID, UNSIGNED_LONG_BITS, raw);
        long socketSequence = requireUnsigned(root, FIELD_SOCKET_SEQUENCE, Integer.SIZE, raw);

        List<MarketEvent> events = new ArrayList<>(eventsNode.size());
        for (int i = 0; i < eventsNode.size(); i++) {
            events.add(decodeEvent(eventsNode.get(i), i, raw));
        }

        return new MarketMessage(
            eventId,
            events,
            optionalUnsignedLong(root, FIELD_TIMESTAMP),
            optionalUnsignedLong(root, FIELD_TIMESTAMP_MS),
            socketSequence
        );
    }

    private MarketEvent decodeEvent(JsonNode node, int index, byte[] raw) {
        if (!node.isObject()) {
            throw eventError("Event is not a JSON object", index, raw);
        }

        MessageKind kind = MessageKind.fromWire(optionalText(node, FIELD_TYPE));
        return switch (kind) {
            case CHANGE -> decodeQuote(node, index, raw);
            case TRADE -> decodeTrade(node, index, raw);
            case UNKNOWN -> UnknownEvent.INSTANCE;
        };
    }

    private Quote decodeQuote(JsonNode node, int index, byte[] raw) {
        BigDecimal price = requireDecimal(node, FIELD_PRICE, index, raw);

        String reason = optionalText(node, FIELD_REASON);
        String remainingText = optionalText(node, FIELD_REMAINING);
        String deltaText = optionalText(node, FIELD_DELTA);

        return new Quote(
            price,
            reason != null ? reason : "",
            remainingText != null ? parseDecimal(remainingText, FIELD_REMAINING, index, raw) : BigDecimal.ZERO,
            MarketSide.fromWire(optionalText(node, FIELD_SIDE)),
            deltaText != null ? parseDecimal(deltaText, FIELD_DELTA, index, raw) : null
        );
    }

    private Trade decodeTrade(JsonNode node, int index, byte[] raw) {
        return new Trade(
            requireDecimal(node, FIELD_PRICE, index, raw),
            requireDecimal(node, FIELD_AMOUNT, index, raw),
            MarketSide.fromWire(optionalText(node, FIELD_MAKER_SIDE))
        );
    }

    /**
     * Reads a non-negative integer of at most {@code bits} bits. A 64-bit value above
     * Long.MAX_VALUE is returned as its two's complement bits.
     */
    private long requireUnsigned(JsonNode root, String field, int bits, byte[] raw) {
        JsonNode value = root.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw messageError("Missing or invalid '" + field + "'", raw);
        }
        BigInteger number = value.bigIntegerValue();
        if (number.signum() < 0 || number.bitLength() > bits) {
            throw messageError("'" + field + "' outside unsigned " + bits + "-bit range: " + number, raw);
        }
        return number.longValue();
    }

    /**
     * Absent, null or non-integer values all read as absent.
     */
    private static Long optionalUnsignedLong(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong() || value.asLong() < 0) {
            return null;
        }
        return value.asLong();
    }

    private BigDecimal requireDecimal(JsonNode node, String field, int index, byte[] raw) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw eventError("Missing or non-string '" + field + "'", index, raw);
        }
        return parseDecimal(value.textValue(), field, index, raw);
    }

    private BigDecimal parseDecimal(String text, String field, int index, byte[] raw) {
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new MarketDataDecodeException(ErrorKind.MALFORMED_EVENT_FIELD,
                "'" + field + "' is not a decimal: \"" + text + "\" (event " + index + ")", index, asText(raw), e);
        }
        if (Math.abs((long) value.scale()) > MAX_DECIMAL_SCALE || value.precision() > MAX_DECIMAL_PRECISION) {
            throw eventError("'" + field + "' is out of range: scale " + value.scale()
                + ", precision " + value.precision(), index, raw);
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static MarketDataDecodeException messageError(String message, byte[] raw) {
        return new MarketDataDecodeException(ErrorKind.MALFORMED_MESSAGE, message, MESSAGE_LEVEL, asText(raw));
    }

    private static MarketDataDecodeException eventError(String message, int index, byte[] raw) {
        return new MarketDataDecodeException(ErrorKind.MALFORMED_EVENT_FIELD,
            message + " (event " + index + ")", index, asText(raw));
    }

    private static String asText(byte[] raw) {
        return raw == null ? "" : new String(raw, StandardCharsets.UTF_8);
    }
}
