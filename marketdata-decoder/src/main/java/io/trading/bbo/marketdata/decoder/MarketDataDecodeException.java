package io.trading.bbo.marketdata.decoder;

/**
 * Raised when a raw message cannot be decoded. The whole message is rejected;
 * none of its events should be processed.
 */
public class MarketDataDecodeException extends RuntimeException {

    /**
     * Failure category.
     */
    public enum ErrorKind {
        /** Not valid JSON, or a mandatory top-level field is missing or mistyped. */
        MALFORMED_MESSAGE,
        /** A mandatory per-event field is missing, mistyped or not a decimal. */
        MALFORMED_EVENT_FIELD
    }

    private static final int MAX_SNIPPET_LENGTH = 256;

    private final ErrorKind errorKind;
    private final int eventIndex;
    private final String rawSnippet;

    public MarketDataDecodeException(ErrorKind errorKind, String message, int eventIndex, String raw, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.eventIndex = eventIndex;
        this.rawSnippet = truncate(raw);
    }

    public MarketDataDecodeException(ErrorKind errorKind, String message, int eventIndex, String raw) {
        this(errorKind, message, eventIndex, raw, null);
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * Index of the failing element in the events array, or -1 for message-level failures.
     */
    public int getEventIndex() {
        return eventIndex;
    }

    /**
     * The start of the offending raw message, for diagnosing upstream feed problems.
     */
    public String getRawSnippet() {
        return rawSnippet;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.length() <= MAX_SNIPPET_LENGTH) {
            return raw;
        }
        return raw.substring(0, MAX_SNIPPET_LENGTH) + "...";
    }
}
