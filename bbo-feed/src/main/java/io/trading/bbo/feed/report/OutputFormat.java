package io.trading.bbo.feed.report;

/**
 * Output format for reported trades and top-of-book snapshots.
 */
public enum OutputFormat {
    /**
     * Human-readable lines.
     */
    TEXT,

    /**
     * One JSON object per line.
     */
    JSON;

    public static OutputFormat fromString(String value) {
        return switch (value.trim().toLowerCase()) {
            case "text", "txt" -> TEXT;
            case "json", "jsonl" -> JSON;
            default -> throw new IllegalArgumentException("Unknown output format: " + value);
        };
    }
}
