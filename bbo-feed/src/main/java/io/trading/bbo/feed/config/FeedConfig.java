package io.trading.bbo.feed.config;

import io.trading.bbo.feed.report.OutputFormat;

import java.net.URI;
import java.util.Map;

/**
 * Configuration for the BBO feed.
 *
 * @param symbol              Instrument to follow, lower case (e.g., "btcusd")
 * @param baseUrl             Market-data WebSocket base URL; the symbol is appended as a path segment
 * @param topOfBook           Whether to request top-of-book only updates
 * @param outputFormat        Format used by the reporting sink
 * @param reconnectMaxRetries Maximum reconnect retries (-1 for unlimited)
 * @param healthCheckMs       Health check interval in milliseconds
 * @param metricsEnabled      Whether to start the metrics HTTP server
 * @param metricsPort         Port for the Prometheus metrics HTTP server
 * @param enableCompression   Whether to negotiate permessage-deflate
 */
public record FeedConfig(
    String symbol,
    String baseUrl,
    boolean topOfBook,
    OutputFormat outputFormat,
    int reconnectMaxRetries,
    int healthCheckMs,
    boolean metricsEnabled,
    int metricsPort,
    boolean enableCompression
) {
    public static final String DEFAULT_BASE_URL = "wss://api.gemini.com/v1/marketdata";
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = 10;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public FeedConfig {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (!symbol.chars().allMatch(Character::isLetterOrDigit)) {
            throw new IllegalArgumentException("symbol must be alphanumeric: " + symbol);
        }
        if (baseUrl == null || baseUrl.isEmpty()) {
            throw new IllegalArgumentException("baseUrl cannot be null or empty");
        }
        if (!baseUrl.startsWith("ws://") && !baseUrl.startsWith("wss://")) {
            throw new IllegalArgumentException("baseUrl must use ws:// or wss://: " + baseUrl);
        }
        if (outputFormat == null) {
            throw new IllegalArgumentException("outputFormat cannot be null");
        }
        if (reconnectMaxRetries < -1) {
            throw new IllegalArgumentException("reconnectMaxRetries must be -1 (unlimited) or non-negative");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (metricsPort < 1 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 1 and 65535");
        }
        symbol = symbol.toLowerCase();
    }

    /**
     * Builds the stream URI, e.g. {@code wss://api.gemini.com/v1/marketdata/btcusd?top_of_book=true}.
     */
    public URI streamUri() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + "/" + symbol + "?top_of_book=" + topOfBook);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - GEMINI_SYMBOL: Symbol to follow (required unless given on the command line)
     * - GEMINI_WS_URL: Base URL (default: wss://api.gemini.com/v1/marketdata)
     * - GEMINI_TOP_OF_BOOK: Request top-of-book updates only (default: true)
     * - OUTPUT_FORMAT: text or json (default: text)
     * - RECONNECT_MAX_RETRIES: Max reconnect retries, -1 for unlimited (default: 10)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - METRICS_ENABLED: Start the metrics server (default: true)
     * - METRICS_PORT: Metrics server port (default: 9090)
     * - WS_COMPRESSION: Negotiate permessage-deflate (default: false)
     */
    public static FeedConfig fromEnv() {
        return fromEnv(System.getenv()).build();
    }

    /**
     * Loads configuration from the environment and applies command-line overrides.
     *
     * Options: --symbol SYMBOL, --url URL, --output text|json, --metrics-port PORT,
     * --reconnect-retries N, --no-metrics, --no-top-of-book, --compression.
     */
    public static FeedConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv());
    }

    static FeedConfig fromArgs(String[] args, Map<String, String> env) {
        Builder builder = fromEnv(env);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--symbol" -> builder.symbol(requireValue(args, ++i, arg));
                case "--url" -> builder.baseUrl(requireValue(args, ++i, arg));
                case "--output" -> builder.outputFormat(OutputFormat.fromString(requireValue(args, ++i, arg)));
                case "--metrics-port" -> builder.metricsPort(parseInt(arg, requireValue(args, ++i, arg)));
                case "--reconnect-retries" -> builder.reconnectMaxRetries(parseInt(arg, requireValue(args, ++i, arg)));
                case "--no-metrics" -> builder.metricsEnabled(false);
                case "--no-top-of-book" -> builder.topOfBook(false);
                case "--compression" -> builder.enableCompression(true);
                default -> {
                    if (arg.startsWith("--symbol=")) {
                        builder.symbol(arg.substring("--symbol=".length()));
                    } else {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                }
            }
        }

        return builder.build();
    }

    static Builder fromEnv(Map<String, String> env) {
        Builder builder = builder();

        String symbol = env.get("GEMINI_SYMBOL");
        if (symbol != null && !symbol.isEmpty()) {
            builder.symbol(symbol);
        }

        String baseUrl = env.get("GEMINI_WS_URL");
        if (baseUrl != null && !baseUrl.isEmpty()) {
            builder.baseUrl(baseUrl);
        }

        String outputFormat = env.get("OUTPUT_FORMAT");
        if (outputFormat != null && !outputFormat.isEmpty()) {
            builder.outputFormat(OutputFormat.fromString(outputFormat));
        }

        return builder
            .topOfBook(parseBooleanEnv(env, "GEMINI_TOP_OF_BOOK", true))
            .reconnectMaxRetries(parseIntEnv(env, "RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES))
            .healthCheckMs(parseIntEnv(env, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS))
            .metricsEnabled(parseBooleanEnv(env, "METRICS_ENABLED", true))
            .metricsPort(parseIntEnv(env, "METRICS_PORT", DEFAULT_METRICS_PORT))
            .enableCompression(parseBooleanEnv(env, "WS_COMPRESSION", false));
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }

    private static int parseIntEnv(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " value: " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    private static boolean parseBooleanEnv(Map<String, String> env, String key, boolean defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    /**
     * Creates a new builder for FeedConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FeedConfig.
     */
    public static class Builder {
        private String symbol;
        private String baseUrl = DEFAULT_BASE_URL;
        private boolean topOfBook = true;
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private boolean metricsEnabled = true;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private boolean enableCompression = false;

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder topOfBook(boolean topOfBook) {
            this.topOfBook = topOfBook;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        public FeedConfig build() {
            if (symbol == null || symbol.isEmpty()) {
                throw new IllegalStateException("A symbol must be set (--symbol or GEMINI_SYMBOL)");
            }
            return new FeedConfig(
                symbol,
                baseUrl,
                topOfBook,
                outputFormat,
                reconnectMaxRetries,
                healthCheckMs,
                metricsEnabled,
                metricsPort,
                enableCompression
            );
        }
    }
}
