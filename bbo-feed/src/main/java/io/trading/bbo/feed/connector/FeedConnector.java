package io.trading.bbo.feed.connector;

/**
 * A market-data stream connection: connection management, decoding and dispatch.
 */
public interface FeedConnector extends AutoCloseable {

    /**
     * Connects to the stream. Reconnects automatically until {@link #disconnect()}.
     */
    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Gets the number of messages received.
     */
    long getMessageCount();

    /**
     * Gets the number of rejected messages and transport errors.
     */
    long getErrorCount();

    /**
     * Human-readable stream name for logs.
     */
    String getName();

    @Override
    void close();
}
