package io.trading.bbo.feed.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.function.Consumer;

/**
 * Netty-based WebSocket client for a single market-data stream.
 * Supports both epoll (Linux) and NIO event loop groups.
 */
public class WebSocketClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int MAX_FRAME_PAYLOAD_LENGTH = 1 << 20;
    private static final int HANDSHAKE_RESPONSE_MAX_LENGTH = 8192;

    private final URI uri;
    private final String name;
    private final Consumer<byte[]> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final Runnable disconnectHandler;
    private final boolean enableCompression;

    private EventLoopGroup eventLoopGroup;
    private Channel channel;
    private volatile boolean connected = false;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI to connect to
     * @param name              Friendly name for logging (e.g., "Gemini-btcusd")
     * @param messageHandler    Callback for each non-empty data frame
     * @param errorHandler      Callback for errors
     * @param connectHandler    Callback when the handshake completes
     * @param disconnectHandler Callback when the connection is lost
     * @param enableCompression Whether to negotiate permessage-deflate
     */
    public WebSocketClient(
        URI uri,
        String name,
        Consumer<byte[]> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        Runnable disconnectHandler,
        boolean enableCompression
    ) {
        this.uri = uri;
        this.name = name;
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.disconnectHandler = disconnectHandler;
        this.enableCompression = enableCompression;
    }

    /**
     * Connects to the WebSocket server. Failures are reported to the error handler.
     */
    public synchronized void connect() {
        if (connected) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }
        releaseResources();

        try {
            boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
            SslContext sslContext = secure ? createSslContext() : null;
            String host = uri.getHost();
            int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);

            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name + "-io");

            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(eventLoopGroup)
                .channel(NettyEventLoopFactory.getClientChannelClass())
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }

                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(HANDSHAKE_RESPONSE_MAX_LENGTH));

                        if (enableCompression) {
                            pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                        }

                        // Reassemble fragmented messages before they reach the handler
                        pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));

                        pipeline.addLast(new WebSocketClientHandler(
                            uri,
                            MAX_FRAME_PAYLOAD_LENGTH,
                            messageHandler,
                            errorHandler,
                            () -> {
                                connected = true;
                                LOGGER.info("{}: Connected", name);
                                if (connectHandler != null) {
                                    connectHandler.run();
                                }
                            },
                            () -> {
                                boolean wasConnected = connected;
                                connected = false;
                                LOGGER.warn("{}: Disconnected (was connected: {})", name, wasConnected);
                                if (disconnectHandler != null) {
                                    disconnectHandler.run();
                                }
                            }
                        ));
                    }
                });

            LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
            channel = bootstrap.connect(host, port).sync().channel();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("{}: Interrupted while connecting", name, e);
            releaseResources();
        } catch (Exception e) {
            LOGGER.error("{}: Failed to connect", name, e);
            releaseResources();
            if (errorHandler != null) {
                errorHandler.accept(e);
            }
        }
    }

    /**
     * Returns whether the client is currently connected.
     */
    public boolean isConnected() {
        return connected && channel != null && channel.isActive();
    }

    @Override
    public synchronized void close() {
        connected = false;
        releaseResources();
        LOGGER.info("{}: Closed", name);
    }

    private SslContext createSslContext() throws SSLException {
        return SslContextBuilder.forClient()
            .protocols("TLSv1.2", "TLSv1.3")
            .sslProvider(SslProvider.JDK)
            .build();
    }

    private void releaseResources() {
        if (channel != null) {
            try {
                channel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.error("{}: Interrupted while closing channel", name, e);
            }
            channel = null;
        }

        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
    }
}
