package io.trading.bbo.feed.netty;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Netty handler for the market-data WebSocket.
 * Completes the handshake, answers pings and hands each non-empty data frame to the
 * message callback as raw bytes.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final Consumer<byte[]> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final Runnable disconnectHandler;

    public WebSocketClientHandler(
        URI uri,
        int maxFramePayloadLength,
        Consumer<byte[]> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        Runnable disconnectHandler
    ) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.disconnectHandler = disconnectHandler;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("WebSocket channel inactive");
        if (disconnectHandler != null) {
            disconnectHandler.run();
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("WebSocket handshake complete");
                if (connectHandler != null) {
                    connectHandler.run();
                }
            } catch (Exception e) {
                LOGGER.error("WebSocket handshake failed", e);
                if (errorHandler != null) {
                    errorHandler.accept(e);
                }
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        if (frame instanceof TextWebSocketFrame || frame instanceof BinaryWebSocketFrame) {
            if (!frame.content().isReadable()) {
                LOGGER.debug("Dropping empty frame");
                return;
            }
            byte[] payload = ByteBufUtil.getBytes(frame.content());
            try {
                if (messageHandler != null) {
                    messageHandler.accept(payload);
                }
            } catch (Exception e) {
                LOGGER.error("Error in message handler", e);
                if (errorHandler != null) {
                    errorHandler.accept(e);
                }
            }
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("Received close frame: status={} reason={}", close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("Unsupported frame type: {}", frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("WebSocket exception", cause);
        if (errorHandler != null) {
            errorHandler.accept(cause);
        }
        ctx.close();
    }
}
