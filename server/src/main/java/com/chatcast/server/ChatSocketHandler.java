package com.chatcast.server;

import com.chatcast.core.SessionRouter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * One instance per WebSocket connection.
 *
 * Lifecycle:
 *   handshake complete → SessionRouter.onConnect
 *   text frame         → SessionRouter.onMessage
 *   channelInactive    → SessionRouter.onClose
 *
 * Binary and continuation frames are ignored; ping/pong and close are handled
 * upstream by WebSocketServerProtocolHandler.
 *
 * A failure while routing one frame drops that frame only. The channel is closed
 * for I/O and framing errors.
 */
public final class ChatSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(ChatSocketHandler.class);

    private final SessionRouter router;

    private NettyConnection connection;

    public ChatSocketHandler(SessionRouter router) {
        this.router = router;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            log.debug("Handshake complete from {} uri={} subprotocol={}",
                    ctx.channel().remoteAddress(), handshake.requestUri(), handshake.selectedSubprotocol());
            handshakeComplete(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    void handshakeComplete(ChannelHandlerContext ctx) {
        if (connection != null) return;
        connection = new NettyConnection(ctx.channel());
        router.onConnect(connection);
        log.info("WS client connected: id={} remote={}", connection.id(), ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            log.info("WS client disconnected: id={}", connection.id());
            router.onClose(connection.id());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Object id = connection != null ? connection.id() : "?";
        if (cause instanceof IOException || cause instanceof CorruptedFrameException) {
            log.error("WS error for id={}: {}", id, cause.getMessage());
            ctx.close();
        } else {
            log.warn("Dropped event for id={}", id, cause);
        }
    }

    // ── Message handling ──────────────────────────────────────────────────────

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame text)) {
            log.debug("Ignoring {} from id={}", frame.getClass().getSimpleName(),
                    connection != null ? connection.id() : "?");
            return;
        }
        if (connection == null) {
            log.warn("Text frame before handshake completed from {}", ctx.channel().remoteAddress());
            return;
        }
        try {
            router.onMessage(connection.id(), text.text());
        } catch (RuntimeException | OutOfMemoryError e) {
            log.warn("Dropped frame from id={}: {}", connection.id(), e.toString());
        }
    }

    NettyConnection connection() {
        return connection;
    }
}
