package com.chatcast.server;

import com.chatcast.common.ChatConfig;
import com.chatcast.core.SessionRouter;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty HTTP server that upgrades requests under the configured path to WebSocket.
 *
 * Pipeline per connection:
 *   HttpServerCodec
 *   → HttpObjectAggregator             (reassemble HTTP requests)
 *   → WebSocketServerCompressionHandler
 *   → WebSocketServerProtocolHandler   (handles upgrade + ping/pong + close)
 *   → ChatSocketHandler                (feeds SessionRouter)
 */
public final class ChatWebSocketServer {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketServer.class);

    private final ChatConfig     cfg;
    private final SessionRouter  router;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;

    private Channel serverChannel;

    public ChatWebSocketServer(ChatConfig cfg, SessionRouter router,
                               EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
        this.cfg         = cfg;
        this.router      = router;
        this.bossGroup   = bossGroup;
        this.workerGroup = workerGroup;
    }

    public void start() throws InterruptedException {
        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(cfg.wsPath)
                .subprotocols(cfg.subprotocol)
                .checkStartsWith(true)
                .allowExtensions(true)
                .maxFramePayloadLength(cfg.maxFrameSize)
                .build();

        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(cfg.maxFrameSize))
                                .addLast(new WebSocketServerCompressionHandler())
                                .addLast(new WebSocketServerProtocolHandler(wsConfig))
                                // one per connection, NOT @Sharable
                                .addLast(new ChatSocketHandler(router));
                    }
                });

        serverChannel = b.bind(cfg.port).sync().channel();
        log.info("WebSocket server listening on ws://localhost:{}{}", boundPort(), cfg.wsPath);
    }

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() throws InterruptedException {
        if (serverChannel != null) serverChannel.close().sync();
        log.info("WebSocket server stopped.");
    }
}
