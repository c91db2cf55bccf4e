package com.chatcast.server;

import com.chatcast.core.session.ChatConnection;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ChatConnection} over a WebSocket channel.
 *
 * writeAndFlush is safe from any thread: off the channel's event loop Netty queues
 * the write as a task, so frames from one calling thread keep their order.
 */
public final class NettyConnection implements ChatConnection {

    private static final Logger log = LoggerFactory.getLogger(NettyConnection.class);

    /** Incrementing counter across all connections. */
    private static final AtomicInteger ID_GEN = new AtomicInteger(1);

    private final int     id;
    private final Channel channel;

    public NettyConnection(Channel channel) {
        this.id      = ID_GEN.getAndIncrement();
        this.channel = channel;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public boolean send(String text) {
        if (!channel.isActive()) return false;
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(f -> {
            if (!f.isSuccess()) log.debug("Write to connection {} failed: {}", id, f.cause().toString());
        });
        return true;
    }

    @Override
    public String toString() {
        return "NettyConnection{id=" + id + ", remote=" + channel.remoteAddress() + '}';
    }
}
