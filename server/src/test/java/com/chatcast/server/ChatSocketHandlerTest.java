package com.chatcast.server;

import com.chatcast.core.SessionRouter;
import com.chatcast.core.history.HistoryRecord;
import com.chatcast.core.history.HistoryStore;
import com.chatcast.core.history.InMemoryMessageStore;
import com.chatcast.core.history.MessageStore;
import com.chatcast.core.session.ClientRegistry;
import com.chatcast.protocol.Role;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatSocketHandlerTest {

    private ClientRegistry registry;
    private SessionRouter router;
    private final List<EmbeddedChannel> channels = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry();
        InMemoryMessageStore store = new InMemoryMessageStore();
        store.initialize();
        router = SessionRouter.create(registry, new HistoryStore(store), 500);
    }

    @AfterEach
    void tearDown() {
        for (EmbeddedChannel ch : channels) ch.finishAndReleaseAll();
    }

    @Test
    void framesBeforeHandshakeAreDropped() {
        ChatSocketHandler handler = new ChatSocketHandler(router);
        EmbeddedChannel ch = track(new EmbeddedChannel(handler));

        ch.writeInbound(new TextWebSocketFrame("role:writer"));

        assertEquals(0, registry.size());
        assertNull(ch.readOutbound());
    }

    @Test
    void handshakeRegistersOnceAndTextFramesAreRouted() {
        ChatSocketHandler handler = new ChatSocketHandler(router);
        EmbeddedChannel ch = track(new EmbeddedChannel(handler));
        handler.handshakeComplete(ch.pipeline().context(handler));
        handler.handshakeComplete(ch.pipeline().context(handler));
        assertEquals(1, registry.size());

        ch.writeInbound(new TextWebSocketFrame("role:writer"));

        assertEquals(List.of("", "ROLE_CONFIRMED:writer", "System: Anonymous joined as Writer", "SYSTEM_COUNTS:0:1"),
                drain(ch));
        assertEquals(Role.WRITER, registry.lookup(handler.connection().id()).role());
    }

    @Test
    void binaryFramesAreIgnored() {
        ChatSocketHandler handler = new ChatSocketHandler(router);
        EmbeddedChannel ch = connected(handler);

        ch.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[]{1, 2, 3})));

        assertTrue(drain(ch).isEmpty());
    }

    @Test
    void closingTheWriterChannelNotifiesTheOthers() {
        ChatSocketHandler writerHandler = new ChatSocketHandler(router);
        EmbeddedChannel writer = connected(writerHandler);
        EmbeddedChannel watcher = connected(new ChatSocketHandler(router));

        writer.writeInbound(new TextWebSocketFrame("username:zed"));
        writer.writeInbound(new TextWebSocketFrame("role:writer"));
        drain(watcher);

        writer.close();

        assertEquals(List.of("System: zed disconnected.", "SYSTEM_COUNTS:0:0"), drain(watcher));
        assertEquals(1, registry.size());
    }

    @Test
    void failedChatFrameIsDroppedAndTheSessionSurvives() {
        router = SessionRouter.create(registry, new HistoryStore(new ExhaustedMessageStore()), 500);
        ChatSocketHandler writerHandler = new ChatSocketHandler(router);
        EmbeddedChannel writer = connected(writerHandler);
        EmbeddedChannel watcher = connected(new ChatSocketHandler(router));
        writer.writeInbound(new TextWebSocketFrame("role:writer"));
        drain(writer);
        drain(watcher);

        writer.writeInbound(new TextWebSocketFrame("hello"));

        assertTrue(writer.isOpen());
        assertEquals(2, registry.size());
        assertEquals(Role.WRITER, registry.lookup(writerHandler.connection().id()).role());
        assertTrue(drain(watcher).isEmpty());

        writer.writeInbound(new TextWebSocketFrame("get_history"));
        assertEquals(List.of(""), drain(writer));
    }

    @Test
    void ioErrorsCloseTheChannel() {
        ChatSocketHandler handler = new ChatSocketHandler(router);
        EmbeddedChannel ch = connected(handler);

        ch.pipeline().fireExceptionCaught(new IOException("connection reset"));
        ch.runPendingTasks();

        assertFalse(ch.isOpen());
        assertEquals(0, registry.size());
    }

    @Test
    void sendToAClosedChannelReportsFailure() {
        ChatSocketHandler handler = new ChatSocketHandler(router);
        EmbeddedChannel ch = connected(handler);
        NettyConnection connection = handler.connection();

        ch.close();

        assertFalse(connection.send("late"));
    }

    private EmbeddedChannel connected(ChatSocketHandler handler) {
        EmbeddedChannel ch = track(new EmbeddedChannel(handler));
        handler.handshakeComplete(ch.pipeline().context(handler));
        return ch;
    }

    private EmbeddedChannel track(EmbeddedChannel ch) {
        channels.add(ch);
        return ch;
    }

    private static List<String> drain(EmbeddedChannel ch) {
        List<String> out = new ArrayList<>();
        Object msg;
        while ((msg = ch.readOutbound()) != null) {
            TextWebSocketFrame frame = (TextWebSocketFrame) msg;
            out.add(frame.text());
            frame.release();
        }
        return out;
    }

    /** Store that runs out of memory on every write. */
    private static final class ExhaustedMessageStore implements MessageStore {

        @Override
        public void initialize() {
        }

        @Override
        public long append(String username, String message) {
            throw new OutOfMemoryError("Java heap space");
        }

        @Override
        public List<HistoryRecord> queryRecent(int limit) {
            return List.of();
        }

        @Override
        public void close() {
        }
    }
}
