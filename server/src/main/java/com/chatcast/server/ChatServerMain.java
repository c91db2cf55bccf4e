package com.chatcast.server;

import com.chatcast.common.ChatConfig;
import com.chatcast.core.SessionRouter;
import com.chatcast.core.history.HistoryStore;
import com.chatcast.core.history.InMemoryMessageStore;
import com.chatcast.core.history.MessageStore;
import com.chatcast.core.history.StoreInitException;
import com.chatcast.core.session.ClientRegistry;
import com.chatcast.store.SqliteMessageStore;
import io.netty.channel.nio.NioEventLoopGroup;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Broadcast chat server entry point.
 *
 * Usage:
 *   java -jar chatcast-server.jar [storage-path]
 *
 * Defaults: ws://localhost:8080/, history in ./chat_history.sqlite (emptied on start).
 * Other settings come from chatcast.yml, see {@link ChatConfig}.
 * Exits with 1 if the store or the listener cannot be initialized.
 */
public final class ChatServerMain {

    private static final Logger log = LoggerFactory.getLogger(ChatServerMain.class);

    public static void main(String[] args) throws Exception {
        ChatConfig cfg = ChatConfig.load();
        if (args.length > 0) cfg.storePath = args[0];

        MessageStore store = cfg.inMemoryStore()
                ? new InMemoryMessageStore()
                : new SqliteMessageStore(Paths.get(cfg.storePath), cfg.storePoolSize);
        try {
            store.initialize();
        } catch (StoreInitException e) {
            log.error("Failed to initialize database. Exiting.", e);
            System.exit(1);
            return;
        }

        ClientRegistry registry = new ClientRegistry(cfg.maxUsernameLength);
        HistoryStore   history  = new HistoryStore(store);
        SessionRouter  router   = SessionRouter.create(registry, history, cfg.historyLimit);

        NioEventLoopGroup bossGroup   = new NioEventLoopGroup(1);
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(cfg.ioThreads);
        ChatWebSocketServer server = new ChatWebSocketServer(cfg, router, bossGroup, workerGroup);
        try {
            server.start();
        } catch (Exception e) {
            log.error("WebSocket server init failed on port {}", cfg.port, e);
            shutdown(bossGroup, workerGroup, store);
            System.exit(1);
            return;
        }

        if (cfg.metricsIntervalSecs > 0) {
            workerGroup.scheduleAtFixedRate(router.broadcaster().fanoutLatency()::logAndReset,
                    cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
        }

        log.info("Broadcast server started on :{}", server.boundPort());
        log.info("History store: {}", cfg.inMemoryStore() ? "in-memory" : Paths.get(cfg.storePath).toAbsolutePath());
        log.info("Waiting for connections... Ctrl-C to stop.");
        new ShutdownSignalBarrier().await();

        server.stop();
        shutdown(bossGroup, workerGroup, store);
        log.info("Server stopped.");
    }

    private static void shutdown(NioEventLoopGroup bossGroup, NioEventLoopGroup workerGroup, MessageStore store) {
        workerGroup.shutdownGracefully().syncUninterruptibly();
        bossGroup.shutdownGracefully().syncUninterruptibly();
        store.close();
    }
}
