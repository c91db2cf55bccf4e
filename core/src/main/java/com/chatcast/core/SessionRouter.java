package com.chatcast.core;

import com.chatcast.core.admission.AdmissionController;
import com.chatcast.core.broadcast.Broadcaster;
import com.chatcast.core.history.HistoryStore;
import com.chatcast.core.session.ChatConnection;
import com.chatcast.core.session.ChatSession;
import com.chatcast.core.session.ClientRegistry;
import com.chatcast.core.session.RoleCounts;
import com.chatcast.protocol.Command;
import com.chatcast.protocol.Frames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for transport events.
 *
 * The transport calls {@link #onConnect}, {@link #onMessage} and {@link #onClose};
 * events for one connection must arrive in order, events for different
 * connections may interleave freely.
 */
public final class SessionRouter {

    private static final Logger log = LoggerFactory.getLogger(SessionRouter.class);

    private final ClientRegistry      registry;
    private final AdmissionController admission;
    private final HistoryStore        history;
    private final Broadcaster         broadcaster;
    private final int                 historyLimit;

    public SessionRouter(ClientRegistry registry, AdmissionController admission, HistoryStore history,
                         Broadcaster broadcaster, int historyLimit) {
        this.registry     = registry;
        this.admission    = admission;
        this.history      = history;
        this.broadcaster  = broadcaster;
        this.historyLimit = historyLimit;
    }

    /** Wires the default components around a registry and a history store. */
    public static SessionRouter create(ClientRegistry registry, HistoryStore history, int historyLimit) {
        Broadcaster broadcaster = new Broadcaster(registry);
        AdmissionController admission = new AdmissionController(registry, history, broadcaster, historyLimit);
        return new SessionRouter(registry, admission, history, broadcaster, historyLimit);
    }

    public ChatSession onConnect(ChatConnection connection) {
        ChatSession session = registry.register(connection);
        log.info("Session {} connected", session.id);
        return session;
    }

    public void onMessage(int sessionId, String text) {
        ChatSession session = registry.lookup(sessionId);
        if (session == null) {
            log.debug("Dropping frame from unknown session {}", sessionId);
            return;
        }

        Command command = Command.classify(text);
        switch (command) {
            case USERNAME -> {
                registry.setUsername(sessionId, command.argument(text));
                log.debug("Session {} is now {}", sessionId, session.username());
            }
            case ROLE -> {
                admission.request(sessionId, command.argument(text));
                broadcastCounts();
            }
            case GET_HISTORY -> broadcaster.sendTo(session, history.snapshot(historyLimit));
            case CHAT -> handleChat(session, text);
        }
    }

    /**
     * A departing writer's notice goes out while it is still registered, so no
     * other session can be granted the writer role before the notice is sent.
     */
    public void onClose(int sessionId) {
        ChatSession closing = registry.lookup(sessionId);
        if (closing != null && closing.isWriter()) {
            broadcaster.broadcastAll(Frames.disconnected(closing.username()));
        }
        ChatSession removed = registry.unregister(sessionId);
        if (removed == null) {
            log.debug("Close for unknown session {}", sessionId);
        } else {
            log.info("Session {} ({}, {}) disconnected", sessionId, removed.username(), removed.role());
        }
        broadcastCounts();
    }

    private void handleChat(ChatSession session, String message) {
        if (!session.isWriter()) {
            log.debug("Session {} ({}) tried to chat without the writer role", session.id, session.role());
            broadcaster.sendTo(session, Frames.NOT_A_WRITER);
            return;
        }
        String username = session.username();
        // delivery does not depend on persistence
        history.append(username, message);
        broadcaster.broadcastAll(Frames.chatLine(username, message));
    }

    private void broadcastCounts() {
        RoleCounts counts = registry.countRoles();
        broadcaster.broadcastAll(Frames.systemCounts(counts.readers(), counts.writers()));
    }

    public Broadcaster broadcaster() {
        return broadcaster;
    }
}
