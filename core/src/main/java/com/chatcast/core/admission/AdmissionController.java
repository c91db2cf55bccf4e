package com.chatcast.core.admission;

import com.chatcast.core.broadcast.Broadcaster;
import com.chatcast.core.history.HistoryStore;
import com.chatcast.core.session.ChatSession;
import com.chatcast.core.session.ClientRegistry;
import com.chatcast.core.session.RoleCounts;
import com.chatcast.protocol.DenyReason;
import com.chatcast.protocol.Frames;
import com.chatcast.protocol.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writer/reader admission gate.
 *
 * Policy:
 *   writer: no writer and no readers present
 *   reader: no writer present
 *
 * The check and the role change happen in one registry critical section, so of
 * several concurrent writer requests at most one wins. History is read only after
 * the registry lock is released; the two locks are never held together.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    public static final int DEFAULT_HISTORY_LIMIT = 500;

    private final ClientRegistry registry;
    private final HistoryStore   history;
    private final Broadcaster    broadcaster;
    private final int            historyLimit;

    public AdmissionController(ClientRegistry registry, HistoryStore history, Broadcaster broadcaster,
                               int historyLimit) {
        this.registry     = registry;
        this.history      = history;
        this.broadcaster  = broadcaster;
        this.historyLimit = historyLimit;
    }

    public static boolean canAdmitWriter(RoleCounts counts) {
        return counts.writers() == 0 && counts.readers() == 0;
    }

    public static boolean canAdmitReader(RoleCounts counts) {
        return counts.writers() == 0;
    }

    public static boolean canAdmit(Role requested, RoleCounts counts) {
        return requested == Role.WRITER ? canAdmitWriter(counts) : canAdmitReader(counts);
    }

    /**
     * Handles the value of a {@code role:} command.
     *
     * On grant the requester receives, in order, the history block and the
     * confirmation; then everyone receives the join notice. On denial only the
     * requester hears about it.
     */
    public AdmissionResult request(int sessionId, String value) {
        Role requested = Role.fromRequest(value);
        ChatSession session = registry.lookup(sessionId);
        if (session == null) {
            return AdmissionResult.denied(requested, DenyReason.forRequest(requested));
        }

        boolean granted = registry.assignRoleIf(sessionId, requested, counts -> canAdmit(requested, counts));
        if (!granted) {
            DenyReason reason = DenyReason.forRequest(requested);
            log.info("Session {} ({}) denied {}: {}", sessionId, session.username(), requested, reason.text);
            broadcaster.sendTo(session, Frames.roleDenied(reason));
            return AdmissionResult.denied(requested, reason);
        }

        log.info("Session {} ({}) admitted as {}", sessionId, session.username(), requested);
        broadcaster.sendTo(session, history.snapshot(historyLimit));
        broadcaster.sendTo(session, Frames.roleConfirmed(requested));
        broadcaster.broadcastAll(Frames.joined(session.username(), requested));
        return AdmissionResult.granted(requested);
    }
}
