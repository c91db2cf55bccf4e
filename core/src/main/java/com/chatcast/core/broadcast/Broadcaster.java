package com.chatcast.core.broadcast;

import com.chatcast.common.LatencyStats;
import com.chatcast.core.session.ChatSession;
import com.chatcast.core.session.ClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Unicast and fan-out of text frames.
 *
 * Fire-and-forget: a failed delivery to one session is logged and counted, never
 * retried and never surfaced as an exception. Sessions are copied out of the
 * registry first so no transport write happens under the registry lock.
 */
public final class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ClientRegistry registry;
    private final LatencyStats   fanoutLatency;

    public Broadcaster(ClientRegistry registry) {
        this(registry, new LatencyStats("fanout-latency"));
    }

    public Broadcaster(ClientRegistry registry, LatencyStats fanoutLatency) {
        this.registry      = registry;
        this.fanoutLatency = fanoutLatency;
    }

    /** @return false if the id is stale or the transport refused the frame */
    public boolean sendTo(int sessionId, String payload) {
        ChatSession session = registry.lookup(sessionId);
        if (session == null) return false;
        return deliver(session, payload);
    }

    public boolean sendTo(ChatSession session, String payload) {
        return deliver(session, payload);
    }

    public DeliveryReport broadcastAll(String payload) {
        long start = System.nanoTime();
        List<ChatSession> targets = registry.snapshot();
        if (targets.isEmpty()) return DeliveryReport.NONE;

        int delivered = 0;
        for (ChatSession s : targets) {
            if (deliver(s, payload)) delivered++;
        }
        fanoutLatency.record(System.nanoTime() - start);

        DeliveryReport report = new DeliveryReport(targets.size(), delivered);
        if (!report.complete()) {
            log.debug("Broadcast reached {}/{} sessions", report.delivered(), report.attempted());
        }
        return report;
    }

    public LatencyStats fanoutLatency() {
        return fanoutLatency;
    }

    private boolean deliver(ChatSession session, String payload) {
        try {
            return session.connection.send(payload);
        } catch (RuntimeException e) {
            log.debug("Delivery to session {} failed: {}", session.id, e.toString());
            return false;
        }
    }
}
