package com.chatcast.core.session;

import com.chatcast.protocol.Role;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Registry of live chat sessions keyed by connection id.
 *
 * Every read and write goes through the one monitor, so role counts and the
 * admission check-and-assign are consistent with each other. Callers must not
 * send to a connection while holding it: iterate over {@link #snapshot()} instead.
 */
public final class ClientRegistry {

    public static final int DEFAULT_MAX_USERNAME_LENGTH = 63;

    private final Int2ObjectOpenHashMap<ChatSession> sessions = new Int2ObjectOpenHashMap<>();
    private final int maxUsernameLength;

    public ClientRegistry() {
        this(DEFAULT_MAX_USERNAME_LENGTH);
    }

    public ClientRegistry(int maxUsernameLength) {
        if (maxUsernameLength < 1) throw new IllegalArgumentException("maxUsernameLength must be positive");
        this.maxUsernameLength = maxUsernameLength;
    }

    /** Adds a session with the default name and no role. Re-registering a live id returns the existing session. */
    public synchronized ChatSession register(ChatConnection connection) {
        ChatSession existing = sessions.get(connection.id());
        if (existing != null) return existing;
        ChatSession session = new ChatSession(connection);
        sessions.put(session.id, session);
        return session;
    }

    /** @return the removed session, or null if the id was unknown */
    public synchronized ChatSession unregister(int id) {
        return sessions.remove(id);
    }

    public synchronized ChatSession lookup(int id) {
        return sessions.get(id);
    }

    /**
     * Sets the display name, cut to the configured maximum length.
     * A blank name falls back to {@link ChatSession#DEFAULT_USERNAME}.
     *
     * @return false if the id was unknown
     */
    public synchronized boolean setUsername(int id, String name) {
        ChatSession session = sessions.get(id);
        if (session == null) return false;
        session.username(normalizeUsername(name));
        return true;
    }

    /** Unconditional role change. Admission goes through {@link #assignRoleIf}. */
    public synchronized boolean setRole(int id, Role role) {
        ChatSession session = sessions.get(id);
        if (session == null) return false;
        session.role(role);
        return true;
    }

    /**
     * Sets the role only if {@code admissible} accepts the current counts.
     * The counts include the session's own current role.
     *
     * @return true if the role was assigned
     */
    public synchronized boolean assignRoleIf(int id, Role role, Predicate<RoleCounts> admissible) {
        ChatSession session = sessions.get(id);
        if (session == null) return false;
        if (!admissible.test(countLocked())) return false;
        session.role(role);
        return true;
    }

    public synchronized RoleCounts countRoles() {
        return countLocked();
    }

    /** Point-in-time copy of all live sessions. */
    public synchronized List<ChatSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }

    public synchronized int size() {
        return sessions.size();
    }

    private RoleCounts countLocked() {
        int readers = 0, writers = 0;
        for (ChatSession s : sessions.values()) {
            switch (s.role()) {
                case WRITER -> writers++;
                case READER -> readers++;
                default -> { }
            }
        }
        return new RoleCounts(readers, writers);
    }

    String normalizeUsername(String name) {
        if (name == null) return ChatSession.DEFAULT_USERNAME;
        int i = 0;
        while (i < name.length() && (name.charAt(i) == ' ' || name.charAt(i) == '\t')) i++;
        String trimmed = name.substring(i);
        if (trimmed.isEmpty()) return ChatSession.DEFAULT_USERNAME;
        if (trimmed.length() <= maxUsernameLength) return trimmed;
        int end = maxUsernameLength;
        // don't split a surrogate pair
        if (Character.isHighSurrogate(trimmed.charAt(end - 1))) end--;
        return trimmed.substring(0, end);
    }
}
