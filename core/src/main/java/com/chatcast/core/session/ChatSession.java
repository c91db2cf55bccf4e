package com.chatcast.core.session;

import com.chatcast.protocol.Role;

/**
 * Core-side state for a connected client.
 *
 * Thread safety: id and connection are immutable. username and role are only
 * written while holding the {@link ClientRegistry} lock and are volatile so that
 * routing threads can read them without it.
 */
public final class ChatSession {

    public static final String DEFAULT_USERNAME = "Anonymous";

    public final int            id;
    public final ChatConnection connection;

    private volatile String username = DEFAULT_USERNAME;
    private volatile Role   role     = Role.NONE;

    ChatSession(ChatConnection connection) {
        this.id         = connection.id();
        this.connection = connection;
    }

    public String username() { return username; }

    public Role role() { return role; }

    public boolean isWriter() { return role == Role.WRITER; }

    void username(String username) { this.username = username; }

    void role(Role role) { this.role = role; }

    @Override
    public String toString() {
        return "ChatSession{id=" + id + ", username=" + username + ", role=" + role + '}';
    }
}
