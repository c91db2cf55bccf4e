package com.chatcast.protocol;

/**
 * Session role. A session starts as NONE and may be granted READER or WRITER.
 */
public enum Role {
    NONE   ("none",   "None"),
    READER ("reader", "Reader"),
    WRITER ("writer", "Writer");

    /** Lower-case form used in ROLE_CONFIRMED frames. */
    public final String wireName;
    /** Capitalized form used in join notices. */
    public final String displayName;

    Role(String wireName, String displayName) {
        this.wireName    = wireName;
        this.displayName = displayName;
    }

    /**
     * Maps the value of a {@code role:} command to the requested role.
     * Only a case-insensitive "writer" asks for WRITER; anything else asks for READER.
     */
    public static Role fromRequest(String value) {
        return WRITER.wireName.equalsIgnoreCase(value) ? WRITER : READER;
    }
}
