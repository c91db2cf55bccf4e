package com.chatcast.protocol;

public enum DenyReason {
    WRITER_OR_READERS_PRESENT ("A writer or readers are already inside."),
    WRITER_PRESENT            ("A writer is already inside.");

    public final String text;
    DenyReason(String text) { this.text = text; }

    /** The reason reported when a request for {@code requested} is refused. */
    public static DenyReason forRequest(Role requested) {
        return requested == Role.WRITER ? WRITER_OR_READERS_PRESENT : WRITER_PRESENT;
    }
}
