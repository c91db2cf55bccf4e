package com.chatcast.protocol;

import java.util.List;

/**
 * Outbound text frame encoders.
 *
 * <pre>
 *   ROLE_CONFIRMED:writer | ROLE_CONFIRMED:reader    private, on grant
 *   ROLE_DENIED:&lt;reason&gt;                           private, on denial
 *   SYSTEM_COUNTS:&lt;readers&gt;:&lt;writers&gt;               broadcast after role requests and disconnects
 *   System: &lt;text&gt;                                  join / leave / rejection notices
 *   &lt;username&gt;: &lt;message&gt;                          chat line
 * </pre>
 *
 * History blocks are chat lines joined with '\n', oldest first, with no trailing newline.
 */
public final class Frames {

    public static final String ROLE_CONFIRMED = "ROLE_CONFIRMED:";
    public static final String ROLE_DENIED    = "ROLE_DENIED:";
    public static final String SYSTEM_COUNTS  = "SYSTEM_COUNTS:";
    public static final String SYSTEM         = "System: ";

    public static final String NOT_A_WRITER = SYSTEM + "Only the writer can send messages.";

    private Frames() {}

    public static String roleConfirmed(Role role) {
        return ROLE_CONFIRMED + role.wireName;
    }

    public static String roleDenied(DenyReason reason) {
        return ROLE_DENIED + reason.text;
    }

    public static String systemCounts(int readers, int writers) {
        return SYSTEM_COUNTS + readers + ":" + writers;
    }

    public static String joined(String username, Role role) {
        return SYSTEM + username + " joined as " + role.displayName;
    }

    public static String disconnected(String username) {
        return SYSTEM + username + " disconnected.";
    }

    public static String chatLine(String username, String message) {
        return username + ": " + message;
    }

    public static String historyBlock(List<String> linesOldestFirst) {
        return String.join("\n", linesOldestFirst);
    }
}
