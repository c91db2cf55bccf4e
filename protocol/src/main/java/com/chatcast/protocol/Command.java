package com.chatcast.protocol;

/**
 * Inbound text frame classification, by prefix.
 *
 * <pre>
 *   username:&lt;name&gt;   set display name
 *   role:&lt;value&gt;      request a role ("writer" or anything else for reader)
 *   get_history       resend history snapshot
 *   (anything else)   chat payload, writer only
 * </pre>
 *
 * Prefixes are matched case-sensitively; leading spaces and tabs after the prefix are dropped.
 */
public enum Command {
    USERNAME    ("username:"),
    ROLE        ("role:"),
    GET_HISTORY ("get_history"),
    CHAT        ("");

    public final String prefix;

    Command(String prefix) { this.prefix = prefix; }

    public static Command classify(String text) {
        if (text.startsWith(USERNAME.prefix))    return USERNAME;
        if (text.startsWith(ROLE.prefix))        return ROLE;
        if (text.startsWith(GET_HISTORY.prefix)) return GET_HISTORY;
        return CHAT;
    }

    /**
     * Text following the prefix with leading blanks removed.
     * CHAT payloads are returned verbatim.
     */
    public String argument(String text) {
        if (this == CHAT) return text;
        return stripLeadingBlanks(text.substring(prefix.length()));
    }

    static String stripLeadingBlanks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) i++;
        return s.substring(i);
    }
}
