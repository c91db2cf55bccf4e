package com.chatcast.core.session;

/** Reader and writer totals taken in a single pass under the registry lock. */
public record RoleCounts(int readers, int writers) {
}
