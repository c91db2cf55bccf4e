package com.chatcast.core.admission;

import com.chatcast.protocol.DenyReason;
import com.chatcast.protocol.Role;

/**
 * Outcome of a role request. {@code reason} is null when granted.
 */
public record AdmissionResult(Role requested, boolean granted, DenyReason reason) {

    public static AdmissionResult granted(Role role) {
        return new AdmissionResult(role, true, null);
    }

    public static AdmissionResult denied(Role role, DenyReason reason) {
        return new AdmissionResult(role, false, reason);
    }
}
