package com.chatcast.core.broadcast;

/** Outcome of one fan-out: how many sessions were tried and how many accepted the frame. */
public record DeliveryReport(int attempted, int delivered) {

    public static final DeliveryReport NONE = new DeliveryReport(0, 0);

    public int failed() {
        return attempted - delivered;
    }

    public boolean complete() {
        return attempted == delivered;
    }
}
