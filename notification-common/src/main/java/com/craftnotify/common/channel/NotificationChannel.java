package com.craftnotify.common.channel;

/**
 * Delivery medium a notification can be routed through.
 * 
 * Each channel owns a single bit so a set of channels can be stored and
 * combined as an integer mask (see {@link ChannelSet}).
 */
public enum NotificationChannel {
    IN_APP(1),
    EMAIL(2),
    SMS(4),
    PUSH(8),
    WEBHOOK(16);

    private final int bit;

    NotificationChannel(int bit) {
        this.bit = bit;
    }

    /**
     * Bit value of this channel inside a {@link ChannelSet} mask.
     */
    public int bit() {
        return bit;
    }
}
