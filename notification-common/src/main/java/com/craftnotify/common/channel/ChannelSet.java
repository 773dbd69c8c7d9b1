package com.craftnotify.common.channel;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Immutable set of {@link NotificationChannel}s backed by an integer bit mask.
 * 
 * Used for requested channels on a notification, enabled channels on a
 * preference and the effective (intersected) channel set after preference
 * resolution. The mask is what gets persisted.
 * 
 * Example usage:
 * <pre>
 * ChannelSet requested = ChannelSet.of(NotificationChannel.IN_APP, NotificationChannel.PUSH);
 * ChannelSet effective = requested.intersect(preference.getEnabledChannels());
 * if (effective.isEmpty()) {
 *     // blocked by preferences
 * }
 * </pre>
 */
public final class ChannelSet {

    private static final int ALL_MASK;

    static {
        int mask = 0;
        for (NotificationChannel channel : NotificationChannel.values()) {
            mask |= channel.bit();
        }
        ALL_MASK = mask;
    }

    private static final ChannelSet NONE = new ChannelSet(0);
    private static final ChannelSet ALL = new ChannelSet(ALL_MASK);

    private final int mask;

    private ChannelSet(int mask) {
        this.mask = mask;
    }

    public static ChannelSet none() {
        return NONE;
    }

    public static ChannelSet all() {
        return ALL;
    }

    public static ChannelSet of(NotificationChannel... channels) {
        int mask = 0;
        for (NotificationChannel channel : channels) {
            mask |= channel.bit();
        }
        return fromMask(mask);
    }

    public static ChannelSet of(Collection<NotificationChannel> channels) {
        if (channels == null) {
            return NONE;
        }
        int mask = 0;
        for (NotificationChannel channel : channels) {
            mask |= channel.bit();
        }
        return fromMask(mask);
    }

    /**
     * Rebuild a set from its persisted mask.
     * 
     * @param mask Bit mask
     * @return Channel set
     * @throws IllegalArgumentException if the mask carries bits no channel owns
     */
    public static ChannelSet fromMask(int mask) {
        if ((mask & ~ALL_MASK) != 0) {
            throw new IllegalArgumentException("Invalid channel mask: " + mask);
        }
        if (mask == 0) {
            return NONE;
        }
        if (mask == ALL_MASK) {
            return ALL;
        }
        return new ChannelSet(mask);
    }

    public int mask() {
        return mask;
    }

    public boolean contains(NotificationChannel channel) {
        return (mask & channel.bit()) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public int size() {
        return Integer.bitCount(mask);
    }

    public ChannelSet union(ChannelSet other) {
        return fromMask(mask | other.mask);
    }

    public ChannelSet intersect(ChannelSet other) {
        return fromMask(mask & other.mask);
    }

    public ChannelSet with(NotificationChannel channel) {
        return fromMask(mask | channel.bit());
    }

    public ChannelSet without(NotificationChannel channel) {
        return fromMask(mask & ~channel.bit());
    }

    /**
     * True when every channel of this set is also in {@code other}.
     */
    public boolean isSubsetOf(ChannelSet other) {
        return (mask & ~other.mask) == 0;
    }

    /**
     * Channels in bit order.
     */
    public Set<NotificationChannel> channels() {
        if (mask == 0) {
            return Collections.emptySet();
        }
        EnumSet<NotificationChannel> result = EnumSet.noneOf(NotificationChannel.class);
        for (NotificationChannel channel : NotificationChannel.values()) {
            if (contains(channel)) {
                result.add(channel);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelSet)) {
            return false;
        }
        return mask == ((ChannelSet) o).mask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(mask);
    }

    @Override
    public String toString() {
        if (mask == 0) {
            return "NONE";
        }
        StringJoiner joiner = new StringJoiner("|");
        for (NotificationChannel channel : channels()) {
            joiner.add(channel.name());
        }
        return joiner.toString();
    }
}
