package com.craftnotify.common.model;

/**
 * Notification priority, totally ordered by {@link #level()}.
 * 
 * Compared against a preference's minimum priority: anything strictly below
 * the floor is not delivered on any channel.
 */
public enum NotificationPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int level;

    NotificationPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * @param floor Minimum priority (null means no floor)
     * @return true if this priority is strictly lower than {@code floor}
     */
    public boolean isBelow(NotificationPriority floor) {
        return floor != null && level < floor.level;
    }
}
