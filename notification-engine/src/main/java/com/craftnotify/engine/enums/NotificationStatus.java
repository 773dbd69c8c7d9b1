package com.craftnotify.engine.enums;

/**
 * Lifecycle status of a notification.
 * 
 * PENDING until at least one channel succeeds, QUEUED while deferred to a
 * scheduled time, DELIVERED once any channel accepted it, READ once the
 * recipient acknowledged it.
 */
public enum NotificationStatus {
    PENDING,
    QUEUED,
    DELIVERED,
    READ
}
