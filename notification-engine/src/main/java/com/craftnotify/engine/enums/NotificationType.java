package com.craftnotify.engine.enums;

/**
 * Cosmetic notification type. Drives presentation only (e.g. card colour).
 */
public enum NotificationType {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
