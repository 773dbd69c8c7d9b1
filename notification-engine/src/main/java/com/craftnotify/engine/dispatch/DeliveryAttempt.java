package com.craftnotify.engine.dispatch;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;

/**
 * One channel's attempt within a dispatch run.
 * 
 * @param channel Channel attempted
 * @param providerName Config name of the provider that ran, or null when no provider was eligible
 * @param attemptNumber 1-based attempt number for this (notification, channel)
 * @param result Provider outcome (synthetic failure when no provider was eligible)
 */
public record DeliveryAttempt(
    NotificationChannel channel,
    String providerName,
    int attemptNumber,
    DeliveryResult result
) {
    public boolean isSuccess() {
        return result.isSuccess();
    }
}
