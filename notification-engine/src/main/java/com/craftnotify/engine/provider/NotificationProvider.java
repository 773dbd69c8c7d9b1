package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.entity.Notification;

/**
 * Delivers notifications over exactly one channel.
 * 
 * Several providers may serve the same channel; the dispatcher runs the first
 * one (lowest {@link #priority()}) whose {@link #canDeliver} accepts the
 * notification.
 * 
 * Implementations return a failed {@link DeliveryResult} for ordinary delivery
 * failures. Anything they throw is converted into a failed result by the
 * dispatcher. Implementations own their network timeouts.
 */
public interface NotificationProvider {

    NotificationChannel channel();

    ProviderName name();

    /**
     * Lower runs first among providers of the same channel.
     */
    int priority();

    /**
     * Cheap precondition check (channel selected, contact data present).
     */
    boolean canDeliver(Notification notification);

    DeliveryResult send(Notification notification);
}
