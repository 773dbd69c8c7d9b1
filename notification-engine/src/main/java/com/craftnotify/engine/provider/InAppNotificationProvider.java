package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.entity.Notification;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-app delivery. The persisted notification row is the in-app message, so
 * delivery only needs a recipient user to show it to.
 */
@Component
@ConditionalOnProperty(prefix = "notification.providers.in-app", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InAppNotificationProvider extends AbstractNotificationProvider {

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.IN_APP;
    }

    @Override
    public ProviderName name() {
        return ProviderName.IN_APP;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canDeliver(Notification notification) {
        return super.canDeliver(notification) && hasText(notification.getRecipientUserId());
    }

    @Override
    protected DeliveryResult doSend(Notification notification) {
        return DeliveryResult.createSuccess("Stored for user " + notification.getRecipientUserId());
    }
}
