package com.craftnotify.engine.provider;

import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.engine.entity.Notification;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Base class for providers: channel check, timing and start/outcome logging.
 * Subclasses implement {@link #doSend(Notification)}.
 */
@Slf4j
public abstract class AbstractNotificationProvider implements NotificationProvider {

    /**
     * A provider only delivers on channels that survived preference resolution.
     */
    @Override
    public boolean canDeliver(Notification notification) {
        return notification.getEffectiveChannels() != null
            && notification.getEffectiveChannels().contains(channel());
    }

    @Override
    public final DeliveryResult send(Notification notification) {
        log.debug("Delivering notification {} via {} ({})", notification.getId(), name(), channel());
        long start = System.nanoTime();

        DeliveryResult result = doSend(notification);

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (result.isSuccess()) {
            log.info("Notification {} delivered via {} in {}ms", notification.getId(), name(), durationMs);
        } else {
            log.warn("Notification {} delivery via {} failed after {}ms: {}",
                notification.getId(), name(), durationMs, result.getErrorMessage());
        }
        return result.withDuration(durationMs);
    }

    protected abstract DeliveryResult doSend(Notification notification);

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
