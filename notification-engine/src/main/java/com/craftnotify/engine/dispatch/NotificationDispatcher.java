package com.craftnotify.engine.dispatch;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderErrorCategory;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.provider.HttpFailureClassifier;
import com.craftnotify.engine.provider.NotificationProvider;
import com.craftnotify.engine.service.DeliveryLogRecorder;
import com.craftnotify.engine.service.NotificationMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one provider per channel for a notification and captures the outcomes.
 * 
 * For every channel of the given set:
 * - candidates come from {@link ProviderRegistry} in priority order
 * - the first candidate whose canDeliver accepts the notification is invoked
 * - a thrown exception becomes a failed result; it never escapes this class
 * - no eligible candidate yields a synthetic CONFIG failure
 * 
 * Attempts are returned, not persisted; the caller writes them together with
 * the notification.
 * 
 * ⚠️ INTERRUPTS: an interrupted thread stops new channels from starting. A
 * provider call that is already running is waited for and its outcome kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final ProviderRegistry providerRegistry;
    private final DeliveryLogRecorder deliveryLogRecorder;
    private final HttpFailureClassifier failureClassifier;
    private final NotificationMetricsService metricsService;

    public DispatchOutcome dispatch(Notification notification, ChannelSet channels) {
        List<DeliveryAttempt> attempts = new ArrayList<>();

        for (NotificationChannel channel : channels.channels()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Dispatch of notification {} interrupted after {} of {} channel(s)",
                    notification.getId(), attempts.size(), channels.size());
                return new DispatchOutcome(attempts, true);
            }
            attempts.add(dispatchChannel(notification, channel));
        }

        return new DispatchOutcome(attempts, false);
    }

    private DeliveryAttempt dispatchChannel(Notification notification, NotificationChannel channel) {
        int attemptNumber = deliveryLogRecorder.nextAttemptNumber(notification.getId(), channel);

        for (NotificationProvider provider : providerRegistry.providersFor(channel)) {
            if (!isEligible(provider, notification)) {
                log.debug("Provider {} skipped notification {} on {}", provider.name(), notification.getId(), channel);
                continue;
            }
            DeliveryResult result = invoke(provider, notification);
            metricsService.recordDeliveryAttempt(channel, result);
            return new DeliveryAttempt(channel, provider.name().toConfigValue(), attemptNumber, result);
        }

        log.warn("No eligible provider for channel {} on notification {}", channel, notification.getId());
        DeliveryResult noProvider = DeliveryResult.createFailure(
            "No eligible provider for channel " + channel, ProviderErrorCategory.CONFIG);
        metricsService.recordDeliveryAttempt(channel, noProvider);
        return new DeliveryAttempt(channel, null, attemptNumber, noProvider);
    }

    private boolean isEligible(NotificationProvider provider, Notification notification) {
        try {
            return provider.canDeliver(notification);
        } catch (RuntimeException e) {
            log.warn("Provider {} eligibility check failed for notification {}: {}",
                provider.name(), notification.getId(), e.getMessage());
            return false;
        }
    }

    private DeliveryResult invoke(NotificationProvider provider, Notification notification) {
        long start = System.nanoTime();
        try {
            DeliveryResult result = provider.send(notification);
            if (result == null) {
                return DeliveryResult.createFailure("Provider " + provider.name().toConfigValue() + " returned no result")
                    .withDuration(elapsedMillis(start));
            }
            return result;
        } catch (Exception e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Provider {} failed to deliver notification {}", provider.name(), notification.getId(), e);
            return DeliveryResult.createFailure(
                    "Provider " + provider.name().toConfigValue() + " failed: " + e.getMessage(),
                    failureClassifier.classify(e))
                .withDuration(elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
