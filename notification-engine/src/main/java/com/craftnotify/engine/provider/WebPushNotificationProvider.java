package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderErrorCategory;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.entity.NotificationPreference;
import com.craftnotify.engine.service.NotificationPreferenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Web push delivery to the subscription stored on the recipient's preference.
 * 
 * Sends a payload-less push message (the service worker fetches the unread
 * notifications itself), so no message encryption is involved. A 404/410
 * from the push service means the subscription is gone and is classified
 * as PERMANENT.
 */
@Component
@ConditionalOnProperty(prefix = "notification.providers.web-push", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class WebPushNotificationProvider extends AbstractNotificationProvider {

    private final WebClient webClient;
    private final NotificationProperties properties;
    private final NotificationPreferenceService preferenceService;
    private final HttpFailureClassifier failureClassifier;

    public WebPushNotificationProvider(WebClient.Builder webClientBuilder,
                                       NotificationProperties properties,
                                       NotificationPreferenceService preferenceService,
                                       HttpFailureClassifier failureClassifier) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.preferenceService = preferenceService;
        this.failureClassifier = failureClassifier;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    public ProviderName name() {
        return ProviderName.WEB_PUSH;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canDeliver(Notification notification) {
        return super.canDeliver(notification)
            && hasText(notification.getRecipientUserId())
            && subscription(notification).hasPushSubscription();
    }

    @Override
    protected DeliveryResult doSend(Notification notification) {
        if (!hasText(notification.getRecipientUserId())) {
            return DeliveryResult.createFailure("Push delivery requires a recipient user", ProviderErrorCategory.PERMANENT);
        }
        NotificationPreference subscription = subscription(notification);
        if (!subscription.hasPushSubscription()) {
            return DeliveryResult.createFailure("No push subscription registered for user "
                + notification.getRecipientUserId(), ProviderErrorCategory.CONFIG);
        }

        try {
            ResponseEntity<Void> response = webClient.post()
                .uri(subscription.getPushEndpoint())
                .header("TTL", String.valueOf(properties.getProviders().getWebPush().getTtlSeconds()))
                .header("Urgency", urgency(notification))
                .retrieve()
                .toBodilessEntity()
                .timeout(properties.getProviders().getHttpTimeout())
                .block();
            int status = response != null ? response.getStatusCode().value() : 0;
            return DeliveryResult.createSuccess("Push service status " + status);

        } catch (WebClientResponseException e) {
            String errorMessage = String.format("Push service returned HTTP %d: %s",
                e.getStatusCode().value(), e.getResponseBodyAsString());
            return DeliveryResult.createFailure(errorMessage, failureClassifier.classify(e))
                .withProviderResponse(e.getResponseBodyAsString());
        } catch (Exception e) {
            log.error("Push delivery failed for notification {}", notification.getId(), e);
            return DeliveryResult.createFailure("Push request failed: " + e.getMessage(),
                failureClassifier.classify(e));
        }
    }

    private NotificationPreference subscription(Notification notification) {
        // Subscriptions live on the default row only
        return preferenceService.resolvePreference(notification.getRecipientUserId(), null);
    }

    private static String urgency(Notification notification) {
        if (notification.getPriority() == null) {
            return "normal";
        }
        return switch (notification.getPriority()) {
            case LOW -> "low";
            case NORMAL -> "normal";
            case HIGH, CRITICAL -> "high";
        };
    }
}
