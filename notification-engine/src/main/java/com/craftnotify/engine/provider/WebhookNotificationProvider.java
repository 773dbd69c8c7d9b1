package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderErrorCategory;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.service.NotificationMetadataSerializer;
import com.craftnotify.engine.service.NotificationPreferenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Generic webhook delivery: POSTs the notification as JSON.
 * 
 * Target URL, first match wins:
 * 1. metadata key {@value #WEBHOOK_URL_KEY}
 * 2. the recipient's preference webhook URL
 * 3. notification.providers.webhook.default-url
 */
@Component
@ConditionalOnProperty(prefix = "notification.providers.webhook", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class WebhookNotificationProvider extends AbstractNotificationProvider {

    public static final String WEBHOOK_URL_KEY = "webhookUrl";

    private final WebClient webClient;
    private final NotificationProperties properties;
    private final NotificationMetadataSerializer metadataSerializer;
    private final NotificationPreferenceService preferenceService;
    private final HttpFailureClassifier failureClassifier;

    public WebhookNotificationProvider(WebClient.Builder webClientBuilder,
                                       NotificationProperties properties,
                                       NotificationMetadataSerializer metadataSerializer,
                                       NotificationPreferenceService preferenceService,
                                       HttpFailureClassifier failureClassifier) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.metadataSerializer = metadataSerializer;
        this.preferenceService = preferenceService;
        this.failureClassifier = failureClassifier;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBHOOK;
    }

    @Override
    public ProviderName name() {
        return ProviderName.WEBHOOK;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean canDeliver(Notification notification) {
        return super.canDeliver(notification) && resolveUrl(notification).isPresent();
    }

    @Override
    protected DeliveryResult doSend(Notification notification) {
        Optional<String> url = resolveUrl(notification);
        if (url.isEmpty()) {
            return DeliveryResult.createFailure("Webhook URL not configured",
                ProviderErrorCategory.CONFIG);
        }

        try {
            String response = webClient.post()
                .uri(url.get())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(notification))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getProviders().getHttpTimeout())
                .block();
            return DeliveryResult.createSuccess(response);

        } catch (WebClientResponseException e) {
            String errorMessage = String.format("Webhook returned HTTP %d: %s",
                e.getStatusCode().value(), e.getResponseBodyAsString());
            return DeliveryResult.createFailure(errorMessage, failureClassifier.classify(e))
                .withProviderResponse(e.getResponseBodyAsString());
        } catch (Exception e) {
            log.error("Webhook request failed for notification {}", notification.getId(), e);
            return DeliveryResult.createFailure("Webhook request failed: " + e.getMessage(),
                failureClassifier.classify(e));
        }
    }

    Optional<String> resolveUrl(Notification notification) {
        Optional<String> fromMetadata = metadataSerializer.getString(notification, WEBHOOK_URL_KEY);
        if (fromMetadata.isPresent()) {
            return fromMetadata;
        }
        if (hasText(notification.getRecipientUserId())) {
            String preferenceUrl = preferenceService
                .resolvePreference(notification.getRecipientUserId(), notification.getCategory())
                .getWebhookUrl();
            if (hasText(preferenceUrl)) {
                return Optional.of(preferenceUrl);
            }
        }
        String defaultUrl = properties.getProviders().getWebhook().getDefaultUrl();
        return hasText(defaultUrl) ? Optional.of(defaultUrl) : Optional.empty();
    }

    Map<String, Object> buildPayload(Notification notification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", notification.getId());
        payload.put("title", notification.getTitle());
        payload.put("message", notification.getMessage());
        payload.put("type", notification.getType());
        payload.put("priority", notification.getPriority());
        payload.put("category", notification.getCategory());
        payload.put("recipientUserId", notification.getRecipientUserId());
        payload.put("senderUserId", notification.getSenderUserId());
        payload.put("tenantId", notification.getTenantId());
        payload.put("actionUrl", notification.getActionUrl());
        payload.put("imageUrl", notification.getImageUrl());
        payload.put("metadata", metadataSerializer.read(notification));
        payload.put("timestamp", notification.getCreatedAt() != null ? notification.getCreatedAt() : LocalDateTime.now());
        return payload;
    }
}
