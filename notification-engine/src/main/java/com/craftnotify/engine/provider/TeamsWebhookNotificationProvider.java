package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderErrorCategory;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.entity.Notification;
import com.craftnotify.engine.service.NotificationMetadataSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Microsoft Teams incoming-webhook delivery on the WEBHOOK channel.
 * 
 * Runs after the generic webhook provider (priority 21 vs 20), so it acts as
 * the fallback when no generic webhook URL is available. Only registered when
 * notification.providers.teams-webhook.url is set; a per-notification URL can
 * be supplied under metadata key {@value #TEAMS_WEBHOOK_URL_KEY}.
 */
@Component
@ConditionalOnProperty(prefix = "notification.providers.teams-webhook", name = "url")
@Slf4j
public class TeamsWebhookNotificationProvider extends AbstractNotificationProvider {

    public static final String TEAMS_WEBHOOK_URL_KEY = "teamsWebhookUrl";

    private final WebClient webClient;
    private final NotificationProperties properties;
    private final NotificationMetadataSerializer metadataSerializer;
    private final HttpFailureClassifier failureClassifier;

    public TeamsWebhookNotificationProvider(WebClient.Builder webClientBuilder,
                                            NotificationProperties properties,
                                            NotificationMetadataSerializer metadataSerializer,
                                            HttpFailureClassifier failureClassifier) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.metadataSerializer = metadataSerializer;
        this.failureClassifier = failureClassifier;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBHOOK;
    }

    @Override
    public ProviderName name() {
        return ProviderName.TEAMS_WEBHOOK;
    }

    @Override
    public int priority() {
        return 21;
    }

    @Override
    public boolean canDeliver(Notification notification) {
        return super.canDeliver(notification) && resolveUrl(notification).isPresent();
    }

    @Override
    protected DeliveryResult doSend(Notification notification) {
        Optional<String> url = resolveUrl(notification);
        if (url.isEmpty()) {
            return DeliveryResult.createFailure("Teams webhook URL not configured", ProviderErrorCategory.CONFIG);
        }

        LocalDateTime timestamp = notification.getCreatedAt() != null
            ? notification.getCreatedAt()
            : LocalDateTime.now(ZoneOffset.UTC);

        try {
            String response = webClient.post()
                .uri(url.get())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TeamsMessageCard.build(notification, timestamp))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getProviders().getHttpTimeout())
                .block();
            return DeliveryResult.createSuccess(response);

        } catch (WebClientResponseException e) {
            String errorMessage = String.format("Teams webhook returned HTTP %d: %s",
                e.getStatusCode().value(), e.getResponseBodyAsString());
            return DeliveryResult.createFailure(errorMessage, failureClassifier.classify(e))
                .withProviderResponse(e.getResponseBodyAsString());
        } catch (Exception e) {
            log.error("Teams webhook delivery failed for notification {}", notification.getId(), e);
            return DeliveryResult.createFailure("Teams webhook request failed: " + e.getMessage(),
                failureClassifier.classify(e));
        }
    }

    private Optional<String> resolveUrl(Notification notification) {
        Optional<String> fromMetadata = metadataSerializer.getString(notification, TEAMS_WEBHOOK_URL_KEY);
        if (fromMetadata.isPresent()) {
            return fromMetadata;
        }
        String configured = properties.getProviders().getTeamsWebhook().getUrl();
        return hasText(configured) ? Optional.of(configured) : Optional.empty();
    }
}
