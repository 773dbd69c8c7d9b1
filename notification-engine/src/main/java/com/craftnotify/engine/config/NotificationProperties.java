package com.craftnotify.engine.config;

import com.craftnotify.common.channel.ChannelSet;
import com.craftnotify.common.channel.NotificationChannel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for the notification engine.
 * 
 * Maps to:
 * notification:
 *   default-channels: [IN_APP]
 *   default-expiration-days: 30
 *   max-batch-size: 100
 *   providers:
 *     http-timeout: 10s
 *     webhook:
 *       default-url: https://hooks.example.com/notify
 * 
 * Read once at startup; nothing mutates these values at runtime.
 */
@Configuration
@ConfigurationProperties(prefix = "notification")
@Data
public class NotificationProperties {

    /**
     * Channels used when a request names none, and the enabled channels of the
     * virtual preference applied to users without a stored preference.
     * Default: IN_APP
     */
    private Set<NotificationChannel> defaultChannels = EnumSet.of(NotificationChannel.IN_APP);

    /**
     * Days until a notification expires when the request sets no expiry.
     * Default: 30
     */
    private int defaultExpirationDays = 30;

    /**
     * Largest batch accepted by sendBatch / sendToMultiple.
     * Default: 100
     */
    private int maxBatchSize = 100;

    /**
     * Whether batch and fan-out sends are accepted at all.
     * Default: true
     */
    private boolean enableBatchProcessing = true;

    /**
     * Highest per-channel attempt number after which retryDelivery refuses.
     * Default: 3
     */
    private int maxRetryAttempts = 3;

    /**
     * Whether cleanupOldNotifications removes anything.
     * Default: true
     */
    private boolean enableAutoCleanup = true;

    /**
     * Age in days after which delivered or read notifications are removed by cleanup.
     * Default: 90
     */
    private int cleanupAfterDays = 90;

    /**
     * Maximum stored length of a provider response in the delivery log.
     * Default: 4000
     */
    private int providerResponseMaxLength = 4000;

    private Providers providers = new Providers();

    public ChannelSet defaultChannelSet() {
        return ChannelSet.of(defaultChannels);
    }

    @Data
    public static class Providers {

        /**
         * Timeout applied to every outbound HTTP provider call.
         * Default: 10s
         */
        private Duration httpTimeout = Duration.ofSeconds(10);

        private Toggle inApp = new Toggle();

        private Email email = new Email();

        private Webhook webhook = new Webhook();

        private TeamsWebhook teamsWebhook = new TeamsWebhook();

        private WebPush webPush = new WebPush();
    }

    @Data
    public static class Toggle {
        private boolean enabled = true;
    }

    @Data
    public static class Email {
        /**
         * Off unless an API key is supplied.
         */
        private boolean enabled = false;
        private String apiKey;
        private String fromEmail = "noreply@example.com";
        private String fromName = "Notification Service";
    }

    @Data
    public static class Webhook {
        private boolean enabled = true;

        /**
         * Used when neither the notification metadata nor the recipient's
         * preference carries a webhook URL.
         */
        private String defaultUrl;
    }

    @Data
    public static class TeamsWebhook {
        /**
         * Incoming webhook URL. The Teams provider is only registered when set.
         */
        private String url;
    }

    @Data
    public static class WebPush {
        private boolean enabled = true;

        /**
         * Seconds the push service keeps an undelivered message.
         * Default: 86400
         */
        private int ttlSeconds = 86400;
    }
}
