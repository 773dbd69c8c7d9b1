package com.craftnotify.common.provider;

/**
 * Provider name enumeration.
 * 
 * Identifies the provider that handled an attempt in delivery logs and
 * metrics, and keys the per-provider configuration block.
 */
public enum ProviderName {
    /**
     * Stored-only in-app delivery
     */
    IN_APP,

    /**
     * SendGrid email provider
     */
    SENDGRID,

    /**
     * Generic JSON webhook
     */
    WEBHOOK,

    /**
     * Microsoft Teams incoming webhook (MessageCard)
     */
    TEAMS_WEBHOOK,

    /**
     * Web push subscription endpoint
     */
    WEB_PUSH;

    /**
     * Get provider name as lowercase, dash-separated string for configuration/storage.
     * 
     * @return Provider name (e.g., "sendgrid", "teams-webhook")
     */
    public String toConfigValue() {
        return name().toLowerCase().replace('_', '-');
    }
}
