package com.craftnotify.common.provider;

/**
 * Provider error category recorded with every failed delivery attempt.
 * 
 * Lets retry and alerting decisions stay provider-agnostic:
 * - TEMPORARY: rate limits, timeouts, 5xx; a later retry may succeed
 * - PERMANENT: malformed request or rejected recipient; retrying won't help
 * - AUTH: invalid or revoked credentials
 * - CONFIG: missing endpoint, disabled provider, no eligible provider
 */
public enum ProviderErrorCategory {
    /**
     * Temporary errors that may resolve: rate limits, timeouts, server errors.
     */
    TEMPORARY,

    /**
     * Permanent errors that won't resolve: invalid request format, malformed data.
     */
    PERMANENT,

    /**
     * Authentication/authorization errors: invalid API key, revoked access.
     */
    AUTH,

    /**
     * Configuration errors: missing required config, invalid settings.
     */
    CONFIG
}
