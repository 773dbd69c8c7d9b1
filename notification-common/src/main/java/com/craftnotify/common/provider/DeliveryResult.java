package com.craftnotify.common.provider;

/**
 * Outcome of a single provider send.
 * 
 * Providers return a failed result for ordinary delivery failures instead of
 * throwing. {@code durationMs} is filled in by the provider base class after
 * the call returns.
 * 
 * Example usage:
 * <pre>
 * DeliveryResult result = provider.send(notification);
 * if (!result.isSuccess()) {
 *     log.warn("Delivery failed: {}", result.getErrorMessage());
 * }
 * </pre>
 */
public record DeliveryResult(
    boolean success,
    String errorMessage,
    ProviderErrorCategory errorCategory,
    String providerResponse,
    long durationMs
) {

    /**
     * Create a successful result.
     * 
     * @param providerResponse Opaque provider payload (may be null)
     * @return Success result
     */
    public static DeliveryResult createSuccess(String providerResponse) {
        return new DeliveryResult(true, null, null, providerResponse, 0L);
    }

    public static DeliveryResult createSuccess() {
        return createSuccess(null);
    }

    /**
     * Create a failure result.
     * 
     * @param errorMessage Error message
     * @param errorCategory Error category
     * @return Failure result
     */
    public static DeliveryResult createFailure(String errorMessage, ProviderErrorCategory errorCategory) {
        return new DeliveryResult(false, errorMessage, errorCategory, null, 0L);
    }

    /**
     * Create a failure result with TEMPORARY category (default).
     */
    public static DeliveryResult createFailure(String errorMessage) {
        return createFailure(errorMessage, ProviderErrorCategory.TEMPORARY);
    }

    public DeliveryResult withProviderResponse(String response) {
        return new DeliveryResult(success, errorMessage, errorCategory, response, durationMs);
    }

    public DeliveryResult withDuration(long millis) {
        return new DeliveryResult(success, errorMessage, errorCategory, providerResponse, millis);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ProviderErrorCategory getErrorCategory() {
        return errorCategory;
    }
}
