package com.craftnotify.engine.provider;

import com.craftnotify.common.provider.ProviderErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures into {@link ProviderErrorCategory}.
 * 
 * Classification rules:
 * - AUTH: HTTP 401/403, "invalid api key" / "unauthorized" messages
 * - TEMPORARY: HTTP 408, 429, 5xx, timeouts and connection errors
 * - PERMANENT: any other 4xx (bad payload, subscription gone)
 * - TEMPORARY: everything else
 */
@Component
@Slf4j
public class HttpFailureClassifier {

    /**
     * Classify a failure based on HTTP status code and error message.
     * 
     * @param httpStatusCode HTTP status code (may be null)
     * @param errorMessage Error message (may be null)
     * @return Error category
     */
    public ProviderErrorCategory classify(Integer httpStatusCode, String errorMessage) {
        if (httpStatusCode != null) {
            if (httpStatusCode == 401 || httpStatusCode == 403) {
                return ProviderErrorCategory.AUTH;
            }
            if (httpStatusCode == 408 || httpStatusCode == 429 || httpStatusCode >= 500) {
                return ProviderErrorCategory.TEMPORARY;
            }
            if (httpStatusCode >= 400) {
                return ProviderErrorCategory.PERMANENT;
            }
        }

        if (errorMessage != null) {
            String lowerError = errorMessage.toLowerCase();
            if (lowerError.contains("invalid api key") ||
                lowerError.contains("unauthorized") ||
                lowerError.contains("forbidden")) {
                return ProviderErrorCategory.AUTH;
            }
        }

        return ProviderErrorCategory.TEMPORARY;
    }

    /**
     * Classify an exception thrown by an HTTP call.
     */
    public ProviderErrorCategory classify(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            return classify(responseException.getStatusCode().value(), responseException.getMessage());
        }
        if (error instanceof TimeoutException || error.getCause() instanceof TimeoutException) {
            return ProviderErrorCategory.TEMPORARY;
        }
        return classify(null, error.getMessage());
    }
}
