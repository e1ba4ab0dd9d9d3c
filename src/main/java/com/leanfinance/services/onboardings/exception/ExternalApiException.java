package com.leanfinance.services.onboardings.exception;

import lombok.Getter;

/**
 * Thrown when a third-party API (HubSpot, Google, Holded, Slack) returns an
 * error or is unavailable.
 *
 * - ExternalApiException: server errors (5xx) and network faults, retryable
 * - ExternalApiException.ClientException: client errors (4xx), NOT retried
 * - ExternalApiException.RateLimitedException: 429, retried after Retry-After
 */
@Getter
public class ExternalApiException extends OnboardingServiceException {

    private final String service;
    private final int httpStatus;

    public ExternalApiException(String service, String message) {
        this(service, message, 503);
    }

    public ExternalApiException(String service, String message, int httpStatus) {
        super(service + ": " + message, "EXTERNAL_API_ERROR");
        this.service = service;
        this.httpStatus = httpStatus;
    }

    public ExternalApiException(String service, String message, Throwable cause) {
        super(service + ": " + message, "EXTERNAL_API_ERROR", cause);
        this.service = service;
        this.httpStatus = 503;
    }

    public static ExternalApiException serviceUnavailable(String service) {
        return new ExternalApiException(service,
                "API is temporarily unavailable. Please try again later.");
    }

    // ========================
    // INNER CLASS
    // 4xx errors: do NOT retry
    // ========================

    public static class ClientException extends ExternalApiException {

        public ClientException(String service, String message, int httpStatus) {
            super(service, message, httpStatus);
        }
    }

    /**
     * HTTP 429. Retryable after the delay the API asked for.
     */
    @Getter
    public static class RateLimitedException extends ExternalApiException {

        private final long retryAfterSeconds;

        public RateLimitedException(String service, String message, long retryAfterSeconds) {
            super(service, message, 429);
            this.retryAfterSeconds = retryAfterSeconds;
        }
    }
}
