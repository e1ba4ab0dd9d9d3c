package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.exception.ExternalApiException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Maps HTTP failures of the third-party APIs onto ExternalApiException:
 * 429 → RateLimitedException, other 4xx → ClientException, 5xx and network
 * faults → ExternalApiException.
 */
final class ApiErrors {

    static final long DEFAULT_RETRY_AFTER_SECONDS = 10;

    private ApiErrors() {
    }

    /** For {@code retrieve().onStatus(HttpStatusCode::isError, ...)}. */
    static Function<ClientResponse, Mono<? extends Throwable>> onError(String service, String operation) {
        return res -> res.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> toException(service, operation, res.statusCode().value(),
                        res.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER), body));
    }

    static ExternalApiException map(String service, String operation, WebClientException ex) {
        if (ex instanceof WebClientResponseException wcre) {
            return toException(service, operation, wcre.getStatusCode().value(),
                    wcre.getHeaders().getFirst(HttpHeaders.RETRY_AFTER), wcre.getResponseBodyAsString());
        }
        return new ExternalApiException(service, operation + " failed: " + ex.getMessage(), ex);
    }

    static ExternalApiException toException(String service, String operation, int status,
                                            String retryAfter, String body) {
        String message = operation + " failed (" + status + "): " + body;
        if (status == 429) {
            return new ExternalApiException.RateLimitedException(service, message, parseRetryAfter(retryAfter));
        }
        if (status >= 400 && status < 500) {
            return new ExternalApiException.ClientException(service, message, status);
        }
        return new ExternalApiException(service, message, status);
    }

    static long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return DEFAULT_RETRY_AFTER_SECONDS;
        try {
            return Math.max(0, Long.parseLong(header.trim()));
        } catch (NumberFormatException ex) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }
}
