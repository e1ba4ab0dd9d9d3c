package com.leanfinance.services.onboardings.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.leanfinance.services.onboardings.config.GoogleApiConfig;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Clock;
import java.time.Instant;

/**
 * Mints Google access tokens from the stored OAuth refresh token and caches
 * them until shortly before they expire. Shared by the Drive, Sheets and Gmail
 * clients.
 */
@Component
@Slf4j
public class GoogleTokenService {

    private static final String SERVICE = "Google OAuth";
    private static final long EXPIRY_MARGIN_SECONDS = 60;

    private final WebClient webClient;
    private final GoogleApiConfig config;
    private final Clock clock;

    private volatile CachedToken cached;

    public GoogleTokenService(@Qualifier("googleOAuthWebClient") WebClient webClient,
                              GoogleApiConfig config,
                              Clock clock) {
        this.webClient = webClient;
        this.config = config;
        this.clock = clock;
    }

    public synchronized String getAccessToken() {
        Instant now = clock.instant();
        CachedToken current = cached;
        if (current != null && now.isBefore(current.expiresAt())) {
            return current.accessToken();
        }

        TokenResponse response;
        try {
            response = webClient.post()
                    .uri(config.getTokenUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                            .with("client_id", config.getClientId())
                            .with("client_secret", config.getClientSecret())
                            .with("refresh_token", config.getRefreshToken()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Token refresh"))
                    .bodyToMono(TokenResponse.class)
                    .block();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Token refresh", ex);
        }

        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new ExternalApiException(SERVICE, "Token refresh returned no access_token");
        }

        long lifetime = Math.max(0, response.getExpiresIn() - EXPIRY_MARGIN_SECONDS);
        cached = new CachedToken(response.getAccessToken(), now.plusSeconds(lifetime));
        log.info("Google access token refreshed, valid for {}s", lifetime);
        return response.getAccessToken();
    }

    public void evict() {
        cached = null;
    }

    private record CachedToken(String accessToken, Instant expiresAt) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;

        @JsonProperty("expires_in")
        private long expiresIn = 3600;
    }
}
