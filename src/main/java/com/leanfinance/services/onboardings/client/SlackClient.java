package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.Map;

/**
 * Slack Web API client for direct messages.
 *
 * Slack answers HTTP 200 with {@code "ok": false} on application errors,
 * so every response is checked for the flag.
 */
@Component
@Slf4j
public class SlackClient {

    private static final String SERVICE = "Slack";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    public SlackClient(@Qualifier("slackWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Opens (or reuses) the DM channel with the user and posts the text.
     *
     * @return the message timestamp, Slack's message id
     */
    public String sendDirectMessage(String userId, String text) {
        Map<String, Object> opened = apiCall("conversations.open", Map.of("users", userId));
        String channelId = channelId(opened);

        Map<String, Object> posted = apiCall("chat.postMessage", Map.of("channel", channelId, "text", text));
        Object ts = posted.get("ts");
        if (ts == null) {
            throw new ExternalApiException(SERVICE, "chat.postMessage returned no message ts");
        }
        log.info("Slack DM sent: userId={}, ts={}", userId, ts);
        return String.valueOf(ts);
    }

    private Map<String, Object> apiCall(String method, Map<String, Object> body) {
        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri("/{method}", method)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, method))
                    .bodyToMono(MAP_TYPE)
                    .block();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, method, ex);
        }

        if (response == null || !Boolean.TRUE.equals(response.get("ok"))) {
            Object error = response == null ? "empty_response" : response.getOrDefault("error", "unknown_error");
            throw new ExternalApiException.ClientException(SERVICE, method + " error: " + error, 200);
        }
        return response;
    }

    @SuppressWarnings("unchecked")
    private String channelId(Map<String, Object> opened) {
        Object channel = opened.get("channel");
        if (channel instanceof Map<?, ?> map && map.get("id") != null) {
            return String.valueOf(((Map<String, Object>) map).get("id"));
        }
        throw new ExternalApiException(SERVICE, "conversations.open returned no channel id");
    }
}
