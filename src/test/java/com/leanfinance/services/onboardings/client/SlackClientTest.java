package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.exception.ExternalApiException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlackClientTest {

    private final Deque<String> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();

    private final SlackClient client = new SlackClient(WebClient.builder()
            .baseUrl("https://slack.test/api")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(responses.poll())
                        .build());
            })
            .build());

    @Test
    void sendDirectMessage_opensChannelThenPosts() {
        responses.add("{\"ok\":true,\"channel\":{\"id\":\"D123\"}}");
        responses.add("{\"ok\":true,\"ts\":\"1710000000.000100\"}");

        String ts = client.sendDirectMessage("U1", "Hola");

        assertThat(ts).isEqualTo("1710000000.000100");
        assertThat(requests).extracting(r -> r.url().getPath())
                .containsExactly("/api/conversations.open", "/api/chat.postMessage");
    }

    @Test
    void sendDirectMessage_postWithoutTs_fails() {
        responses.add("{\"ok\":true,\"channel\":{\"id\":\"D123\"}}");
        responses.add("{\"ok\":true}");

        assertThatThrownBy(() -> client.sendDirectMessage("U1", "Hola"))
                .isInstanceOf(ExternalApiException.class)
                .hasMessageContaining("no message ts");
    }

    @Test
    void sendDirectMessage_okFalse_isClientError() {
        responses.add("{\"ok\":false,\"error\":\"user_not_found\"}");

        assertThatThrownBy(() -> client.sendDirectMessage("U404", "Hola"))
                .isInstanceOf(ExternalApiException.ClientException.class)
                .hasMessageContaining("user_not_found");
        assertThat(requests).hasSize(1);
    }
}
