package com.leanfinance.services.onboardings.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per third-party API.
 *
 * Every call made by the polling cycle is blocking and sequential, so all
 * clients share the same bounded timeouts:
 * - Connect: 10s
 * - Read:    30s
 * - Write:   30s
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    private final HubSpotApiConfig hubSpotApiConfig;
    private final GoogleApiConfig googleApiConfig;
    private final HoldedApiConfig holdedApiConfig;
    private final SlackApiConfig slackApiConfig;

    @Bean(name = "hubspotWebClient")
    public WebClient hubspotWebClient() {
        return jsonClient("HubSpot", hubSpotApiConfig.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + hubSpotApiConfig.getAccessToken())
                .build();
    }

    @Bean(name = "holdedWebClient")
    public WebClient holdedWebClient() {
        return jsonClient("Holded", holdedApiConfig.getBaseUrl())
                .defaultHeader("key", holdedApiConfig.getApiKey())
                .build();
    }

    @Bean(name = "slackWebClient")
    public WebClient slackWebClient() {
        return jsonClient("Slack", slackApiConfig.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + slackApiConfig.getBotToken())
                .build();
    }

    /** Bearer tokens are added per request from GoogleTokenService. */
    @Bean(name = "driveWebClient")
    public WebClient driveWebClient() {
        return jsonClient("Drive", googleApiConfig.getDriveBaseUrl()).build();
    }

    @Bean(name = "sheetsWebClient")
    public WebClient sheetsWebClient() {
        return jsonClient("Sheets", googleApiConfig.getSheetsBaseUrl()).build();
    }

    @Bean(name = "gmailWebClient")
    public WebClient gmailWebClient() {
        return jsonClient("Gmail", googleApiConfig.getGmailBaseUrl()).build();
    }

    /** Token endpoint takes form posts, so no default content type. */
    @Bean(name = "googleOAuthWebClient")
    public WebClient googleOAuthWebClient() {
        return WebClient.builder()
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient()))
                .filter(logRequest("Google OAuth"))
                .filter(logResponse("Google OAuth"))
                .build();
    }

    private WebClient.Builder jsonClient(String apiName, String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .clientConnector(new ReactorClientHttpConnector(httpClient()))
                .filter(logRequest(apiName))
                .filter(logResponse(apiName));
    }

    private HttpClient httpClient() {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(Duration.ofSeconds(30))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
                );
    }

    private ExchangeFilterFunction logRequest(String apiName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("-> {} Request: {} {}", apiName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String apiName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- {} Response: {}", apiName, clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
