package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.constants.OnboardingConstants;
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
 * Holded invoicing API client. Only contact creation is needed.
 */
@Component
@Slf4j
public class HoldedClient {

    private static final String SERVICE = "Holded";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    public HoldedClient(@Qualifier("holdedWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Creates a contact and returns its Holded id.
     * Not retried: a timed-out create may have succeeded and would duplicate the contact.
     */
    public String createContact(Map<String, Object> payload) {
        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri("/contacts")
                    .bodyValue(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Contact creation"))
                    .bodyToMono(MAP_TYPE)
                    .block();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Contact creation", ex);
        }

        Object id = response == null ? null : response.get("id");
        if (id == null || String.valueOf(id).isBlank()) {
            throw new ExternalApiException(SERVICE, "Contact creation returned no id: " + response);
        }
        log.info("Holded contact created: contactId={}, name={}", id, payload.get("name"));
        return String.valueOf(id);
    }

    public static String contactUrl(String contactId) {
        return String.format(OnboardingConstants.HOLDED_CONTACT_URL, contactId);
    }
}
