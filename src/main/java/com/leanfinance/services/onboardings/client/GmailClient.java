package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Properties;

/**
 * Sends HTML emails through the Gmail API as the configured sender mailbox.
 */
@Component
@Slf4j
public class GmailClient {

    private static final String SERVICE = "Gmail";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final GoogleTokenService tokenService;
    private final OnboardingConfig onboardingConfig;

    public GmailClient(@Qualifier("gmailWebClient") WebClient webClient,
                       GoogleTokenService tokenService,
                       OnboardingConfig onboardingConfig) {
        this.webClient = webClient;
        this.tokenService = tokenService;
        this.onboardingConfig = onboardingConfig;
    }

    /** @return the Gmail message id */
    public String sendEmail(String to, String subject, String html) {
        String raw = encode(buildMessage(to, subject, html));
        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri("/users/me/messages/send")
                    .headers(h -> h.setBearerAuth(tokenService.getAccessToken()))
                    .bodyValue(Map.of("raw", raw))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Send"))
                    .bodyToMono(MAP_TYPE)
                    .block();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Send", ex);
        }

        Object id = response == null ? null : response.get("id");
        if (id == null) {
            throw new ExternalApiException(SERVICE, "Send returned no message id");
        }
        log.info("Email sent: to={}, subject='{}', messageId={}", to, subject, id);
        return String.valueOf(id);
    }

    MimeMessage buildMessage(String to, String subject, String html) {
        try {
            MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
            message.setFrom(new InternetAddress(onboardingConfig.getSenderEmail()));
            message.setRecipients(jakarta.mail.Message.RecipientType.TO, InternetAddress.parse(to));
            message.setSubject(subject, StandardCharsets.UTF_8.name());
            message.setContent(html, "text/html; charset=UTF-8");
            message.saveChanges();
            return message;
        } catch (MessagingException ex) {
            throw new ExternalApiException(SERVICE, "Invalid email for " + to + ": " + ex.getMessage(), ex);
        }
    }

    static String encode(MimeMessage message) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            return Base64.getUrlEncoder().encodeToString(out.toByteArray());
        } catch (IOException | MessagingException ex) {
            throw new ExternalApiException(SERVICE, "Could not encode email: " + ex.getMessage(), ex);
        }
    }
}
