package com.leanfinance.services.onboardings.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.leanfinance.services.onboardings.config.GoogleApiConfig;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.dto.directory.ServiceEntry;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the onboarding directory spreadsheet (staff and services).
 *
 * Ranges are cached in memory for {@code google.directory-cache-ttl-seconds};
 * {@link #invalidateCache()} forces a reload on the next read.
 */
@Component
@Slf4j
public class GoogleSheetsClient {

    private static final String SERVICE = "Google Sheets";

    private final WebClient webClient;
    private final GoogleTokenService tokenService;
    private final GoogleApiConfig config;
    private final ApiRetryExecutor retryExecutor;
    private final TtlCache<String, List<List<String>>> cache;

    public GoogleSheetsClient(@Qualifier("sheetsWebClient") WebClient webClient,
                              GoogleTokenService tokenService,
                              GoogleApiConfig config,
                              ApiRetryExecutor retryExecutor,
                              Clock clock) {
        this.webClient = webClient;
        this.tokenService = tokenService;
        this.config = config;
        this.retryExecutor = retryExecutor;
        this.cache = new TtlCache<>(clock, config.getDirectoryCacheTtlSeconds());
    }

    public List<TeamMember> fetchTeamMembers() {
        return SheetRowMapper.toTeamMembers(readNamedRange(OnboardingConstants.RANGE_TEAM_MEMBERS));
    }

    public List<ServiceEntry> fetchServices() {
        return SheetRowMapper.toServices(readNamedRange(OnboardingConstants.RANGE_SERVICES));
    }

    /** Rows of the range as text, header included. */
    public List<List<String>> readNamedRange(String range) {
        return cache.get(range).orElseGet(() -> {
            List<List<String>> rows = retryExecutor.execute(SERVICE + " read[" + range + "]", () -> fetch(range));
            cache.put(range, rows);
            log.info("Directory range loaded: range={}, rows={}", range, rows.size());
            return rows;
        });
    }

    public void invalidateCache() {
        cache.invalidate();
        log.info("Directory cache invalidated");
    }

    private List<List<String>> fetch(String range) {
        try {
            ValueRange response = webClient.get()
                    .uri("/spreadsheets/{id}/values/{range}", config.getSpreadsheetId(), range)
                    .headers(h -> h.setBearerAuth(tokenService.getAccessToken()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Read " + range))
                    .bodyToMono(ValueRange.class)
                    .block();
            return response == null || response.getValues() == null ? List.of() : response.getValues();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Read " + range, ex);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ValueRange {
        private List<List<String>> values = new ArrayList<>();
    }
}
