package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.config.HubSpotApiConfig;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.dto.crm.CrmAssociationResponse;
import com.leanfinance.services.onboardings.dto.crm.CrmObject;
import com.leanfinance.services.onboardings.dto.crm.CrmSearchResponse;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * HTTP client for the HubSpot CRM v3/v4 API.
 *
 * Resilience strategy (outermost → innermost):
 *   RateLimiter → CircuitBreaker → ApiRetryExecutor → actual HTTP call
 *
 *   1. RateLimiter:    keeps us under the private-app burst limit (YAML)
 *   2. CircuitBreaker: opens after 50% failures; stays open 60s
 *   3. Retry:          3 attempts, exponential backoff, Retry-After on 429
 *
 * 4xx other than 429 are never retried.
 */
@Component
@Slf4j
public class HubSpotClient {

    private static final String SERVICE = "HubSpot";
    private static final String CB_NAME = "hubspot";

    private final WebClient webClient;
    private final HubSpotApiConfig config;
    private final ApiRetryExecutor retryExecutor;

    public HubSpotClient(@Qualifier("hubspotWebClient") WebClient webClient,
                         HubSpotApiConfig config,
                         ApiRetryExecutor retryExecutor) {
        this.webClient = webClient;
        this.config = config;
        this.retryExecutor = retryExecutor;
    }

    // ======================================================
    // DEAL SEARCH
    // ======================================================

    /**
     * Won deals of the configured pipeline closed at or after {@code since}.
     * Pages are fetched lazily as the stream is consumed, following the
     * {@code paging.next.after} cursor until it is absent.
     */
    public Stream<CrmObject> searchWonDeals(Instant since) {
        Iterator<CrmObject> pages = new SearchPageIterator(since);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false);
    }

    /** One page of the won-deal search. {@code after} is null for the first page. */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackSearchPage")
    @RateLimiter(name = CB_NAME)
    public CrmSearchResponse searchWonDealsPage(Instant since, String after) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filterGroups", List.of(Map.of("filters", List.of(
                filter("pipeline", "EQ", config.getPipelineId()),
                filter("dealstage", "EQ", config.getWonStageId()),
                filter("closedate", "GTE", String.valueOf(since.toEpochMilli()))
        ))));
        body.put("properties", OnboardingConstants.DEAL_PROPERTIES);
        body.put("limit", config.getPageSize());
        if (after != null) {
            body.put("after", after);
        }

        CrmSearchResponse page = call("searchDeals[after=" + after + "]", () -> webClient.post()
                .uri("/crm/v3/objects/deals/search")
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Deal search"))
                .bodyToMono(CrmSearchResponse.class)
                .block());
        return page != null ? page : new CrmSearchResponse();
    }

    // ======================================================
    // OBJECT READS
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackObject")
    @RateLimiter(name = CB_NAME)
    public CrmObject getDeal(String dealId) {
        return getObject("deals", dealId, OnboardingConstants.DEAL_PROPERTIES);
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackObject")
    @RateLimiter(name = CB_NAME)
    public CrmObject getCompany(String companyId) {
        return getObject("companies", companyId, OnboardingConstants.COMPANY_PROPERTIES);
    }

    /** Contact with its personal data and the technician assignment properties. */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackObject")
    @RateLimiter(name = CB_NAME)
    public CrmObject getContact(String contactId) {
        List<String> properties = new ArrayList<>(OnboardingConstants.CONTACT_BASE_PROPERTIES);
        properties.addAll(OnboardingConstants.TECHNICIAN_PROPERTIES);
        return getObject("contacts", contactId, properties);
    }

    // ======================================================
    // ASSOCIATIONS
    // ======================================================

    /** First company associated with the deal. */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackOptional")
    @RateLimiter(name = CB_NAME)
    public Optional<String> getDealCompanyId(String dealId) {
        List<String> ids = getAssociations("deals", dealId, "companies");
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    /** Contacts of the company, in the order HubSpot returns them. */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackList")
    @RateLimiter(name = CB_NAME)
    public List<String> getCompanyContactIds(String companyId) {
        return getAssociations("companies", companyId, "contacts");
    }

    // ======================================================
    // WRITE-BACK
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackUpdate")
    @RateLimiter(name = CB_NAME)
    public void updateCompany(String companyId, Map<String, String> properties) {
        log.info("Updating HubSpot company: companyId={}, properties={}", companyId, properties.keySet());
        call("updateCompany[" + companyId + "]", () -> webClient.patch()
                .uri("/crm/v3/objects/companies/{id}", companyId)
                .bodyValue(Map.of("properties", properties))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Company update"))
                .toBodilessEntity()
                .block());
    }

    // ======================================================
    // FALLBACKS
    // ======================================================

    private CrmSearchResponse fallbackSearchPage(Instant since, String after, Throwable ex) {
        throw handleFallback(ex);
    }

    private CrmObject fallbackObject(String id, Throwable ex) {
        throw handleFallback(ex);
    }

    private Optional<String> fallbackOptional(String id, Throwable ex) {
        throw handleFallback(ex);
    }

    private List<String> fallbackList(String id, Throwable ex) {
        throw handleFallback(ex);
    }

    private void fallbackUpdate(String id, Map<String, String> properties, Throwable ex) {
        throw handleFallback(ex);
    }

    private RuntimeException handleFallback(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN — HubSpot is unreachable. Calls blocked until it recovers.");
            return ExternalApiException.serviceUnavailable(SERVICE);
        }
        if (ex instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ExternalApiException(SERVICE, ex.getMessage(), ex);
    }

    // ======================================================
    // PRIVATE HELPERS
    // ======================================================

    private CrmObject getObject(String type, String id, List<String> properties) {
        log.debug("Fetching HubSpot {}: id={}", type, id);
        CrmObject object = call("get " + type + "[" + id + "]", () -> webClient.get()
                .uri(uri -> uri
                        .path("/crm/v3/objects/{type}/{id}")
                        .queryParam("properties", String.join(",", properties))
                        .build(type, id))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Fetch " + type + " " + id))
                .bodyToMono(CrmObject.class)
                .block());
        if (object == null) {
            throw new ExternalApiException(SERVICE, "Empty response fetching " + type + " " + id);
        }
        return object;
    }

    private List<String> getAssociations(String fromType, String id, String toType) {
        CrmAssociationResponse response = call(fromType + "[" + id + "] → " + toType, () -> webClient.get()
                .uri("/crm/v4/objects/{from}/{id}/associations/{to}", fromType, id, toType)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Associations " + fromType + " " + id))
                .bodyToMono(CrmAssociationResponse.class)
                .block());
        return response == null ? List.of() : response.targetIds();
    }

    private <T> T call(String operation, Supplier<T> request) {
        return retryExecutor.execute(SERVICE + " " + operation, () -> {
            try {
                return request.get();
            } catch (WebClientException ex) {
                throw ApiErrors.map(SERVICE, operation, ex);
            }
        });
    }

    private static Map<String, String> filter(String property, String operator, String value) {
        return Map.of("propertyName", property, "operator", operator, "value", value);
    }

    /**
     * Buffers one search page at a time. The next page is only requested once
     * the current one has been fully consumed.
     */
    private final class SearchPageIterator implements Iterator<CrmObject> {

        private final Instant since;
        private final Deque<CrmObject> buffer = new ArrayDeque<>();
        private String cursor;
        private boolean lastPageFetched;

        private SearchPageIterator(Instant since) {
            this.since = since;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !lastPageFetched) {
                CrmSearchResponse page = searchWonDealsPage(since, cursor);
                if (page.getResults() != null) {
                    buffer.addAll(page.getResults());
                }
                cursor = page.nextCursor();
                lastPageFetched = cursor == null;
            }
            return !buffer.isEmpty();
        }

        @Override
        public CrmObject next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }
    }
}
