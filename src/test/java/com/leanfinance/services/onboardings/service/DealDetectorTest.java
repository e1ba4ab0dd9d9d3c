package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.HubSpotClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.dto.crm.CrmObject;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.deal.TechnicianInfo;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DealDetectorTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock
    private HubSpotClient hubSpotClient;

    @Mock
    private OnboardingStateService stateService;

    private DealDetector detector;

    @BeforeEach
    void setUp() {
        OnboardingConfig config = new OnboardingConfig();
        detector = new DealDetector(hubSpotClient, stateService, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void detectNewDeals_defaultsToSevenDayLookback() {
        when(hubSpotClient.searchWonDeals(any())).thenReturn(Stream.empty());

        detector.detectNewDeals();

        verify(hubSpotClient).searchWonDeals(NOW.minus(Duration.ofDays(7)));
    }

    @Test
    void detectNewDeals_existingRecord_makesNoEnrichmentCalls() {
        when(hubSpotClient.searchWonDeals(any())).thenReturn(Stream.of(deal("1", "ACME - ENISA")));
        when(stateService.existsByDealId("1")).thenReturn(true);

        List<EnrichedDeal> deals = detector.detectNewDeals(NOW);

        assertThat(deals).isEmpty();
        verify(hubSpotClient, never()).getDealCompanyId(anyString());
        verify(hubSpotClient, never()).getCompany(anyString());
        verify(hubSpotClient, never()).getContact(anyString());
    }

    @Test
    void detectNewDeals_skipsUnparseableNamesAndBrokenChains() {
        when(hubSpotClient.searchWonDeals(any())).thenReturn(Stream.of(
                deal("1", "Sin separador"),
                deal("2", "NoCompany - ENISA"),
                deal("3", "NoContact - ENISA")));
        when(hubSpotClient.getDealCompanyId("2")).thenReturn(Optional.empty());
        when(hubSpotClient.getDealCompanyId("3")).thenReturn(Optional.of("C3"));
        when(hubSpotClient.getCompany("C3")).thenReturn(crm("C3", Map.of("name", "NoContact SL")));
        when(hubSpotClient.getCompanyContactIds("C3")).thenReturn(List.of());

        assertThat(detector.detectNewDeals(NOW)).isEmpty();
        verify(hubSpotClient, never()).getDealCompanyId("1");
    }

    @Test
    void detectNewDeals_collaboratorFaultOnOneDeal_skipsItAndKeepsTheRest() {
        when(hubSpotClient.searchWonDeals(any())).thenReturn(Stream.of(
                deal("1", "Deleted SL - ENISA"),
                deal("2", "ACME SL - ENISA")));
        when(hubSpotClient.getDealCompanyId("1")).thenReturn(Optional.of("C1"));
        when(hubSpotClient.getCompany("C1"))
                .thenThrow(new ExternalApiException.ClientException("HubSpot", "company 404", 404));
        when(hubSpotClient.getDealCompanyId("2")).thenReturn(Optional.of("C2"));
        when(hubSpotClient.getCompany("C2")).thenReturn(crm("C2", Map.of("name", "ACME SL")));
        when(hubSpotClient.getCompanyContactIds("C2")).thenReturn(List.of("P2"));
        when(hubSpotClient.getContact("P2")).thenReturn(crm("P2", Map.of("firstname", "Laura")));

        List<EnrichedDeal> deals = detector.detectNewDeals(NOW);

        assertThat(deals).extracting(EnrichedDeal::getDealId).containsExactly("2");
    }

    @Test
    void detectNewDeals_searchFault_propagates() {
        when(hubSpotClient.searchWonDeals(any()))
                .thenThrow(ExternalApiException.serviceUnavailable("HubSpot"));

        assertThatThrownBy(() -> detector.detectNewDeals(NOW)).isInstanceOf(ExternalApiException.class);
    }

    @Test
    void detectNewDeals_enrichesDealWithCompanyContactAndTechnicians() {
        CrmObject deal = deal("42", "ACME SL - CFO Externo");
        deal.getProperties().put("amount", "1500.50");
        deal.getProperties().put("hubspot_owner_id", "777");
        deal.getProperties().put("closedate", String.valueOf(NOW.toEpochMilli()));

        when(hubSpotClient.searchWonDeals(any())).thenReturn(Stream.of(deal));
        when(hubSpotClient.getDealCompanyId("42")).thenReturn(Optional.of("C1"));
        when(hubSpotClient.getCompany("C1")).thenReturn(crm("C1", Map.of(
                "name", "ACME SL",
                "generic_email", "info@acme.es",
                "domain", "acme.es",
                "tl_holded_id", "H-9",
                "drive_folder_id", "F-1")));
        when(hubSpotClient.getCompanyContactIds("C1")).thenReturn(List.of("P1", "P2"));
        when(hubSpotClient.getContact("P1")).thenReturn(crm("P1", Map.of(
                "firstname", "Laura",
                "lastname", "Ruiz",
                "email", "laura@acme.es",
                "cfo_asignado_ii", "902",
                "tecnico_enisa_asignado", "901")));

        List<EnrichedDeal> deals = detector.detectNewDeals(NOW);

        assertThat(deals).hasSize(1);
        EnrichedDeal enriched = deals.get(0);
        assertThat(enriched.getCompanyName()).isEqualTo("ACME SL");
        assertThat(enriched.getServiceName()).isEqualTo("CFO Externo");
        assertThat(enriched.getAmount()).isEqualByComparingTo(new BigDecimal("1500.50"));
        assertThat(enriched.getHubspotOwnerId()).isEqualTo("777");
        assertThat(enriched.getCloseDate()).isEqualTo(LocalDateTime.of(2025, 3, 10, 9, 0));
        assertThat(enriched.getCompany().getWebsite()).isEqualTo("acme.es");
        assertThat(enriched.getCompany().getHoldedId()).isEqualTo("H-9");
        assertThat(enriched.getCompany().getDriveFolderId()).isEqualTo("F-1");
        assertThat(enriched.getContact().displayName()).isEqualTo("Laura Ruiz");
        // property-list order, not insertion order
        assertThat(enriched.getTechnicians()).containsExactly(
                new TechnicianInfo("901", "tecnico_enisa_asignado"),
                new TechnicianInfo("902", "cfo_asignado_ii"));
        verify(hubSpotClient, never()).getContact("P2");
    }

    @Test
    void enrichDealById_returnsEmptyWhenNameNoLongerParses() {
        when(hubSpotClient.getDeal("5")).thenReturn(deal("5", "renamed"));

        assertThat(detector.enrichDealById("5")).isEmpty();
    }

    @Test
    void parseCloseDate_acceptsEpochIsoAndFallsBackToNow() {
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

        assertThat(detector.parseCloseDate("1741597200000")).isEqualTo(LocalDateTime.of(2025, 3, 10, 9, 0));
        assertThat(detector.parseCloseDate("2025-03-01T12:30:00Z")).isEqualTo(LocalDateTime.of(2025, 3, 1, 12, 30));
        assertThat(detector.parseCloseDate("2025-03-01T12:30:00.000+01:00"))
                .isEqualTo(LocalDateTime.of(2025, 3, 1, 11, 30));
        assertThat(detector.parseCloseDate("2025-03-01T12:30:00")).isEqualTo(LocalDateTime.of(2025, 3, 1, 12, 30));
        assertThat(detector.parseCloseDate("not a date")).isEqualTo(now);
        assertThat(detector.parseCloseDate(null)).isEqualTo(now);
    }

    @Test
    void parseAmount_blankOrInvalid_isNull() {
        assertThat(DealDetector.parseAmount("")).isNull();
        assertThat(DealDetector.parseAmount("mil euros")).isNull();
        assertThat(DealDetector.parseAmount("2000")).isEqualByComparingTo("2000");
    }

    private static CrmObject deal(String id, String name) {
        Map<String, String> properties = new HashMap<>();
        properties.put("dealname", name);
        return new CrmObject(id, properties);
    }

    private static CrmObject crm(String id, Map<String, String> properties) {
        return new CrmObject(id, new HashMap<>(properties));
    }
}
