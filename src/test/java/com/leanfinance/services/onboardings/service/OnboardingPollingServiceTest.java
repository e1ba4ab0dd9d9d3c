package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.GmailClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.response.PollingCycleSummary;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OnboardingPollingServiceTest {

    @Mock
    private DealDetector dealDetector;
    @Mock
    private OnboardingManager onboardingManager;
    @Mock
    private OnboardingStateService stateService;
    @Mock
    private GmailClient gmailClient;

    private OnboardingPollingService pollingService;

    @BeforeEach
    void setUp() {
        OnboardingConfig config = new OnboardingConfig();
        config.setAdminEmail("admin@leanfinance.es");
        pollingService = new OnboardingPollingService(dealDetector, onboardingManager, stateService, gmailClient, config);
    }

    @Test
    void run_faultOnOneDealDoesNotStopTheOthers() {
        EnrichedDeal first = deal("1");
        EnrichedDeal second = deal("2");
        when(dealDetector.detectNewDeals()).thenReturn(List.of(first, second));
        when(onboardingManager.processDeal(first)).thenThrow(new IllegalStateException("db down"));
        when(onboardingManager.processDeal(second)).thenReturn(record("2", OnboardingStatus.COMPLETED, null));
        when(stateService.listPending()).thenReturn(List.of());
        when(stateService.listFailed()).thenReturn(List.of());

        PollingCycleSummary summary = pollingService.run();

        verify(onboardingManager).processDeal(second);
        assertThat(summary.getNewDeals()).isEqualTo(2);
        assertThat(summary.getNewDealErrors()).isEqualTo(1);
        verify(gmailClient, never()).sendEmail(anyString(), anyString(), anyString());
    }

    @Test
    void run_reEnrichesPendingRecordsAndSkipsUnenrichable() {
        OnboardingRecord waiting = record("10", OnboardingStatus.WAITING_TECHNICIAN, Department.FI);
        OnboardingRecord gone = record("11", OnboardingStatus.PENDING, null);
        OnboardingRecord broken = record("12", OnboardingStatus.IN_PROGRESS, null);
        EnrichedDeal refreshed = deal("10");

        when(dealDetector.detectNewDeals()).thenReturn(List.of());
        when(stateService.listPending()).thenReturn(List.of(waiting, gone, broken));
        when(dealDetector.enrichDealById("10")).thenReturn(Optional.of(refreshed));
        when(dealDetector.enrichDealById("11")).thenReturn(Optional.empty());
        when(dealDetector.enrichDealById("12")).thenThrow(new ExternalApiException("HubSpot", "503"));
        when(onboardingManager.processDeal(refreshed)).thenReturn(waiting);
        when(stateService.listFailed()).thenReturn(List.of());

        PollingCycleSummary summary = pollingService.run();

        verify(onboardingManager, times(1)).processDeal(refreshed);
        assertThat(summary.getRetried()).isEqualTo(1);
        assertThat(summary.getRetrySkipped()).isEqualTo(2);
    }

    @Test
    void run_failedRecords_sendExactlyOneSummaryEmailListingThem() {
        when(dealDetector.detectNewDeals()).thenReturn(List.of());
        when(stateService.listPending()).thenReturn(List.of());
        when(stateService.listFailed()).thenReturn(List.of(record("99", OnboardingStatus.FAILED, null)));
        when(gmailClient.sendEmail(anyString(), anyString(), anyString())).thenReturn("msg-1");

        PollingCycleSummary summary = pollingService.run();

        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(gmailClient, times(1)).sendEmail(eq("admin@leanfinance.es"), subject.capture(), body.capture());
        assertThat(subject.getValue()).isEqualTo("[LeanFinance Onboardings] 1 onboarding(s) con error");
        assertThat(body.getValue())
                .startsWith("<pre>")
                .contains("Deal 99: ACME SL - Servicio 99 (depto: sin asignar)");
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.isSummaryEmailSent()).isTrue();
    }

    @Test
    void run_summaryEmailFault_isLoggedNotThrown() {
        when(dealDetector.detectNewDeals()).thenReturn(List.of());
        when(stateService.listPending()).thenReturn(List.of());
        when(stateService.listFailed()).thenReturn(List.of(record("99", OnboardingStatus.FAILED, Department.SU)));
        when(gmailClient.sendEmail(anyString(), anyString(), anyString()))
                .thenThrow(new ExternalApiException("Gmail", "quota"));

        PollingCycleSummary summary = pollingService.run();

        assertThat(summary.isSummaryEmailSent()).isFalse();
    }

    @Test
    void failedSummaryHtml_escapesDealNamesAndShowsDepartment() {
        OnboardingRecord record = record("7", OnboardingStatus.FAILED, Department.AS);
        record.setDealName("A&B <SL> - Fiscal");

        String html = OnboardingPollingService.failedSummaryHtml(List.of(record));

        assertThat(html).contains("A&amp;B &lt;SL&gt; - Fiscal").contains("(depto: AS)");
    }

    @Test
    void notifyCriticalError_sendsEscapedTraceToAdmin() {
        when(gmailClient.sendEmail(anyString(), anyString(), anyString())).thenReturn("msg-2");

        pollingService.notifyCriticalError(new IllegalStateException("<bad>"), "at Foo.bar(Foo.java:1)");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(gmailClient).sendEmail(eq("admin@leanfinance.es"),
                eq("[LeanFinance Onboardings] ERROR CRITICO en polling"), body.capture());
        assertThat(body.getValue())
                .contains("IllegalStateException: &lt;bad&gt;")
                .contains("<pre>at Foo.bar(Foo.java:1)</pre>");
    }

    @Test
    void notifyCriticalError_neverThrows() {
        when(gmailClient.sendEmail(anyString(), anyString(), anyString()))
                .thenThrow(new ExternalApiException("Gmail", "down"));

        assertThatCode(() -> pollingService.notifyCriticalError(new RuntimeException("x")))
                .doesNotThrowAnyException();
    }

    private static EnrichedDeal deal(String id) {
        return EnrichedDeal.builder()
                .dealId(id)
                .dealName("ACME SL - Servicio " + id)
                .companyName("ACME SL")
                .serviceName("Servicio " + id)
                .build();
    }

    private static OnboardingRecord record(String dealId, OnboardingStatus status, Department department) {
        return OnboardingRecord.builder()
                .id(Long.valueOf(dealId))
                .dealId(dealId)
                .dealName("ACME SL - Servicio " + dealId)
                .status(status)
                .department(department)
                .build();
    }
}
