package com.leanfinance.services.onboardings.scheduler;

import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.dto.response.PollingCycleSummary;
import com.leanfinance.services.onboardings.exception.PollingInProgressException;
import com.leanfinance.services.onboardings.service.OnboardingPollingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OnboardingPollingSchedulerTest {

    @Mock
    private OnboardingPollingService pollingService;

    private OnboardingConfig config;
    private OnboardingPollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new OnboardingConfig();
        scheduler = new OnboardingPollingScheduler(pollingService, config);
    }

    @Test
    void runMorningCycle_disabled_doesNothing() {
        config.getPolling().setEnabled(false);

        scheduler.runMorningCycle();

        verifyNoInteractions(pollingService);
    }

    @Test
    void runAfternoonCycle_failure_notifiesAdminAndReleasesLock() {
        RuntimeException boom = new IllegalStateException("HubSpot down");
        when(pollingService.run()).thenThrow(boom);

        scheduler.runAfternoonCycle();

        verify(pollingService).notifyCriticalError(boom);
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void runNow_returnsSummary() {
        PollingCycleSummary summary = PollingCycleSummary.builder().newDeals(2).build();
        when(pollingService.run()).thenReturn(summary);

        assertThat(scheduler.runNow()).isSameAs(summary);
    }

    @Test
    void runNow_failure_isReportedAndRethrown() {
        RuntimeException boom = new IllegalStateException("DB gone");
        when(pollingService.run()).thenThrow(boom);

        assertThatThrownBy(() -> scheduler.runNow()).isSameAs(boom);
        verify(pollingService).notifyCriticalError(boom);
    }

    @Test
    void runNow_whileCycleRunning_isRejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(pollingService.run()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new PollingCycleSummary();
        });

        CompletableFuture<PollingCycleSummary> running = CompletableFuture.supplyAsync(scheduler::runNow);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> scheduler.runNow()).isInstanceOf(PollingInProgressException.class);

        release.countDown();
        running.get(5, TimeUnit.SECONDS);
        assertThat(scheduler.isRunning()).isFalse();
    }
}
