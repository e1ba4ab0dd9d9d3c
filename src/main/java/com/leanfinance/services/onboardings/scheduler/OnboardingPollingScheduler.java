package com.leanfinance.services.onboardings.scheduler;

import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.dto.response.PollingCycleSummary;
import com.leanfinance.services.onboardings.exception.PollingInProgressException;
import com.leanfinance.services.onboardings.service.OnboardingPollingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * ══════════════════════════════════════════════════════════════════
 * Onboarding Polling Scheduler
 * ══════════════════════════════════════════════════════════════════
 *
 * SCHEDULE (Europe/Madrid by default)
 * ─────────
 *   Morning cycle:    10:00 daily
 *   Afternoon cycle:  13:50 daily
 *
 * Manual runs from the admin API share the same lock: a trigger that finds a
 * cycle in flight is skipped (scheduled) or rejected with 409 (manual).
 * Any exception escaping the cycle is emailed to the admin.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OnboardingPollingScheduler {

    private final OnboardingPollingService pollingService;
    private final OnboardingConfig config;

    private final ReentrantLock cycleLock = new ReentrantLock();

    @Scheduled(cron = "${onboarding.polling.morning-cron:0 0 10 * * *}",
            zone = "${onboarding.polling.zone:Europe/Madrid}")
    public void runMorningCycle() {
        runScheduled("morning");
    }

    @Scheduled(cron = "${onboarding.polling.afternoon-cron:0 50 13 * * *}",
            zone = "${onboarding.polling.zone:Europe/Madrid}")
    public void runAfternoonCycle() {
        runScheduled("afternoon");
    }

    /**
     * Runs a cycle now, on the caller's thread.
     *
     * @throws PollingInProgressException another cycle holds the lock
     */
    public PollingCycleSummary runNow() {
        if (!cycleLock.tryLock()) {
            throw new PollingInProgressException();
        }
        try {
            log.info("Manual polling cycle requested");
            return runReportingErrors();
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    private void runScheduled(String trigger) {
        if (!config.getPolling().isEnabled()) {
            log.debug("Polling disabled, skipping {} cycle", trigger);
            return;
        }
        if (!cycleLock.tryLock()) {
            log.warn("Skipping {} cycle: previous cycle still running", trigger);
            return;
        }
        try {
            log.info("Scheduled {} polling cycle", trigger);
            runReportingErrors();
        } catch (RuntimeException ex) {
            // already reported to the admin
            log.error("{} polling cycle aborted: {}", trigger, ex.getMessage());
        } finally {
            cycleLock.unlock();
        }
    }

    private PollingCycleSummary runReportingErrors() {
        try {
            return pollingService.run();
        } catch (RuntimeException ex) {
            log.error("Polling cycle failed with an unhandled exception: {}", ex.getMessage(), ex);
            pollingService.notifyCriticalError(ex);
            throw ex;
        }
    }
}
