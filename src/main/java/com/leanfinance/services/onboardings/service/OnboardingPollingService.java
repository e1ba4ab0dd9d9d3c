package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.GmailClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.response.PollingCycleSummary;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;

/**
 * One polling cycle:
 *
 *   (a) detect new won deals and process each one
 *   (b) re-enrich and process PENDING / WAITING_TECHNICIAN / IN_PROGRESS records
 *   (c) email the admin a summary when FAILED records exist
 *
 * Every deal is isolated: a fault on one is logged and the cycle moves on.
 * Faults outside the per-deal loops (HubSpot search, database) propagate to
 * the caller, which reports them through {@link #notifyCriticalError}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnboardingPollingService {

    private final DealDetector dealDetector;
    private final OnboardingManager onboardingManager;
    private final OnboardingStateService stateService;
    private final GmailClient gmailClient;
    private final OnboardingConfig config;

    public PollingCycleSummary run() {
        log.info("=== Polling cycle START ===");
        PollingCycleSummary summary = new PollingCycleSummary();

        processNewDeals(summary);
        retryPendingOnboardings(summary);
        notifyFailedSummary(summary);

        log.info("=== Polling cycle DONE: newDeals={}, newDealErrors={}, retried={}, retrySkipped={}, failed={} ===",
                summary.getNewDeals(), summary.getNewDealErrors(), summary.getRetried(),
                summary.getRetrySkipped(), summary.getFailed());
        return summary;
    }

    // ════════════════════════════════════════════════════════════
    // (a) NEW DEALS
    // ════════════════════════════════════════════════════════════

    private void processNewDeals(PollingCycleSummary summary) {
        List<EnrichedDeal> newDeals = dealDetector.detectNewDeals();
        summary.setNewDeals(newDeals.size());

        for (EnrichedDeal deal : newDeals) {
            if (!safeProcess(deal, "new_deal")) {
                summary.setNewDealErrors(summary.getNewDealErrors() + 1);
            }
        }
    }

    // ════════════════════════════════════════════════════════════
    // (b) PENDING RETRIES
    // ════════════════════════════════════════════════════════════

    private void retryPendingOnboardings(PollingCycleSummary summary) {
        List<OnboardingRecord> pending = stateService.listPending();
        if (pending.isEmpty()) {
            return;
        }
        log.info("Retrying {} pending onboarding(s)", pending.size());

        for (OnboardingRecord record : pending) {
            Optional<EnrichedDeal> enriched;
            try {
                enriched = dealDetector.enrichDealById(record.getDealId());
            } catch (RuntimeException ex) {
                log.error("Re-enrichment failed for onboarding {} (dealId={}): {}",
                        record.getId(), record.getDealId(), ex.getMessage());
                summary.setRetrySkipped(summary.getRetrySkipped() + 1);
                continue;
            }

            if (enriched.isEmpty()) {
                log.warn("Onboarding {} (dealId={}) can no longer be enriched, skipping",
                        record.getId(), record.getDealId());
                summary.setRetrySkipped(summary.getRetrySkipped() + 1);
                continue;
            }

            if (safeProcess(enriched.get(), "retry")) {
                summary.setRetried(summary.getRetried() + 1);
            } else {
                summary.setRetrySkipped(summary.getRetrySkipped() + 1);
            }
        }
    }

    private boolean safeProcess(EnrichedDeal deal, String context) {
        try {
            OnboardingRecord result = onboardingManager.processDeal(deal);
            log.info("Deal {} processed ({}) → {}", deal.getDealId(), context, result.getStatus());
            return true;
        } catch (RuntimeException ex) {
            log.error("Error processing deal {} ({}): {}", deal.getDealId(), context, ex.getMessage(), ex);
            return false;
        }
    }

    // ════════════════════════════════════════════════════════════
    // (c) ADMIN NOTIFICATIONS
    // ════════════════════════════════════════════════════════════

    private void notifyFailedSummary(PollingCycleSummary summary) {
        List<OnboardingRecord> failed = stateService.listFailed();
        summary.setFailed(failed.size());
        if (failed.isEmpty()) {
            return;
        }
        log.warn("{} onboarding(s) in FAILED state", failed.size());

        String subject = String.format("%s %d onboarding(s) con error",
                OnboardingConstants.SUBJECT_PREFIX, failed.size());
        try {
            gmailClient.sendEmail(config.getAdminEmail(), subject, failedSummaryHtml(failed));
            summary.setSummaryEmailSent(true);
            log.info("Admin notified about {} failed onboarding(s)", failed.size());
        } catch (RuntimeException ex) {
            log.error("Failed to send the failure summary email: {}", ex.getMessage());
        }
    }

    static String failedSummaryHtml(List<OnboardingRecord> failed) {
        StringBuilder body = new StringBuilder()
                .append("Se encontraron ").append(failed.size()).append(" onboarding(s) con errores:\n");
        for (OnboardingRecord r : failed) {
            body.append("\n  • Deal ").append(r.getDealId()).append(": ").append(r.getDealName())
                    .append(" (depto: ").append(r.getDepartment() != null ? r.getDepartment().name() : "sin asignar")
                    .append(")");
        }
        return "<pre>" + HtmlUtils.htmlEscape(body.toString()) + "</pre>";
    }

    /**
     * Best-effort email to the admin about a fault that escaped the cycle.
     * Never throws.
     */
    public void notifyCriticalError(Throwable error, String trace) {
        String subject = OnboardingConstants.SUBJECT_PREFIX + " ERROR CRITICO en polling";
        String body = "<h2>El job de polling ha fallado con una excepción no controlada.</h2>"
                + "<p><strong>Error:</strong> "
                + HtmlUtils.htmlEscape(error.getClass().getSimpleName() + ": " + error.getMessage())
                + "</p>"
                + "<pre>" + HtmlUtils.htmlEscape(trace != null ? trace : "Sin traceback") + "</pre>";
        try {
            gmailClient.sendEmail(config.getAdminEmail(), subject, body);
            log.info("Admin notified about critical polling error");
        } catch (RuntimeException ex) {
            log.error("CRITICAL: admin notification failed: {}", ex.getMessage());
        }
    }

    public void notifyCriticalError(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        notifyCriticalError(error, trace.toString());
    }
}
