package com.leanfinance.services.onboardings.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.constants.StepStatus;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.entity.StepRecord;
import com.leanfinance.services.onboardings.service.OnboardingStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ══════════════════════════════════════════════════════════════════
 * Pipeline Engine
 * ══════════════════════════════════════════════════════════════════
 *
 * Runs the steps of one onboarding in order and persists every transition:
 *
 *   record → IN_PROGRESS
 *   per step: StepRecord IN_PROGRESS, current_step pointer, run,
 *             StepRecord COMPLETED / SKIPPED / FAILED
 *   record → COMPLETED if no step failed, else FAILED
 *
 * A failed step never stops the ones after it. On the next cycle the whole
 * pipeline runs again and steps that already succeeded skip themselves via
 * checkAlreadyDone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineEngine {

    static final String UNHANDLED_PREFIX = "Unhandled exception: ";

    private final OnboardingStateService stateService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OnboardingRecord run(OnboardingRecord record, StepContext ctx, List<PipelineStep> steps) {
        if (record == null || !record.isPersisted()) {
            throw new IllegalArgumentException("Pipeline needs a persisted onboarding record");
        }
        Long onboardingId = record.getId();

        stateService.markInProgress(onboardingId);
        log.info("=== Pipeline START: onboarding={}, dealId={}, steps={} ===",
                onboardingId, record.getDealId(), steps.size());

        List<StepName> failedSteps = new ArrayList<>();

        for (PipelineStep step : steps) {
            StepName stepName = step.name();
            LocalDateTime startedAt = LocalDateTime.now(clock);

            stateService.upsertStep(StepRecord.builder()
                    .onboardingId(onboardingId)
                    .stepName(stepName)
                    .status(StepStatus.IN_PROGRESS)
                    .startedAt(startedAt)
                    .build());
            stateService.moveToStep(onboardingId, stepName);

            StepRecord terminal = StepRecord.builder()
                    .onboardingId(onboardingId)
                    .stepName(stepName)
                    .startedAt(startedAt)
                    .build();

            try {
                StepResult result = step.run(ctx);

                if (result.isSkipped()) {
                    terminal.setStatus(StepStatus.SKIPPED);
                    terminal.setResultData(toJson(result.getData()));
                    log.info("Onboarding {} — step {} SKIPPED (already done)", onboardingId, stepName);
                } else if (result.isSuccess()) {
                    terminal.setStatus(StepStatus.COMPLETED);
                    terminal.setResultData(toJson(result.getData()));
                    log.info("Onboarding {} — step {} COMPLETED", onboardingId, stepName);
                } else {
                    terminal.setStatus(StepStatus.FAILED);
                    terminal.setErrorMessage(result.getError());
                    failedSteps.add(stepName);
                    log.warn("Onboarding {} — step {} FAILED: {}", onboardingId, stepName, result.getError());
                }
            } catch (Exception ex) {
                terminal.setStatus(StepStatus.FAILED);
                terminal.setErrorMessage(UNHANDLED_PREFIX + ex.getMessage());
                failedSteps.add(stepName);
                log.error("Onboarding {} — step {} threw: {}", onboardingId, stepName, ex.getMessage(), ex);
            }

            terminal.setCompletedAt(LocalDateTime.now(clock));
            stateService.upsertStep(terminal);
        }

        OnboardingRecord finished = stateService.finishPipeline(onboardingId, !failedSteps.isEmpty());
        log.info("=== Pipeline DONE: onboarding={}, status={}, failedSteps={} ===",
                onboardingId, finished.getStatus(), failedSteps);
        return finished;
    }

    private String toJson(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException ex) {
            log.warn("Step payload is not serializable, storing its text form: {}", ex.getMessage());
            return String.valueOf(data);
        }
    }
}
