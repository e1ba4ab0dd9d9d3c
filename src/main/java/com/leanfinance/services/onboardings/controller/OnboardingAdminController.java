package com.leanfinance.services.onboardings.controller;

import com.leanfinance.services.onboardings.client.GoogleSheetsClient;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.constants.OnboardingStatus;
import com.leanfinance.services.onboardings.dto.response.ApiResponse;
import com.leanfinance.services.onboardings.dto.response.OnboardingResponse;
import com.leanfinance.services.onboardings.dto.response.PollingCycleSummary;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.exception.OnboardingNotFoundException;
import com.leanfinance.services.onboardings.mapper.OnboardingMapper;
import com.leanfinance.services.onboardings.scheduler.OnboardingPollingScheduler;
import com.leanfinance.services.onboardings.service.OnboardingStateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator endpoints: run a cycle on demand, inspect records, re-queue failures.
 */
@RestController
@RequestMapping(OnboardingConstants.API_V1 + "/onboardings")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Onboardings", description = "Inspect and operate client onboardings")
public class OnboardingAdminController {

    private final OnboardingPollingScheduler pollingScheduler;
    private final OnboardingStateService stateService;
    private final GoogleSheetsClient sheetsClient;

    @PostMapping("/polling/run")
    @Operation(summary = "Run a polling cycle now",
            description = "Same cycle as the scheduled one. 409 while another cycle is running.")
    public ResponseEntity<ApiResponse<PollingCycleSummary>> runPolling() {
        log.info("POST /onboardings/polling/run");
        PollingCycleSummary summary = pollingScheduler.runNow();
        return ResponseEntity.ok(ApiResponse.success(summary, "Polling cycle finished"));
    }

    @GetMapping
    @Operation(summary = "List onboardings by status", description = "Oldest first")
    public ResponseEntity<ApiResponse<List<OnboardingResponse>>> listByStatus(
            @Parameter(description = "Onboarding status", example = "FAILED")
            @RequestParam OnboardingStatus status
    ) {
        log.debug("GET /onboardings?status={}", status);
        List<OnboardingResponse> response = stateService.listByStatus(status).stream()
                .map(OnboardingMapper::toOnboardingResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(response, "Onboardings fetched successfully"));
    }

    @GetMapping("/deals/{dealId}")
    @Operation(summary = "Get the onboarding of a deal, with its steps")
    public ResponseEntity<ApiResponse<OnboardingResponse>> getByDealId(
            @Parameter(description = "HubSpot deal id") @PathVariable String dealId
    ) {
        log.debug("GET /onboardings/deals/{}", dealId);
        OnboardingRecord record = stateService.findByDealId(dealId)
                .orElseThrow(() -> OnboardingNotFoundException.withDealId(dealId));
        OnboardingResponse response =
                OnboardingMapper.toOnboardingResponse(record, stateService.findSteps(record.getId()));
        return ResponseEntity.ok(ApiResponse.success(response, "Onboarding fetched successfully"));
    }

    @PostMapping("/deals/{dealId}/retry")
    @Operation(summary = "Re-queue a FAILED onboarding",
            description = "Moves it back to PENDING; the next cycle runs it again. 400 for any other status.")
    public ResponseEntity<ApiResponse<OnboardingResponse>> retry(
            @Parameter(description = "HubSpot deal id") @PathVariable String dealId
    ) {
        log.info("POST /onboardings/deals/{}/retry", dealId);
        OnboardingRecord record = stateService.resetForRetry(dealId);
        return ResponseEntity.ok(ApiResponse.success(
                OnboardingMapper.toOnboardingResponse(record), "Onboarding re-queued"));
    }

    @PostMapping("/directory/refresh")
    @Operation(summary = "Drop the cached spreadsheet directory",
            description = "Next lookup reads staff and services from the sheet again")
    public ResponseEntity<ApiResponse<Void>> refreshDirectory() {
        log.info("POST /onboardings/directory/refresh");
        sheetsClient.invalidateCache();
        return ResponseEntity.ok(ApiResponse.success("Directory cache cleared"));
    }
}
