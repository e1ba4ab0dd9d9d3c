package com.leanfinance.services.onboardings.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Onboarding of one won deal")
public class OnboardingResponse {

    @Schema(example = "12")
    private Long id;

    @Schema(description = "HubSpot deal id", example = "15482736511")
    private String dealId;

    @Schema(example = "ACME SL - CFO")
    private String dealName;

    @Schema(example = "ACME SL")
    private String companyName;

    @Schema(example = "CFO")
    private String serviceName;

    @Schema(description = "Department code", example = "FI")
    private String department;

    @Schema(example = "COMPLETED")
    private String status;

    @Schema(description = "Step running right now, if any")
    private String currentStep;

    @Schema(description = "Why the onboarding could not start")
    private String lastError;

    @Schema(description = "HubSpot user ids of the assigned technicians")
    private List<String> technicianIds;

    @Schema(description = "Per-step progress, only on detail lookups")
    private List<StepRecordResponse> steps;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
