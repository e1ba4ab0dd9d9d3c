package com.leanfinance.services.onboardings.mapper;

import com.leanfinance.services.onboardings.dto.response.OnboardingResponse;
import com.leanfinance.services.onboardings.dto.response.StepRecordResponse;
import com.leanfinance.services.onboardings.entity.OnboardingRecord;
import com.leanfinance.services.onboardings.entity.StepRecord;
import com.leanfinance.services.onboardings.entity.TechnicianAssignment;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapper utility for converting onboarding entities to admin API DTOs
 */
@UtilityClass
public class OnboardingMapper {

    /**
     * Map OnboardingRecord entity to OnboardingResponse DTO, without steps
     */
    public OnboardingResponse toOnboardingResponse(OnboardingRecord entity) {
        if (entity == null) return null;

        return OnboardingResponse.builder()
                .id(entity.getId())
                .dealId(entity.getDealId())
                .dealName(entity.getDealName())
                .companyName(entity.getCompanyName())
                .serviceName(entity.getServiceName())
                .department(entity.getDepartment() != null ? entity.getDepartment().name() : null)
                .status(entity.getStatus() != null ? entity.getStatus().name() : null)
                .currentStep(entity.getCurrentStep() != null ? entity.getCurrentStep().name() : null)
                .lastError(entity.getLastError())
                .technicianIds(entity.getTechnicians().stream()
                        .map(TechnicianAssignment::getHubspotTecId)
                        .collect(Collectors.toList()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public OnboardingResponse toOnboardingResponse(OnboardingRecord entity, List<StepRecord> steps) {
        OnboardingResponse response = toOnboardingResponse(entity);
        if (response != null) {
            response.setSteps(steps.stream()
                    .map(OnboardingMapper::toStepRecordResponse)
                    .collect(Collectors.toList()));
        }
        return response;
    }

    public StepRecordResponse toStepRecordResponse(StepRecord entity) {
        if (entity == null) return null;

        return StepRecordResponse.builder()
                .stepName(entity.getStepName().name())
                .status(entity.getStatus().name())
                .resultData(entity.getResultData())
                .errorMessage(entity.getErrorMessage())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
