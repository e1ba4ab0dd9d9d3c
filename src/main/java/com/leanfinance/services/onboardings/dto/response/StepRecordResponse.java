package com.leanfinance.services.onboardings.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Progress of one onboarding step")
public class StepRecordResponse {

    @Schema(example = "CREATE_DRIVE_FOLDER")
    private String stepName;

    @Schema(example = "COMPLETED")
    private String status;

    @Schema(description = "JSON payload produced by the step")
    private String resultData;

    private String errorMessage;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
