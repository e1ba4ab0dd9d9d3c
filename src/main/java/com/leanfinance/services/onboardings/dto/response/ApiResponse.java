package com.leanfinance.services.onboardings.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Envelope of every /api/v1/onboardings response. Exactly one of
 * {@code data} and {@code error} is set.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Admin API response envelope")
public class ApiResponse<T> {

    @Schema(description = "False when the request was rejected or failed", example = "true")
    private final boolean success;

    @Schema(description = "Outcome for the operator", example = "Onboarding re-queued")
    private final String message;

    @Schema(description = "Payload: a cycle summary, an onboarding or a list of onboardings")
    private final T data;

    @Schema(description = "Set on failure only")
    private final ErrorDetails error;

    private final LocalDateTime timestamp;

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, message, data, null, LocalDateTime.now());
    }

    public static <T> ApiResponse<T> success(String message) {
        return success(null, message);
    }

    /**
     * @param errorCode stable code from OnboardingServiceException, e.g. POLLING_IN_PROGRESS
     * @param path      request URI that failed
     */
    public static <T> ApiResponse<T> error(String message, String errorCode, String path) {
        return new ApiResponse<>(false, message, null, new ErrorDetails(errorCode, path), LocalDateTime.now());
    }

    @Getter
    @AllArgsConstructor
    @Schema(description = "Machine-readable failure")
    public static class ErrorDetails {

        @Schema(example = "ONBOARDING_NOT_FOUND")
        private final String code;

        @Schema(example = "/api/v1/onboardings/deals/18523649112")
        private final String path;
    }
}
