package com.leanfinance.services.onboardings.exception;

import lombok.Getter;

/**
 * Base exception for all onboardings service exceptions
 */
@Getter
public class OnboardingServiceException extends RuntimeException {

    private final String errorCode;

    public OnboardingServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public OnboardingServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
