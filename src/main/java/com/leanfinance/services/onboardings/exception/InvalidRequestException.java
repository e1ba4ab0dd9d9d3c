package com.leanfinance.services.onboardings.exception;

/**
 * Thrown for invalid business logic requests
 */
public class InvalidRequestException extends OnboardingServiceException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public static InvalidRequestException notRetryable(String dealId, String status) {
        return new InvalidRequestException(
                "Onboarding for deal " + dealId + " is " + status + "; only FAILED onboardings can be retried");
    }
}
