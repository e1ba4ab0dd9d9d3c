package com.leanfinance.services.onboardings.exception;

/**
 * Thrown when no onboarding record exists for a lookup
 */
public class OnboardingNotFoundException extends OnboardingServiceException {

    public OnboardingNotFoundException(String message) {
        super(message, "ONBOARDING_NOT_FOUND");
    }

    public static OnboardingNotFoundException withId(Long id) {
        return new OnboardingNotFoundException("Onboarding not found with ID: " + id);
    }

    public static OnboardingNotFoundException withDealId(String dealId) {
        return new OnboardingNotFoundException("Onboarding not found for deal: " + dealId);
    }
}
