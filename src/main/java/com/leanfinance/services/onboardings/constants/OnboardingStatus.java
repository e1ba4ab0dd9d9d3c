package com.leanfinance.services.onboardings.constants;

/**
 * Lifecycle of an onboarding record.
 *
 * PENDING, WAITING_TECHNICIAN and IN_PROGRESS are picked up again by the next
 * polling cycle. COMPLETED is terminal. FAILED stays until an operator resets it.
 */
public enum OnboardingStatus {
    PENDING,
    WAITING_TECHNICIAN,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isRetryableByCycle() {
        return this == PENDING || this == WAITING_TECHNICIAN || this == IN_PROGRESS;
    }
}
