package com.leanfinance.services.onboardings.exception;

/**
 * Thrown when a polling cycle is requested while another one is running
 */
public class PollingInProgressException extends OnboardingServiceException {

    public PollingInProgressException() {
        super("A polling cycle is already running", "POLLING_IN_PROGRESS");
    }
}
