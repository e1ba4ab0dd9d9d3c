package com.leanfinance.services.onboardings.exception;

/**
 * Thrown when a deal's service name has no entry in the services sheet
 */
public class ServiceNotFoundException extends OnboardingServiceException {

    public ServiceNotFoundException(String serviceName) {
        super("Service not found in directory: '" + serviceName + "'", "SERVICE_NOT_FOUND");
    }
}
