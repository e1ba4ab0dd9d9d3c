package com.leanfinance.services.onboardings.exception;

/**
 * Thrown when a service exists in the directory but has no department
 */
public class DepartmentNotAssignedException extends OnboardingServiceException {

    public DepartmentNotAssignedException(String serviceName) {
        super("Service '" + serviceName + "' has no department assigned", "DEPARTMENT_NOT_ASSIGNED");
    }
}
