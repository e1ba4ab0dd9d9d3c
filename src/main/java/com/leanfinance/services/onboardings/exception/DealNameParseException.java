package com.leanfinance.services.onboardings.exception;

public class DealNameParseException extends OnboardingServiceException {

    public DealNameParseException(String dealName) {
        super("Deal name does not match 'COMPANY - SERVICE': '" + dealName + "'", "DEAL_NAME_UNPARSEABLE");
    }
}
