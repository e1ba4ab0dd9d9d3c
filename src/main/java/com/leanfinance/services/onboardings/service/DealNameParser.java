package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.exception.DealNameParseException;

/**
 * Splits "COMPANY - SERVICE" deal names.
 *
 * Separators are tried from most to least specific. The split is on the first
 * occurrence only, so "EMPRESA - ENISA - NEXT" gives ("EMPRESA", "ENISA - NEXT").
 */
public final class DealNameParser {

    private DealNameParser() {
    }

    public record ParsedDealName(String companyName, String serviceName) {
    }

    public static ParsedDealName parse(String dealName) {
        if (dealName != null) {
            for (String separator : OnboardingConstants.DEAL_NAME_SEPARATORS) {
                int index = dealName.indexOf(separator);
                if (index < 0) continue;

                String company = dealName.substring(0, index).strip();
                String service = dealName.substring(index + separator.length()).strip();
                if (!company.isEmpty() && !service.isEmpty()) {
                    return new ParsedDealName(company, service);
                }
            }
        }
        throw new DealNameParseException(dealName);
    }
}
