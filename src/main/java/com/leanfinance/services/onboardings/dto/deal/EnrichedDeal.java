package com.leanfinance.services.onboardings.dto.deal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A won deal with everything the onboarding needs, as produced by DealDetector.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class EnrichedDeal {

    private final String dealId;
    private final String dealName;
    private final String companyName;
    private final String serviceName;
    private final BigDecimal amount;
    private final String hubspotOwnerId;
    private final LocalDateTime closeDate;
    private final CompanyInfo company;
    private final ContactPersonInfo contact;
    @Builder.Default
    private final List<TechnicianInfo> technicians = List.of();
}
