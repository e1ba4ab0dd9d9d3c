package com.leanfinance.services.onboardings.pipeline;

import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.dto.deal.CompanyInfo;
import com.leanfinance.services.onboardings.dto.deal.ContactPersonInfo;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.directory.TeamMember;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * Data shared by the steps of one pipeline run.
 *
 * Built once per run and owned by it. Steps fill in the ids they create
 * (drive folder, Holded contact) so later steps can link to them.
 */
@Getter
@Setter
@Builder
public class StepContext {

    private final String dealId;
    private final String dealName;
    private final String companyName;
    private final String serviceName;
    private final String hubspotOwnerId;

    private final CompanyInfo company;
    private final ContactPersonInfo contact;

    private final Department department;
    private final TeamMember technician;

    private final String hubspotPortalId;

    private String driveFolderId;
    private String driveFolderUrl;
    private String driveSubfolderId;
    private String holdedContactId;
    private String holdedContactUrl;

    public static StepContext from(EnrichedDeal deal, Department department,
                                   TeamMember technician, String hubspotPortalId) {
        CompanyInfo company = deal.getCompany();
        return StepContext.builder()
                .dealId(deal.getDealId())
                .dealName(deal.getDealName())
                .companyName(deal.getCompanyName())
                .serviceName(deal.getServiceName())
                .hubspotOwnerId(deal.getHubspotOwnerId())
                .company(company)
                .contact(deal.getContact())
                .department(department)
                .technician(technician)
                .hubspotPortalId(hubspotPortalId)
                // keep the Holded id of a client onboarded before
                .holdedContactId(company != null ? company.getHoldedId() : null)
                .build();
    }

    /** Deal link in HubSpot, or null when the portal id is not configured. */
    public String hubspotDealUrl() {
        if (hubspotPortalId == null || hubspotPortalId.isBlank() || dealId == null) {
            return null;
        }
        return String.format(OnboardingConstants.HUBSPOT_DEAL_URL, hubspotPortalId, dealId);
    }
}
