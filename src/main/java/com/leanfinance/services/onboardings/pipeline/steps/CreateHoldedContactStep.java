package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.HoldedClient;
import com.leanfinance.services.onboardings.client.HubSpotClient;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.dto.deal.CompanyInfo;
import com.leanfinance.services.onboardings.dto.deal.ContactPersonInfo;
import com.leanfinance.services.onboardings.pipeline.PipelineStep;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import com.leanfinance.services.onboardings.pipeline.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Billing contact in Holded for the client company. The Holded id is written
 * back to the company (tl_holded_id), which is what marks the step done.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreateHoldedContactStep extends PipelineStep {

    static final String DEFAULT_COUNTRY_CODE = "ES";

    private static final Map<String, String> COUNTRY_CODES = Map.ofEntries(
            Map.entry("spain", "ES"),
            Map.entry("españa", "ES"),
            Map.entry("portugal", "PT"),
            Map.entry("france", "FR"),
            Map.entry("francia", "FR"),
            Map.entry("germany", "DE"),
            Map.entry("alemania", "DE"),
            Map.entry("italy", "IT"),
            Map.entry("italia", "IT"),
            Map.entry("united kingdom", "GB"),
            Map.entry("uk", "GB"),
            Map.entry("united states", "US"),
            Map.entry("usa", "US"));

    private final HoldedClient holdedClient;
    private final HubSpotClient hubSpotClient;

    @Override
    public StepName name() {
        return StepName.CREATE_HOLDED_CONTACT;
    }

    @Override
    public boolean checkAlreadyDone(StepContext ctx) {
        CompanyInfo company = ctx.getCompany();
        if (company == null || company.getHoldedId() == null) {
            return false;
        }
        ctx.setHoldedContactId(company.getHoldedId());
        ctx.setHoldedContactUrl(HoldedClient.contactUrl(company.getHoldedId()));
        return true;
    }

    @Override
    public StepResult execute(StepContext ctx) {
        CompanyInfo company = ctx.getCompany();
        if (company == null) {
            return StepResult.failure("No company data to create the Holded contact");
        }

        String contactId = holdedClient.createContact(buildPayload(ctx));
        ctx.setHoldedContactId(contactId);
        ctx.setHoldedContactUrl(HoldedClient.contactUrl(contactId));

        hubSpotClient.updateCompany(company.getHubspotId(), Map.of(OnboardingConstants.PROP_HOLDED_ID, contactId));
        log.info("Holded contact linked to company: dealId={}, holdedId={}, companyId={}",
                ctx.getDealId(), contactId, company.getHubspotId());

        return StepResult.success(payload(ctx));
    }

    @Override
    protected StepResult skippedResult(StepContext ctx) {
        return StepResult.skipped(payload(ctx));
    }

    Map<String, Object> buildPayload(StepContext ctx) {
        CompanyInfo company = ctx.getCompany();
        ContactPersonInfo contact = ctx.getContact();

        String email = company.getEmail();
        if (email == null && contact != null) {
            email = contact.getEmail();
        }

        Map<String, Object> billAddress = new LinkedHashMap<>();
        billAddress.put("address", orEmpty(company.getAddress()));
        billAddress.put("city", orEmpty(company.getCity()));
        billAddress.put("postalCode", orEmpty(company.getZip()));
        billAddress.put("province", orEmpty(company.getState()));
        billAddress.put("country", orEmpty(company.getCountry()));
        billAddress.put("countryCode", countryCode(company.getCountry()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", company.getName() != null ? company.getName() : ctx.getCompanyName());
        payload.put("type", "client");
        payload.put("code", orEmpty(company.getNif()));
        payload.put("email", orEmpty(email));
        payload.put("phone", orEmpty(company.getPhone()));
        payload.put("billAddress", billAddress);

        String website = company.getWebsite() != null ? company.getWebsite() : company.getDomain();
        if (website != null) {
            payload.put("socialNetworks", Map.of("website", website));
        }

        if (contact != null) {
            Map<String, Object> person = new LinkedHashMap<>();
            person.put("name", contact.displayName());
            person.put("email", orEmpty(contact.getEmail()));
            person.put("phone", orEmpty(contact.anyPhone()));
            if (contact.getJobTitle() != null) {
                person.put("cargo", contact.getJobTitle());
            }
            payload.put("contactPersons", List.of(person));
        }
        return payload;
    }

    /** ISO code for a free-text country, Spain when blank or unknown. */
    static String countryCode(String country) {
        if (country == null || country.isBlank()) {
            return DEFAULT_COUNTRY_CODE;
        }
        return COUNTRY_CODES.getOrDefault(country.trim().toLowerCase(Locale.ROOT), DEFAULT_COUNTRY_CODE);
    }

    private Map<String, Object> payload(StepContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(OnboardingConstants.DATA_HOLDED_CONTACT_ID, ctx.getHoldedContactId());
        data.put(OnboardingConstants.DATA_HOLDED_CONTACT_URL, ctx.getHoldedContactUrl());
        return data;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
