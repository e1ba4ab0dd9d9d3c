package com.leanfinance.services.onboardings.service;

import com.leanfinance.services.onboardings.client.HubSpotClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.dto.crm.CrmObject;
import com.leanfinance.services.onboardings.dto.deal.CompanyInfo;
import com.leanfinance.services.onboardings.dto.deal.ContactPersonInfo;
import com.leanfinance.services.onboardings.dto.deal.EnrichedDeal;
import com.leanfinance.services.onboardings.dto.deal.TechnicianInfo;
import com.leanfinance.services.onboardings.exception.DealNameParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * ══════════════════════════════════════════════════════════════════
 * Deal Detector
 * ══════════════════════════════════════════════════════════════════
 *
 * Finds won deals in HubSpot that have no onboarding yet and enriches them:
 *
 *   deal → parse "COMPANY - SERVICE" → associated company → first contact
 *        → technician candidates from the contact's *_asignado properties
 *
 * Deals that already have a record are skipped before any enrichment call.
 * Data-quality problems (unparseable name, no company, no contact) skip the
 * deal with a warning. HubSpot faults propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DealDetector {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

    private final HubSpotClient hubSpotClient;
    private final OnboardingStateService stateService;
    private final OnboardingConfig config;
    private final Clock clock;

    // ════════════════════════════════════════════════════════════
    // DETECTION
    // ════════════════════════════════════════════════════════════

    public List<EnrichedDeal> detectNewDeals() {
        return detectNewDeals(clock.instant().minus(Duration.ofDays(config.getLookbackDays())));
    }

    public List<EnrichedDeal> detectNewDeals(Instant since) {
        log.info("Detecting won deals closed since {} (lookbackDays={})", since, config.getLookbackDays());

        List<EnrichedDeal> newDeals = new ArrayList<>();
        try (Stream<CrmObject> deals = hubSpotClient.searchWonDeals(since)) {
            deals.forEach(deal -> {
                if (stateService.existsByDealId(deal.getId())) {
                    log.debug("Deal {} already has an onboarding, skipping", deal.getId());
                    return;
                }
                try {
                    enrich(deal).ifPresent(newDeals::add);
                } catch (RuntimeException ex) {
                    // skip the deal, keep the batch
                    log.error("Deal {} skipped: enrichment failed: {}", deal.getId(), ex.getMessage(), ex);
                }
            });
        }

        log.info("Deal detection done: {} new deal(s)", newDeals.size());
        return newDeals;
    }

    /**
     * Re-reads a known deal from HubSpot and enriches it again.
     * Empty when the name no longer parses or the company/contact chain is broken.
     */
    public Optional<EnrichedDeal> enrichDealById(String dealId) {
        return enrich(hubSpotClient.getDeal(dealId));
    }

    // ════════════════════════════════════════════════════════════
    // ENRICHMENT
    // ════════════════════════════════════════════════════════════

    private Optional<EnrichedDeal> enrich(CrmObject deal) {
        String dealId = deal.getId();
        String dealName = deal.property("dealname");

        DealNameParser.ParsedDealName parsed;
        try {
            parsed = DealNameParser.parse(dealName);
        } catch (DealNameParseException ex) {
            log.warn("Deal {} skipped: unparseable name '{}'", dealId, dealName);
            return Optional.empty();
        }

        Optional<String> companyId = hubSpotClient.getDealCompanyId(dealId);
        if (companyId.isEmpty()) {
            log.warn("Deal {} skipped: no associated company", dealId);
            return Optional.empty();
        }
        CompanyInfo company = toCompanyInfo(hubSpotClient.getCompany(companyId.get()));

        List<String> contactIds = hubSpotClient.getCompanyContactIds(companyId.get());
        if (contactIds.isEmpty()) {
            log.warn("Deal {} skipped: company {} has no contacts", dealId, companyId.get());
            return Optional.empty();
        }
        if (contactIds.size() > 1) {
            log.info("Company {} has {} contacts, using the first ({})",
                    companyId.get(), contactIds.size(), contactIds.get(0));
        }
        CrmObject contact = hubSpotClient.getContact(contactIds.get(0));
        List<TechnicianInfo> technicians = extractTechnicians(contact);

        EnrichedDeal enriched = EnrichedDeal.builder()
                .dealId(dealId)
                .dealName(dealName)
                .companyName(parsed.companyName())
                .serviceName(parsed.serviceName())
                .amount(parseAmount(deal.property("amount")))
                .hubspotOwnerId(deal.property("hubspot_owner_id"))
                .closeDate(parseCloseDate(deal.property("closedate")))
                .company(company)
                .contact(toContactInfo(contact))
                .technicians(technicians)
                .build();

        log.info("New deal {}: company='{}', service='{}', technicians={}, holdedExists={}",
                dealId, parsed.companyName(), parsed.serviceName(),
                technicians.size(), company.getHoldedId() != null);
        return Optional.of(enriched);
    }

    static List<TechnicianInfo> extractTechnicians(CrmObject contact) {
        List<TechnicianInfo> technicians = new ArrayList<>();
        for (String property : OnboardingConstants.TECHNICIAN_PROPERTIES) {
            String value = contact.property(property);
            if (value != null) {
                technicians.add(new TechnicianInfo(value.strip(), property));
            }
        }
        return technicians;
    }

    private static CompanyInfo toCompanyInfo(CrmObject company) {
        String website = company.property("website");
        return CompanyInfo.builder()
                .hubspotId(company.getId())
                .name(company.property("name"))
                .nif(company.property("nif"))
                .email(company.property("generic_email"))
                .phone(company.property("phone"))
                .address(company.property("address"))
                .city(company.property("city"))
                .state(company.property("state"))
                .zip(company.property("zip"))
                .country(company.property("country"))
                .website(website != null ? website : company.property("domain"))
                .domain(company.property("domain"))
                .holdedId(company.property(OnboardingConstants.PROP_HOLDED_ID))
                .syncedWithHolded("true".equalsIgnoreCase(company.property("tl_synced_holded")))
                .driveFolderId(company.property(OnboardingConstants.PROP_DRIVE_FOLDER_ID))
                .driveFolderUrl(company.property(OnboardingConstants.PROP_DRIVE_FOLDER_URL))
                .build();
    }

    private static ContactPersonInfo toContactInfo(CrmObject contact) {
        return ContactPersonInfo.builder()
                .hubspotId(contact.getId())
                .firstName(contact.property("firstname"))
                .lastName(contact.property("lastname"))
                .fullName(contact.property("nombre_y_apellidos"))
                .email(contact.property("email"))
                .phone(contact.property("phone"))
                .mobilePhone(contact.property("mobilephone"))
                .jobTitle(contact.property("cargo_en_empresa"))
                .nif(contact.property("nif"))
                .build();
    }

    // ════════════════════════════════════════════════════════════
    // PARSING
    // ════════════════════════════════════════════════════════════

    /** Epoch millis, then ISO-8601 with or without offset, then now. Never throws. */
    LocalDateTime parseCloseDate(String value) {
        if (value == null || value.isBlank()) {
            return LocalDateTime.now(clock);
        }
        String trimmed = value.strip();
        try {
            if (EPOCH_MILLIS.matcher(trimmed).matches()) {
                return LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(trimmed)), clock.getZone());
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).atZoneSameInstant(clock.getZone()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (NumberFormatException | DateTimeException ex) {
            log.warn("Unparseable closedate '{}', using now", value);
            return LocalDateTime.now(clock);
        }
    }

    static BigDecimal parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
