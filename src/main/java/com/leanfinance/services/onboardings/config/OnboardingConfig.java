package com.leanfinance.services.onboardings.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Business settings of the onboarding flow.
 *
 * Bound from application.yml under prefix "onboarding":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  onboarding:                                                    │
 * │    admin-email:            ${ADMIN_EMAIL}                       │
 * │    sender-email:           tech@leanfinance.es                  │
 * │    hubspot-portal-id:      ${HUBSPOT_PORTAL_ID:}                │
 * │    lookback-days:          7                                    │
 * │    drive-parent-folder-id: 0AN-sodeoSVkMUk9PVA                  │
 * │    polling:                                                     │
 * │      morning-cron:   0 0 10 * * *                               │
 * │      afternoon-cron: 0 50 13 * * *                              │
 * │      zone:           Europe/Madrid                              │
 * └─────────────────────────────────────────────────────────────────┘
 */
@Configuration
@ConfigurationProperties(prefix = "onboarding")
@Validated
@Data
public class OnboardingConfig {

    /** Receives the failure summary and critical error emails */
    private String adminEmail;

    /** Mailbox the Gmail API sends from */
    @NotBlank
    @Email
    private String senderEmail = "tech@leanfinance.es";

    /** HubSpot portal id, only used to build deal links. Links are omitted when blank. */
    private String hubspotPortalId;

    /** How far back the detector looks for won deals */
    @Min(1)
    private int lookbackDays = 7;

    /** Shared-drive folder that holds one folder per client */
    @NotBlank
    private String driveParentFolderId = "0AN-sodeoSVkMUk9PVA";

    @Valid
    private Polling polling = new Polling();

    @Data
    public static class Polling {
        private boolean enabled = true;
        @NotBlank
        private String morningCron = "0 0 10 * * *";
        @NotBlank
        private String afternoonCron = "0 50 13 * * *";
        private String zone = "Europe/Madrid";
    }
}
