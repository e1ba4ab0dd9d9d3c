package com.leanfinance.services.onboardings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed config properties for Google Drive, Sheets and Gmail (prefix "google").
 *
 * All three APIs share one OAuth client; access tokens are minted from the
 * refresh token by GoogleTokenService.
 */
@Configuration
@ConfigurationProperties(prefix = "google")
@Data
public class GoogleApiConfig {

    private String clientId;

    private String clientSecret;

    private String refreshToken;

    private String tokenUrl = "https://oauth2.googleapis.com/token";

    private String driveBaseUrl = "https://www.googleapis.com/drive/v3";

    private String sheetsBaseUrl = "https://sheets.googleapis.com/v4";

    private String gmailBaseUrl = "https://gmail.googleapis.com/gmail/v1";

    /** Spreadsheet holding the "usuarios" and "servicios" tabs */
    private String spreadsheetId;

    /** How long directory rows are served from memory */
    private long directoryCacheTtlSeconds = 3600;
}
