package com.leanfinance.services.onboardings.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Typed config properties for the HubSpot CRM API (prefix "hubspot").
 * The token comes from HUBSPOT_TOKEN, see IntegrationConfigValidator.
 */
@Configuration
@ConfigurationProperties(prefix = "hubspot")
@Validated
@Data
public class HubSpotApiConfig {

    /** Private app access token */
    private String accessToken;

    private String baseUrl = "https://api.hubapi.com";

    /** Sales pipeline watched for won deals */
    @NotBlank
    private String pipelineId = "20024183";

    /** "Closed won" stage of that pipeline */
    @NotBlank
    private String wonStageId = "48577422";

    /** HubSpot caps search pages at 100 */
    @Min(1)
    @Max(100)
    private int pageSize = 100;
}
