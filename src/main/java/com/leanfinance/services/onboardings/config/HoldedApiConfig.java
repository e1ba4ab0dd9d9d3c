package com.leanfinance.services.onboardings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "holded")
@Data
public class HoldedApiConfig {

    /** Sent as the "key" header */
    private String apiKey;

    private String baseUrl = "https://api.holded.com/api/invoicing/v1";
}
