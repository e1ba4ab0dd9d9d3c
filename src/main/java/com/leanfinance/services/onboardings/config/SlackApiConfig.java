package com.leanfinance.services.onboardings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "slack")
@Data
public class SlackApiConfig {

    /** Bot token (xoxb-...) with im:write and chat:write scopes */
    private String botToken;

    private String baseUrl = "https://slack.com/api";
}
