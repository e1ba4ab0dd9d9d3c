package com.leanfinance.services.onboardings;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Client Onboardings Service
 *
 * This service handles:
 * - Detection of won deals in HubSpot (twice a day)
 * - Department and technician resolution from the onboardings spreadsheet
 * - The onboarding pipeline: Drive folder, Holded contact, Slack DM, email
 * - Admin notifications for failed onboardings
 *
 * @author LeanFinance Tech
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Onboardings Service API",
                version = "1.0.0",
                description = "Client onboarding automation for won HubSpot deals.",
                contact = @Contact(
                        name = "LeanFinance Tech",
                        email = "tech@leanfinance.es"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8080", description = "Local Development")
        }
)
public class OnboardingsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnboardingsServiceApplication.class, args);
    }
}
