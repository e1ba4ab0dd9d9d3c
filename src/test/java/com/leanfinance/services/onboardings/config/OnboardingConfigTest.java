package com.leanfinance.services.onboardings.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OnboardingConfigTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaults_areValid() {
        assertThat(validator.validate(new OnboardingConfig())).isEmpty();
        assertThat(validator.validate(new HubSpotApiConfig())).isEmpty();
    }

    @Test
    void lookbackAndSender_areChecked() {
        OnboardingConfig config = new OnboardingConfig();
        config.setLookbackDays(0);
        config.setSenderEmail("not-an-email");
        config.getPolling().setMorningCron(" ");

        Set<ConstraintViolation<OnboardingConfig>> violations = validator.validate(config);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("lookbackDays", "senderEmail", "polling.morningCron");
    }

    @Test
    void hubSpotPageSize_isCappedAtSearchLimit() {
        HubSpotApiConfig config = new HubSpotApiConfig();
        config.setPageSize(500);

        assertThat(validator.validate(config)).hasSize(1);
    }
}
