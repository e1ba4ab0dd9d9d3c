package com.leanfinance.services.onboardings.config;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ActuatorSecurityFilterTest {

    private final ActuatorSecurityFilter filter = new ActuatorSecurityFilter();

    @ParameterizedTest
    @CsvSource({
            "/actuator/health, false",
            "/actuator/health/liveness, false",
            "/actuator/scheduledtasks, true",
            "/actuator/env, true",
            "/actuator, true",
            "/api/v1/onboardings, false"
    })
    void isBlocked_onlyHealthIsExposedOnAppPort(String path, boolean blocked) {
        assertThat(filter.isBlocked(path)).isEqualTo(blocked);
    }
}
