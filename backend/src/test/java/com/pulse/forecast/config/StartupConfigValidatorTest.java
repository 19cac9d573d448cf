package com.pulse.forecast.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartupConfigValidatorTest {

    private ForecastProperties properties;
    private StartupConfigValidator validator;

    @BeforeEach
    void setUp() {
        properties = new ForecastProperties();
        validator = new StartupConfigValidator(properties);
        ReflectionTestUtils.setField(validator, "dbUrl", "jdbc:postgresql://localhost:5432/pulse_forecast");
        ReflectionTestUtils.setField(validator, "dbUser", "pulse");
        ReflectionTestUtils.setField(validator, "dbPassword", "secret");
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate()).isEmpty();
    }

    @Test
    void missingPasswordIsReported() {
        ReflectionTestUtils.setField(validator, "dbPassword", "");

        assertThat(validator.validate()).singleElement().asString().contains("SPRING_DATASOURCE_URL");
    }

    @Test
    void unknownZoneAndInvertedHoursAreReported() {
        properties.setMarketZone("Mars/Olympus");
        properties.setMarketOpenHour(16);
        properties.setMarketCloseHour(10);

        assertThat(validator.validate())
                .containsExactly("unknown market zone Mars/Olympus", "market open hour must precede close hour");
    }

    @Test
    void strongThresholdBelowPlainThresholdFailsStartup() {
        properties.getActions().setStrongConfidence(0.5);

        assertThatThrownBy(() -> validator.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("strong action thresholds");
    }
}
