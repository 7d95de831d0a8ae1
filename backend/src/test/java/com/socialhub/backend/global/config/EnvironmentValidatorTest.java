package com.socialhub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/socialhub")
                .withProperty("jwt.secret", "test-secret-key-for-socialhub-unit-tests-0123456789")
                .withProperty("jwt.expiration", "3600000")
                .withProperty("jwt.refresh-expiration", "259200000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000");
    }

    @Test
    void acceptsCompleteConfiguration() {
        assertThat(new EnvironmentValidator(environment).validate()).isEmpty();
    }

    @Test
    void reportsMissingAndShortSecret() {
        environment.setProperty("jwt.secret", "short");
        environment.setProperty("app.cors.allowed-origins", " ");

        assertThat(new EnvironmentValidator(environment).validate())
                .contains("app.cors.allowed-origins is missing")
                .anyMatch(problem -> problem.startsWith("jwt.secret must be at least"));
    }

    @Test
    void rejectsOutOfRangeLifetimes() {
        environment.setProperty("jwt.expiration", "1000");
        environment.setProperty("jwt.refresh-expiration", "three-days");

        assertThat(new EnvironmentValidator(environment).validate())
                .anyMatch(problem -> problem.startsWith("jwt.expiration must be between"))
                .contains("jwt.refresh-expiration must be a number");
    }

    @Test
    void rejectsDevelopmentSecretInProduction() {
        environment.setProperty("jwt.secret", EnvironmentValidator.DEFAULT_DEV_SECRET);
        environment.setActiveProfiles("prod");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }
}
