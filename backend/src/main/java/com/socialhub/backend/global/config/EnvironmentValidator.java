package com.socialhub.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Verifies the required settings once the application is up and refuses to keep running without them.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "dev-jwt-secret-change-me-in-production-please-32b";
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
                "spring.datasource.url",
                "jwt.secret",
                "jwt.expiration",
                "jwt.refresh-expiration",
                "app.cors.allowed-origins"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(var + " is missing");
            }
        }

        Optional<String> secret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (secret.filter(DEFAULT_DEV_SECRET::equals).isPresent()
                && environment.acceptsProfiles(Profiles.of("prod"))) {
            problems.add("jwt.secret still uses the development default");
        }
        secret.filter(value -> !value.isBlank())
                .filter(value -> secretLength(value) < MIN_SECRET_BYTES)
                .ifPresent(value -> problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes"));

        checkMillis("jwt.expiration", 60_000L, 86_400_000L, problems);
        checkMillis("jwt.refresh-expiration", 3_600_000L, 2_592_000_000L, problems);
        return problems;
    }

    private void checkMillis(String key, long min, long max, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                problems.add(key + " must be between " + min + " and " + max + " milliseconds");
            }
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number");
        }
    }

    private int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
