package com.lendingmarket.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required configuration is missing or insecure.
 */
@Component
public class EnvironmentValidator {

    static final String DEFAULT_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025";
    private static final int MIN_JWT_SECRET_BYTES = 32;
    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (jwtSecret.filter(secret -> secret.getBytes().length < MIN_JWT_SECRET_BYTES).isPresent()) {
            problems.add("jwt.secret must be at least " + MIN_JWT_SECRET_BYTES + " bytes");
        }
        boolean production = Arrays.asList(environment.getActiveProfiles()).contains("prod");
        if (production && jwtSecret.filter(DEFAULT_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still uses the development default");
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < 300_000 || millis > 86_400_000) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be numeric");
            }
        }
        return problems;
    }
}
