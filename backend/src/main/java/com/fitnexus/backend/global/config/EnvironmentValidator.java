package com.fitnexus.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when required settings are missing or malformed.
 */
@Component
public class EnvironmentValidator {

    static final String DEV_JWT_SECRET = "dev-fitnexus-jwt-secret-change-me-0123456789abcdef";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
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
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(DEV_JWT_SECRET::equals)
                .ifPresent(secret -> log.warn("jwt.secret is the development default; set JWT_SECRET before deploying"));

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < MIN_EXPIRATION_MILLIS || millis > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration: must be between " + MIN_EXPIRATION_MILLIS + " and "
                            + MAX_EXPIRATION_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration: must be numeric");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }
        log.info("Environment validation passed");
    }
}
