package com.teamstash.backend.global.config;

import java.nio.charset.StandardCharsets;
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
 * Verifies required settings once the context is up and refuses to keep running without them.
 */
@Component
public class EnvironmentValidator {

    static final String PLACEHOLDER_SECRET = "change-me-teamstash-dev-secret-0000000000";
    private static final int MIN_SECRET_BYTES = 32;

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.trim().isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        Optional<String> secret = Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(value -> !value.isBlank());
        if (secret.filter(PLACEHOLDER_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the placeholder with a random value");
        }
        if (secret.filter(value -> value.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES).isPresent()) {
            problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }
}
