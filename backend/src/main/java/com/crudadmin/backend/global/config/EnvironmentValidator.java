package com.crudadmin.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks required settings once the context is up and aborts start-up when any is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.jwt.secret",
            "app.jwt.ttl"
    };
    static final Duration MIN_TTL = Duration.ofMinutes(5);
    static final Duration MAX_TTL = Duration.ofHours(24);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            if (!StringUtils.hasText(environment.getProperty(property))) {
                problems.add(property + " is missing");
            }
        }

        String rawTtl = environment.getProperty("app.jwt.ttl");
        if (StringUtils.hasText(rawTtl)) {
            try {
                Duration ttl = DurationStyle.detectAndParse(rawTtl.trim());
                if (ttl.compareTo(MIN_TTL) < 0 || ttl.compareTo(MAX_TTL) > 0) {
                    problems.add("app.jwt.ttl must be between " + MIN_TTL + " and " + MAX_TTL);
                }
            } catch (IllegalArgumentException ex) {
                problems.add("app.jwt.ttl is not a duration");
            }
        }

        if (!problems.isEmpty()) {
            log.error("Environment validation failed: {}", problems);
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }
}
