package com.tasklane.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.tasklane.backend.global.error.ConfigurationFailureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates the configuration the authentication core cannot run without. Runs while the
 * context is being built (the signing key and password hasher depend on this bean), so a
 * missing or out-of-range value stops the process before any request is accepted.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    public static final String JWT_SECRET = "jwt.secret";
    public static final String JWT_EXPIRATION = "jwt.expiration";
    public static final String BCRYPT_STRENGTH = "security.password.bcrypt-strength";

    static final long MIN_TOKEN_TTL_MILLIS = 5L * 60 * 1000;
    static final long MAX_TOKEN_TTL_MILLIS = 7L * 24 * 60 * 60 * 1000;
    static final int MIN_BCRYPT_STRENGTH = 10;
    static final int MAX_BCRYPT_STRENGTH = 31;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            JWT_SECRET,
            JWT_EXPIRATION,
            BCRYPT_STRENGTH,
            "app.cors.allowed-origins"
    };

    public EnvironmentValidator(Environment environment) {
        validate(environment);
    }

    static void validate(Environment environment) {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key)).map(String::trim);
            if (value.isEmpty() || value.get().isEmpty()) {
                missing.add(key);
            }
        }

        checkRange(environment, JWT_EXPIRATION, MIN_TOKEN_TTL_MILLIS, MAX_TOKEN_TTL_MILLIS, invalid);
        checkRange(environment, BCRYPT_STRENGTH, MIN_BCRYPT_STRENGTH, MAX_BCRYPT_STRENGTH, invalid);

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            StringBuilder message = new StringBuilder("Configuration validation failed.");
            if (!missing.isEmpty()) {
                message.append(" Missing: ").append(String.join(", ", missing)).append('.');
            }
            if (!invalid.isEmpty()) {
                message.append(" Invalid: ").append(String.join("; ", invalid)).append('.');
            }
            log.error(message.toString());
            throw new ConfigurationFailureException(message.toString());
        }

        log.info("Configuration validated (token TTL {} ms, bcrypt strength {})",
                environment.getProperty(JWT_EXPIRATION), environment.getProperty(BCRYPT_STRENGTH));
    }

    private static void checkRange(Environment environment, String key, long min, long max, List<String> invalid) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                invalid.add(key + ": must be between " + min + " and " + max);
            }
        } catch (NumberFormatException ex) {
            invalid.add(key + ": must be a whole number");
        }
    }
}
