package com.crudadmin.backend.modules.auth.domain;

import java.nio.charset.StandardCharsets;

import com.crudadmin.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Length rules for usernames and passwords accepted at account creation and password change.
 */
public final class CredentialRules {

    public static final int USERNAME_MIN = 3;
    public static final int USERNAME_MAX = 100;
    public static final int PASSWORD_MIN = 8;
    public static final int PASSWORD_MAX = 30;
    /** BCrypt reads no further than this many UTF-8 bytes. */
    public static final int PASSWORD_MAX_BYTES = 72;

    private CredentialRules() {
    }

    /**
     * @return the trimmed username
     * @throws ProblemException 422 when the trimmed value is outside the allowed length
     */
    public static String normalizeUsername(String username) {
        String trimmed = username == null ? "" : username.strip();
        if (trimmed.length() < USERNAME_MIN || trimmed.length() > USERNAME_MAX) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "username: must be between " + USERNAME_MIN + " and " + USERNAME_MAX + " characters");
        }
        return trimmed;
    }

    public static void checkPassword(String password) {
        if (password == null || password.isBlank()
                || password.length() < PASSWORD_MIN || password.length() > PASSWORD_MAX) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "password: must be between " + PASSWORD_MIN + " and " + PASSWORD_MAX + " characters");
        }
        if (exceedsByteLimit(password)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "password: must not exceed " + PASSWORD_MAX_BYTES + " bytes when UTF-8 encoded");
        }
    }

    public static boolean exceedsByteLimit(String password) {
        return password.getBytes(StandardCharsets.UTF_8).length > PASSWORD_MAX_BYTES;
    }
}
