package com.crudadmin.backend.global.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header value.
 */
public final class BearerTokenExtractor {

    private static final String BEARER = "bearer";

    private BearerTokenExtractor() {
    }

    /**
     * @return the token, or empty if the header is absent, uses another scheme, or carries no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)
                || !Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
