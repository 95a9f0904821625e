package com.crudadmin.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Internal classification of authentication and authorization failures.
 * <p>
 * Several kinds share one public code so that clients cannot tell a forged signature from a
 * garbled token, or a deleted account from either of them. The kind itself is only logged.
 */
public enum AuthErrorKind {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Incorrect username or password"),
    MISSING_CREDENTIALS(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Not authenticated"),
    TOKEN_MALFORMED(HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN", "Could not validate credentials"),
    SIGNATURE_INVALID(HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN", "Could not validate credentials"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "ACCESS_TOKEN_EXPIRED", "Access token has expired"),
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN", "Could not validate credentials"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN", "Insufficient privileges");

    private final HttpStatus status;
    private final String publicCode;
    private final String publicDetail;

    AuthErrorKind(HttpStatus status, String publicCode, String publicDetail) {
        this.status = status;
        this.publicCode = publicCode;
        this.publicDetail = publicDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String publicCode() {
        return publicCode;
    }

    public String publicDetail() {
        return publicDetail;
    }
}
