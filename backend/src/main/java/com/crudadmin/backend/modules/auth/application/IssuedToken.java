package com.crudadmin.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;

public record IssuedToken(String token, Instant issuedAt, Instant expiresAt) {

    public long expiresInSeconds() {
        return Duration.between(issuedAt, expiresAt).toSeconds();
    }

    @Override
    public String toString() {
        return "IssuedToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
