package com.crudadmin.backend.modules.auth.application;

import java.time.Instant;

public record TokenClaims(String subject, Instant issuedAt, Instant expiresAt) {
}
