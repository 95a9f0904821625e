package com.crudadmin.backend.modules.auth.application;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;

import javax.crypto.SecretKey;

import com.crudadmin.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.UnsupportedJwtException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256-signed access tokens ({@code header.claims.signature}).
 * <p>
 * Verification needs nothing but the shared key, so the public API and the admin service validate
 * tokens independently. There is no revocation: a token stays valid until {@code exp}, and changing
 * the secret invalidates every outstanding token at once.
 */
@Service
public class JwtTokenCodec {

    private static final Base64.Encoder SEGMENT_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder SEGMENT_DECODER = Base64.getUrlDecoder();
    private static final ObjectMapper SEGMENT_MAPPER = new ObjectMapper();

    private final SecretKey key;
    private final Duration ttl;

    public JwtTokenCodec(JwtSigningKeyProvider keyProvider, @Value("${app.jwt.ttl:30m}") Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.toSeconds() < 1) {
            throw new IllegalStateException("app.jwt.ttl must be at least one second");
        }
        this.key = keyProvider.getSecretKey();
        this.ttl = Duration.ofSeconds(ttl.toSeconds());
    }

    public IssuedToken issue(String subject, Instant now) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        // JWT timestamps carry whole seconds only
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        String token = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key, SIG.HS256)
                .compact();
        return new IssuedToken(token, issuedAt, expiresAt);
    }

    /**
     * @throws AuthException with {@link AuthErrorKind#TOKEN_MALFORMED}, {@link AuthErrorKind#SIGNATURE_INVALID}
     *                       or {@link AuthErrorKind#TOKEN_EXPIRED}
     */
    public TokenClaims verify(String token, Instant now) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED);
        }
        String[] segments = token.split("\\.", -1);
        // a '.' inside the signature splits it in two behind an intact header and payload
        if (segments.length == 4 && isJsonObjectSegment(segments[0]) && isJsonObjectSegment(segments[1])) {
            throw new AuthException(AuthErrorKind.SIGNATURE_INVALID);
        }
        if (segments.length != 3 || segments[0].isEmpty() || segments[1].isEmpty()) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED);
        }
        // non-canonical encodings would let a flipped padding bit decode to the same signature bytes
        if (!isCanonicalSegment(segments[2])) {
            throw new AuthException(AuthErrorKind.SIGNATURE_INVALID);
        }

        String subject;
        Date issuedAt;
        Date expiration;
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            subject = claims.getSubject();
            issuedAt = claims.getIssuedAt();
            expiration = claims.getExpiration();
        } catch (ExpiredJwtException ex) {
            throw new AuthException(AuthErrorKind.TOKEN_EXPIRED, ex);
        } catch (io.jsonwebtoken.security.SecurityException | UnsupportedJwtException ex) {
            throw new AuthException(AuthErrorKind.SIGNATURE_INVALID, ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED, ex);
        }

        if (subject == null || subject.isBlank() || issuedAt == null || expiration == null
                || !expiration.after(issuedAt)) {
            throw new AuthException(AuthErrorKind.TOKEN_MALFORMED);
        }

        Instant expiresAt = expiration.toInstant();
        if (!now.isBefore(expiresAt)) {
            throw new AuthException(AuthErrorKind.TOKEN_EXPIRED);
        }
        return new TokenClaims(subject, issuedAt.toInstant(), expiresAt);
    }

    public Duration getTtl() {
        return ttl;
    }

    private static boolean isJsonObjectSegment(String segment) {
        if (!isCanonicalSegment(segment)) {
            return false;
        }
        try {
            return SEGMENT_MAPPER.readTree(SEGMENT_DECODER.decode(segment)).isObject();
        } catch (IOException ex) {
            return false;
        }
    }

    private static boolean isCanonicalSegment(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        try {
            byte[] decoded = SEGMENT_DECODER.decode(segment);
            return SEGMENT_ENCODER.encodeToString(decoded).equals(segment);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
