package com.crudadmin.backend.modules.auth.infrastructure.crypto;

import java.util.UUID;

import com.crudadmin.backend.modules.auth.application.HashingException;
import com.crudadmin.backend.modules.auth.application.PasswordHasher;
import com.crudadmin.backend.modules.auth.domain.CredentialRules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * {@link PasswordHasher} backed by Spring Security's BCrypt encoder.
 * <p>
 * BCrypt ignores everything past the first 72 UTF-8 bytes, so longer input is refused by {@link #hash}
 * and never verifies.
 */
@Component
public class BCryptPasswordHasher implements PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(BCryptPasswordHasher.class);

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public BCryptPasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = hash(UUID.randomUUID().toString());
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        if (CredentialRules.exceedsByteLimit(plaintext)) {
            throw new IllegalArgumentException(
                    "plaintext exceeds " + CredentialRules.PASSWORD_MAX_BYTES + " bytes when UTF-8 encoded");
        }
        String encoded;
        try {
            encoded = passwordEncoder.encode(plaintext);
        } catch (IllegalArgumentException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new HashingException(ex);
        }
        if (encoded == null) {
            throw new HashingException(null);
        }
        return encoded;
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        if (CredentialRules.exceedsByteLimit(plaintext)) {
            // costs the same as a mismatch
            matchesQuietly("", hash);
            return false;
        }
        return matchesQuietly(plaintext, hash);
    }

    private boolean matchesQuietly(String plaintext, String hash) {
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (RuntimeException ex) {
            log.debug("Password verification failed on an unreadable hash: {}", ex.getClass().getSimpleName());
            return false;
        }
    }

    @Override
    public String dummyHash() {
        return dummyHash;
    }
}
