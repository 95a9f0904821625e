package com.crudadmin.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import com.crudadmin.backend.modules.auth.domain.UserAccount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Login (credentials to token) and identity resolution (token to current user).
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final JwtTokenCodec tokenCodec;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            JwtTokenCodec tokenCodec,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.tokenCodec = tokenCodec;
        this.clock = clock;
    }

    public IssuedToken login(String username, String password) {
        return login(username, password, clock.instant());
    }

    /**
     * Exactly one hash verification runs whether or not the account exists, so an unknown username
     * and a wrong password fail the same way and take the same time.
     */
    public IssuedToken login(String username, String password, Instant now) {
        Optional<UserAccount> candidate = username == null
                ? Optional.empty()
                : credentialStore.findByUsername(username);

        String hash = candidate.map(UserAccount::passwordHash).orElseGet(passwordHasher::dummyHash);
        boolean matches = passwordHasher.verify(password, hash);

        if (candidate.isEmpty() || !matches) {
            log.info("Login rejected: invalid credentials");
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }

        UserAccount user = candidate.get();
        IssuedToken token = tokenCodec.issue(user.username(), now);
        log.info("Login succeeded for user id={}", user.id());
        return token;
    }

    public UserAccount resolve(String token) {
        return resolve(token, clock.instant());
    }

    /**
     * @throws AuthException token errors unchanged, or {@link AuthErrorKind#USER_NOT_FOUND} when the
     *                       account was deleted after the token was issued
     */
    public UserAccount resolve(String token, Instant now) {
        TokenClaims claims = tokenCodec.verify(token, now);
        return credentialStore.findByUsername(claims.subject())
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND));
    }
}
