package com.crudadmin.backend.modules.user.application;

import com.crudadmin.backend.modules.auth.application.AuthErrorKind;
import com.crudadmin.backend.modules.auth.application.AuthException;
import com.crudadmin.backend.modules.auth.application.CredentialStore;
import com.crudadmin.backend.modules.auth.application.PasswordHasher;
import com.crudadmin.backend.modules.auth.application.UsernameTakenException;
import com.crudadmin.backend.modules.auth.domain.CredentialRules;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Self-service account operations of the public API.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;

    public UserAccountService(CredentialStore credentialStore, PasswordHasher passwordHasher) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
    }

    /**
     * Creates a non-admin account. Admin rights are only granted through the admin service.
     *
     * @throws UsernameTakenException if the username is already registered
     */
    public UserAccount register(String username, String password) {
        String normalized = CredentialRules.normalizeUsername(username);
        CredentialRules.checkPassword(password);
        if (credentialStore.findByUsername(normalized).isPresent()) {
            throw new UsernameTakenException();
        }
        UserAccount created = credentialStore.create(new NewUser(normalized, passwordHasher.hash(password), false));
        log.info("Registered user id={}", created.id());
        return created;
    }

    /**
     * @throws AuthException {@link AuthErrorKind#INVALID_CREDENTIALS} when the current password does not match,
     *                       {@link AuthErrorKind#USER_NOT_FOUND} when the account is gone
     */
    public void changePassword(long userId, String currentPassword, String newPassword) {
        UserAccount user = credentialStore.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND));
        if (!passwordHasher.verify(currentPassword, user.passwordHash())) {
            log.info("Password change rejected for user id={}", userId);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }
        CredentialRules.checkPassword(newPassword);
        if (!credentialStore.updatePasswordHash(userId, passwordHasher.hash(newPassword))) {
            throw new AuthException(AuthErrorKind.USER_NOT_FOUND);
        }
        log.info("Password changed for user id={}", userId);
    }
}
