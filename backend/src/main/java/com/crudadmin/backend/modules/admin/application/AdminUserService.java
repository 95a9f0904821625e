package com.crudadmin.backend.modules.admin.application;

import com.crudadmin.backend.global.error.ProblemException;
import com.crudadmin.backend.modules.auth.application.CredentialStore;
import com.crudadmin.backend.modules.auth.application.PasswordHasher;
import com.crudadmin.backend.modules.auth.domain.CredentialRules;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.domain.UserPage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * User management behind the admin gate. The acting admin's id is passed in for the self-protection rules.
 */
@Service
public class AdminUserService {

    private static final Logger log = LoggerFactory.getLogger(AdminUserService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;

    public AdminUserService(CredentialStore credentialStore, PasswordHasher passwordHasher) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
    }

    public UserPage listUsers(int page, int size) {
        if (page < 0) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR", "page: must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "size: must be between 1 and " + MAX_PAGE_SIZE);
        }
        return credentialStore.findPage(page, size);
    }

    public UserAccount getUser(long id) {
        return credentialStore.findById(id).orElseThrow(AdminUserService::userNotFound);
    }

    public UserAccount createUser(String username, String password, boolean admin, long actorId) {
        String normalized = CredentialRules.normalizeUsername(username);
        CredentialRules.checkPassword(password);
        UserAccount created = credentialStore.create(new NewUser(normalized, passwordHasher.hash(password), admin));
        log.info("Admin id={} created user id={} admin={}", actorId, created.id(), admin);
        return created;
    }

    public void updateRole(long targetId, boolean admin, long actorId) {
        if (targetId == actorId && !admin) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.self_demotion", "Admins cannot revoke their own admin flag");
        }
        if (!credentialStore.updateRole(targetId, admin)) {
            throw userNotFound();
        }
        log.info("Admin id={} set admin={} on user id={}", actorId, admin, targetId);
    }

    public void deleteUser(long targetId, long actorId) {
        if (targetId == actorId) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.self_delete", "Admins cannot delete their own account");
        }
        if (!credentialStore.delete(targetId)) {
            throw userNotFound();
        }
        log.info("Admin id={} deleted user id={}", actorId, targetId);
    }

    public void resetPassword(long targetId, String newPassword, long actorId) {
        CredentialRules.checkPassword(newPassword);
        if (!credentialStore.updatePasswordHash(targetId, passwordHasher.hash(newPassword))) {
            throw userNotFound();
        }
        log.info("Admin id={} reset password of user id={}", actorId, targetId);
    }

    private static ProblemException userNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "admin.user_not_found", "User not found");
    }
}
