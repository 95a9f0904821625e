package com.crudadmin.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Supplier;

import com.crudadmin.backend.modules.auth.application.CredentialStore;
import com.crudadmin.backend.modules.auth.application.StoreUnavailableException;
import com.crudadmin.backend.modules.auth.application.UsernameTakenException;
import com.crudadmin.backend.modules.auth.domain.AppUser;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.domain.UserPage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * {@link CredentialStore} over the {@code users} table. Each call runs in the repository's own
 * transaction; the unique constraint on {@code username} settles concurrent registrations.
 */
@Repository
public class JpaCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialStore.class);

    private final AppUserRepository appUserRepository;
    private final Clock clock;
    private final int retryAfterSeconds;

    public JpaCredentialStore(
            AppUserRepository appUserRepository,
            Clock clock,
            @Value("${app.store.retry-after-seconds:5}") int retryAfterSeconds
    ) {
        this.appUserRepository = appUserRepository;
        this.clock = clock;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    public Optional<UserAccount> findByUsername(String username) {
        return call(() -> appUserRepository.findByUsername(username).map(AppUser::toAccount));
    }

    @Override
    public Optional<UserAccount> findById(long id) {
        return call(() -> appUserRepository.findById(id).map(AppUser::toAccount));
    }

    @Override
    public UserAccount create(NewUser user) {
        AppUser entity = new AppUser();
        entity.setUsername(user.username());
        entity.setPasswordHash(user.passwordHash());
        entity.setAdmin(user.admin());
        try {
            return call(() -> appUserRepository.saveAndFlush(entity).toAccount());
        } catch (DataIntegrityViolationException ex) {
            throw new UsernameTakenException(ex);
        }
    }

    @Override
    public boolean updateRole(long id, boolean admin) {
        return call(() -> appUserRepository.updateAdminFlag(id, admin, OffsetDateTime.now(clock)) > 0);
    }

    @Override
    public boolean updatePasswordHash(long id, String passwordHash) {
        return call(() -> appUserRepository.updatePasswordHash(id, passwordHash, OffsetDateTime.now(clock)) > 0);
    }

    @Override
    public boolean delete(long id) {
        return call(() -> appUserRepository.deleteUserById(id) > 0);
    }

    @Override
    public UserPage findPage(int page, int size) {
        return call(() -> {
            Page<AppUser> result = appUserRepository.findAll(PageRequest.of(page, size, Sort.by("id")));
            return new UserPage(
                    result.map(AppUser::toAccount).getContent(),
                    result.getNumber(),
                    result.getSize(),
                    result.getTotalElements(),
                    result.getTotalPages()
            );
        });
    }

    private <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException
                 | TransientDataAccessException
                 | RecoverableDataAccessException
                 | CannotCreateTransactionException ex) {
            log.warn("Credential store unavailable: {}", ex.getClass().getSimpleName());
            throw new StoreUnavailableException(retryAfterSeconds, ex);
        }
    }
}
