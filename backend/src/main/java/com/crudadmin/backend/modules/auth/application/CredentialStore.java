package com.crudadmin.backend.modules.auth.application;

import java.util.Optional;

import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.domain.UserPage;

/**
 * Narrow port onto the relational user table. Atomicity and username uniqueness are the store's job.
 * <p>
 * Every method throws {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface CredentialStore {

    Optional<UserAccount> findByUsername(String username);

    Optional<UserAccount> findById(long id);

    /**
     * @throws UsernameTakenException if the username already exists
     */
    UserAccount create(NewUser user);

    /**
     * @return {@code false} if no user has the given id
     */
    boolean updateRole(long id, boolean admin);

    boolean updatePasswordHash(long id, String passwordHash);

    boolean delete(long id);

    UserPage findPage(int page, int size);
}
