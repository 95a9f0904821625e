package com.crudadmin.backend.support;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.crudadmin.backend.modules.auth.application.CredentialStore;
import com.crudadmin.backend.modules.auth.application.UsernameTakenException;
import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.domain.UserPage;

/**
 * Map-backed {@link CredentialStore} for tests that do not need PostgreSQL.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<Long, UserAccount> users = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<UserAccount> findByUsername(String username) {
        return users.values().stream()
                .filter(user -> user.username().equals(username))
                .findFirst();
    }

    @Override
    public Optional<UserAccount> findById(long id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public synchronized UserAccount create(NewUser user) {
        if (findByUsername(user.username()).isPresent()) {
            throw new UsernameTakenException();
        }
        UserAccount account = new UserAccount(sequence.incrementAndGet(), user.username(), user.passwordHash(), user.admin());
        users.put(account.id(), account);
        return account;
    }

    @Override
    public boolean updateRole(long id, boolean admin) {
        return users.computeIfPresent(id,
                (key, user) -> new UserAccount(user.id(), user.username(), user.passwordHash(), admin)) != null;
    }

    @Override
    public boolean updatePasswordHash(long id, String passwordHash) {
        return users.computeIfPresent(id,
                (key, user) -> new UserAccount(user.id(), user.username(), passwordHash, user.admin())) != null;
    }

    @Override
    public boolean delete(long id) {
        return users.remove(id) != null;
    }

    @Override
    public UserPage findPage(int page, int size) {
        List<UserAccount> sorted = new ArrayList<>(users.values());
        sorted.sort(Comparator.comparingLong(UserAccount::id));
        int from = Math.min(page * size, sorted.size());
        int to = Math.min(from + size, sorted.size());
        int totalPages = (sorted.size() + size - 1) / size;
        return new UserPage(sorted.subList(from, to), page, size, sorted.size(), totalPages);
    }
}
