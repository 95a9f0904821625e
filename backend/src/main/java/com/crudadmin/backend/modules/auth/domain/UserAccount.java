package com.crudadmin.backend.modules.auth.domain;

import java.util.Objects;

/**
 * Immutable view of a stored user as seen by the auth core.
 */
public record UserAccount(long id, String username, String passwordHash, boolean admin) {

    public UserAccount {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(passwordHash, "passwordHash");
    }

    @Override
    public String toString() {
        return "UserAccount[id=" + id + ", username=" + username + ", admin=" + admin + "]";
    }
}
