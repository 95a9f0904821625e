package com.crudadmin.backend.modules.auth.domain;

import java.util.Objects;

public record NewUser(String username, String passwordHash, boolean admin) {

    public NewUser {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(passwordHash, "passwordHash");
    }

    @Override
    public String toString() {
        return "NewUser[username=" + username + ", admin=" + admin + "]";
    }
}
