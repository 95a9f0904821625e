package com.crudadmin.backend.modules.auth.presentation.dto;

import com.crudadmin.backend.global.security.AuthenticatedUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
        long id,
        String username,
        @JsonProperty("is_admin") boolean admin
) {

    public static UserResponse from(UserAccount account) {
        return new UserResponse(account.id(), account.username(), account.admin());
    }

    public static UserResponse from(AuthenticatedUser user) {
        return new UserResponse(user.id(), user.username(), user.admin());
    }
}
