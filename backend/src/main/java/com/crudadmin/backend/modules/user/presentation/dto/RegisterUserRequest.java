package com.crudadmin.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterUserRequest(
        @NotBlank(message = "username is required") @Size(min = 3, max = 100) String username,
        @NotBlank(message = "password is required") @Size(min = 8, max = 30) String password
) {

    @Override
    public String toString() {
        return "RegisterUserRequest[username=" + username + "]";
    }
}
