package com.crudadmin.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "username is required") @Size(min = 3, max = 100) String username,
        @NotBlank(message = "password is required") @Size(min = 8, max = 30) String password,
        @JsonProperty("is_admin") boolean admin
) {

    @Override
    public String toString() {
        return "CreateUserRequest[username=" + username + ", admin=" + admin + "]";
    }
}
