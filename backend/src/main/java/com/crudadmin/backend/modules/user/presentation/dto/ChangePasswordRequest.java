package com.crudadmin.backend.modules.user.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @JsonProperty("current_password") @NotBlank(message = "current_password is required") String currentPassword,
        @JsonProperty("new_password") @NotBlank(message = "new_password is required") @Size(min = 8, max = 30) String newPassword
) {

    @Override
    public String toString() {
        return "ChangePasswordRequest[]";
    }
}
