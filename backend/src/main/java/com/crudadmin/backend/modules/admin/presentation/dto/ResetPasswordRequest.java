package com.crudadmin.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @JsonProperty("new_password") @NotBlank(message = "new_password is required") @Size(min = 8, max = 30) String newPassword
) {

    @Override
    public String toString() {
        return "ResetPasswordRequest[]";
    }
}
