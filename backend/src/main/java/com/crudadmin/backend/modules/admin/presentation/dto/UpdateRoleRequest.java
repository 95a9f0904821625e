package com.crudadmin.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

public record UpdateRoleRequest(
        @JsonProperty("is_admin") @NotNull(message = "is_admin is required") Boolean admin
) {
}
