package com.crudadmin.backend.modules.admin.presentation.dto;

import java.util.List;

import com.crudadmin.backend.modules.auth.domain.UserPage;
import com.crudadmin.backend.modules.auth.presentation.dto.UserResponse;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminUsersResponse(
        List<UserResponse> items,
        int page,
        int size,
        @JsonProperty("total_elements") long totalElements,
        @JsonProperty("total_pages") int totalPages
) {

    public static AdminUsersResponse from(UserPage page) {
        List<UserResponse> items = page.items().stream().map(UserResponse::from).toList();
        return new AdminUsersResponse(items, page.page(), page.size(), page.totalElements(), page.totalPages());
    }
}
