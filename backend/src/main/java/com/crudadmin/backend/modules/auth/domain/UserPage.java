package com.crudadmin.backend.modules.auth.domain;

import java.util.List;

public record UserPage(List<UserAccount> items, int page, int size, long totalElements, int totalPages) {

    public UserPage {
        items = List.copyOf(items);
    }
}
