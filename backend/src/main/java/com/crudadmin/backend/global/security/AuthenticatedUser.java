package com.crudadmin.backend.global.security;

import java.util.List;

import com.crudadmin.backend.modules.auth.domain.UserAccount;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Principal placed in the security context once a request's bearer token has been resolved.
 */
public record AuthenticatedUser(long id, String username, boolean admin) {

    public static AuthenticatedUser from(UserAccount account) {
        return new AuthenticatedUser(account.id(), account.username(), account.admin());
    }

    public List<GrantedAuthority> authorities() {
        if (admin) {
            return List.of(new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        return List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }
}
