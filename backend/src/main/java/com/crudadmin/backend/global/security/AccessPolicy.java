package com.crudadmin.backend.global.security;

/**
 * Gating capability a service applies on top of identity resolution.
 * Each entry point contributes exactly one of these as a bean.
 */
public record AccessPolicy(boolean requiresAdmin) {

    public static final AccessPolicy AUTHENTICATED = new AccessPolicy(false);
    public static final AccessPolicy ADMIN_ONLY = new AccessPolicy(true);
}
