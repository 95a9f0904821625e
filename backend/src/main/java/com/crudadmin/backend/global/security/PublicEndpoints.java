package com.crudadmin.backend.global.security;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;

/**
 * Routes reachable without a bearer token.
 */
public final class PublicEndpoints {

    static final String[] PATTERNS = {
            "/auth/login",
            "/auth/token",
            "/health",
            "/healthz",
            "/readyz",
            "/actuator/health",
            "/actuator/health/**",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html"
    };

    static final String REGISTRATION_PATH = "/users";

    private static final AntPathMatcher MATCHER = new AntPathMatcher();
    private static final List<String> PATTERN_LIST = List.of(PATTERNS);

    private PublicEndpoints() {
    }

    public static boolean isPublic(HttpServletRequest request) {
        String method = request.getMethod();
        if (HttpMethod.OPTIONS.matches(method)) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (HttpMethod.POST.matches(method) && REGISTRATION_PATH.equals(path)) {
            return true;
        }
        return PATTERN_LIST.stream().anyMatch(pattern -> MATCHER.match(pattern, path));
    }
}
