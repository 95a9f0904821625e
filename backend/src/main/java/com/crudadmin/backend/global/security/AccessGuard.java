package com.crudadmin.backend.global.security;

import com.crudadmin.backend.modules.auth.application.AuthErrorKind;
import com.crudadmin.backend.modules.auth.application.AuthException;
import com.crudadmin.backend.modules.auth.application.AuthService;
import com.crudadmin.backend.modules.auth.domain.UserAccount;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Gate every protected route goes through.
 * <p>
 * Per request: {@code Unauthenticated -> TokenExtracted -> Valid|Invalid -> Authorized|Forbidden|Rejected}.
 * Nothing is remembered between requests. The admin gate is the same resolution followed by the
 * {@link AccessPolicy#requiresAdmin()} capability check, not a second authentication path.
 */
@Component
public class AccessGuard {

    private final AuthService authService;

    public AccessGuard(AuthService authService) {
        this.authService = authService;
    }

    /**
     * @throws AuthException {@link AuthErrorKind#MISSING_CREDENTIALS} without a bearer token, any token or
     *                       account error from resolution, or {@link AuthErrorKind#FORBIDDEN} when the policy
     *                       requires an admin and the caller is not one
     */
    public AuthenticatedUser authorize(HttpServletRequest request, AccessPolicy policy) {
        String token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(() -> new AuthException(AuthErrorKind.MISSING_CREDENTIALS));

        UserAccount user = authService.resolve(token);

        if (policy.requiresAdmin() && !user.admin()) {
            throw new AuthException(AuthErrorKind.FORBIDDEN);
        }
        return AuthenticatedUser.from(user);
    }
}
