package com.crudadmin.backend.global.security;

import java.io.IOException;

import com.crudadmin.backend.global.error.ProblemException;
import com.crudadmin.backend.modules.auth.application.AuthException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AccessGuard} with this service's {@link AccessPolicy} on every non-public request.
 * Rejected requests get a problem body here and never reach a controller.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final AccessGuard accessGuard;
    private final AccessPolicy accessPolicy;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            AccessGuard accessGuard,
            AccessPolicy accessPolicy,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.accessGuard = accessGuard;
        this.accessPolicy = accessPolicy;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AuthenticatedUser user;
        try {
            user = accessGuard.authorize(request, accessPolicy);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            if (ex instanceof AuthException authException) {
                log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), authException.getKind());
            }
            problemResponseWriter.write(request, response, ex);
            return;
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(user, null, user.authorities());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return PublicEndpoints.isPublic(request);
    }
}
