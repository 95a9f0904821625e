package com.crudadmin.backend.modules.auth.application;

import com.crudadmin.backend.global.error.ProblemException;

/**
 * Terminal authentication/authorization failure for the current request. Never retried.
 */
public class AuthException extends ProblemException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind) {
        this(kind, null);
    }

    public AuthException(AuthErrorKind kind, Throwable cause) {
        super(kind.status(), kind.publicCode(), kind.publicDetail(), cause);
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }
}
