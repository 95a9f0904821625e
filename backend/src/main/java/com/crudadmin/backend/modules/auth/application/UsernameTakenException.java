package com.crudadmin.backend.modules.auth.application;

import com.crudadmin.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class UsernameTakenException extends ProblemException {

    public UsernameTakenException() {
        this(null);
    }

    public UsernameTakenException(Throwable cause) {
        super(HttpStatus.CONFLICT, "USERNAME_TAKEN", "Username already exists", cause);
    }
}
