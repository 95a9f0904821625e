package com.crudadmin.backend.modules.auth.application;

import com.crudadmin.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class HashingException extends ProblemException {

    public HashingException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", cause);
    }
}
