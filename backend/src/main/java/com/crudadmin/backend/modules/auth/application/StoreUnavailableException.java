package com.crudadmin.backend.modules.auth.application;

import com.crudadmin.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * The credential store could not be reached in time. The only failure a caller should retry.
 */
public class StoreUnavailableException extends RetryableProblemException {

    public StoreUnavailableException(int retryAfterSeconds, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Credential store unavailable", retryAfterSeconds, cause);
    }
}
