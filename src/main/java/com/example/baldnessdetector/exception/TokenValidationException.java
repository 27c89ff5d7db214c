package com.example.baldnessdetector.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for every reason a session token can be refused. Always answered with 401.
 */
public abstract class TokenValidationException extends ApiException {

    protected TokenValidationException(String type, String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, type, message, cause);
    }
}
