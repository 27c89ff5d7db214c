package com.example.baldnessdetector.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationFailedException extends ApiException {

    public AuthenticationFailedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "authentication_error", message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "authentication_error", message, cause);
    }
}
