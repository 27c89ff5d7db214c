package com.example.baldnessdetector.exception;

public class ExpiredTokenException extends TokenValidationException {

    public ExpiredTokenException(String message, Throwable cause) {
        super("expired_token", message, cause);
    }
}
