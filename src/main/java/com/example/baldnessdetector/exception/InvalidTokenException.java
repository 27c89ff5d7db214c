package com.example.baldnessdetector.exception;

public class InvalidTokenException extends TokenValidationException {

    public InvalidTokenException(String message) {
        super("invalid_token", message, null);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super("invalid_token", message, cause);
    }
}
