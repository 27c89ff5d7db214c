package com.example.baldnessdetector.exception;

public class MalformedTokenException extends TokenValidationException {

    public MalformedTokenException(String message) {
        super("malformed_token", message, null);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super("malformed_token", message, cause);
    }
}
