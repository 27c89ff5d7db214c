package com.example.baldnessdetector.exception;

import org.springframework.http.HttpStatus;

public class InvalidImageException extends ApiException {

    public InvalidImageException(String message) {
        super(HttpStatus.BAD_REQUEST, "bad_request", message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "bad_request", message, cause);
    }
}
