package com.example.baldnessdetector.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Client-facing failure. The status and type end up in the error envelope.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;

    protected ApiException(HttpStatus status, String type, String message) {
        super(message);
        this.status = status;
        this.type = type;
    }

    protected ApiException(HttpStatus status, String type, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.type = type;
    }
}
