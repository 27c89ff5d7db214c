package com.example.baldnessdetector.exception;

import org.springframework.http.HttpStatus;

public class UserNotFoundException extends ApiException {

    public UserNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "not_found", message);
    }

    public static UserNotFoundException byId(Long id) {
        return new UserNotFoundException("User " + id + " not found");
    }

    public static UserNotFoundException byWalletAddress(String address) {
        return new UserNotFoundException("No user owns wallet " + address);
    }
}
