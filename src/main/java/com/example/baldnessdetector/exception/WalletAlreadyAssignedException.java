package com.example.baldnessdetector.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class WalletAlreadyAssignedException extends ApiException {

    private final Long userId;
    private final String existingAddress;

    public WalletAlreadyAssignedException(Long userId, String existingAddress) {
        super(HttpStatus.CONFLICT, "conflict", "User " + userId + " already has a wallet address");
        this.userId = userId;
        this.existingAddress = existingAddress;
    }
}
