package com.example.baldnessdetector.exception;

/**
 * Raised by wallet providers. Never reaches a client; the provisioning queue retries and then gives up.
 */
public class WalletProvisioningException extends RuntimeException {

    public WalletProvisioningException(String message) {
        super(message);
    }

    public WalletProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
