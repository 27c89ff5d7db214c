package com.example.baldnessdetector.service.wallet;

public enum ProvisioningOutcome {
    ASSIGNED,
    /** The user already owned a wallet, nothing written. */
    SKIPPED,
    USER_MISSING
}
