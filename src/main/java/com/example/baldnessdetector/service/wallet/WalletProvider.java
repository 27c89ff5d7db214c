package com.example.baldnessdetector.service.wallet;

/**
 * External service that creates an embedded wallet for a user.
 */
public interface WalletProvider {

    /**
     * @return the public address of the new wallet
     * @throws com.example.baldnessdetector.exception.WalletProvisioningException on any provider failure
     */
    String createWallet(Long userId);
}
