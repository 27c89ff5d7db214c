package com.example.baldnessdetector.service.wallet;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stand-in used when no wallet provider secret is configured. Addresses are derived
 * from the user id, so the same user always gets the same address.
 */
@Slf4j
public class DevelopmentWalletProvider implements WalletProvider {

    @Override
    public String createWallet(Long userId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(("wallet_" + userId).getBytes(StandardCharsets.UTF_8));
            String address = "0x" + HexFormat.of().formatHex(hash).substring(0, 40);
            log.info("Created development wallet {} for user {}", address, userId);
            return address;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
