package com.example.baldnessdetector.service.wallet;

import com.example.baldnessdetector.exception.UserNotFoundException;
import com.example.baldnessdetector.exception.WalletAlreadyAssignedException;
import com.example.baldnessdetector.model.User;
import com.example.baldnessdetector.service.UserDirectoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One provisioning attempt for one user. Retrying and swallowing failures is the queue's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletProvisioner {

    private final UserDirectoryService userDirectoryService;
    private final WalletProvider walletProvider;

    public ProvisioningOutcome provisionOnce(Long userId) {
        User user;
        try {
            user = userDirectoryService.getById(userId);
        } catch (UserNotFoundException ex) {
            log.error("User {} not found, cannot provision wallet", userId);
            return ProvisioningOutcome.USER_MISSING;
        }

        if (user.getWalletAddress() != null) {
            log.info("User {} already has wallet {}", userId, user.getWalletAddress());
            return ProvisioningOutcome.SKIPPED;
        }

        String address = walletProvider.createWallet(userId);
        try {
            userDirectoryService.updateWalletAddress(userId, address);
        } catch (WalletAlreadyAssignedException ex) {
            log.info("User {} received wallet {} concurrently, discarding {}", userId, ex.getExistingAddress(), address);
            return ProvisioningOutcome.SKIPPED;
        }
        return ProvisioningOutcome.ASSIGNED;
    }
}
