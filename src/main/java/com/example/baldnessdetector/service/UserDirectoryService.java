package com.example.baldnessdetector.service;

import com.example.baldnessdetector.exception.UserNotFoundException;
import com.example.baldnessdetector.exception.WalletAlreadyAssignedException;
import com.example.baldnessdetector.model.IdentityClaims;
import com.example.baldnessdetector.model.User;
import com.example.baldnessdetector.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * One record per authenticated identity, keyed by email and optionally by Google id.
 * <p>
 * Duplicate inserts racing each other are settled by the unique constraints of the
 * {@code users} table: the loser re-reads the row the winner created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserDirectoryService {

    private final UserRepository userRepository;

    public UserLookupResult findOrCreate(IdentityClaims claims) {
        Optional<User> existingOpt = lookup(claims);
        if (existingOpt.isPresent()) {
            User user = refresh(existingOpt.get(), claims);
            return new UserLookupResult(user, false);
        }

        try {
            User u = User.builder()
                    .email(claims.getEmail())
                    .name(claims.getName())
                    .picture(claims.getPicture())
                    .googleId(claims.hasGoogleId() ? claims.getGoogleId() : null)
                    .build();
            User created = userRepository.saveAndFlush(u);
            log.info("Created user {} for email {}", created.getId(), created.getEmail());
            return new UserLookupResult(created, true);
        } catch (DataIntegrityViolationException dive) {
            // Only a row created by a concurrent login explains the violation; anything else is a real failure
            Optional<User> concurrent = lookup(claims);
            if (concurrent.isEmpty()) {
                throw dive;
            }
            log.warn("Concurrent create detected for email {}, using user {}", claims.getEmail(), concurrent.get().getId());
            return new UserLookupResult(concurrent.get(), false);
        }
    }

    /**
     * Assigns the wallet address unless one is already present.
     *
     * @throws UserNotFoundException          if the user does not exist
     * @throws WalletAlreadyAssignedException if the user already owns a wallet; the stored address is kept
     */
    public User updateWalletAddress(Long userId, String address) {
        int updated = userRepository.assignWalletAddressIfAbsent(userId, address);
        User user = getById(userId);
        if (updated == 0) {
            throw new WalletAlreadyAssignedException(userId, user.getWalletAddress());
        }
        log.info("Assigned wallet {} to user {}", address, userId);
        return user;
    }

    public User getById(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> UserNotFoundException.byId(id));
    }

    public User getByWalletAddress(String address) {
        return userRepository.findByWalletAddress(address)
                .orElseThrow(() -> UserNotFoundException.byWalletAddress(address));
    }

    private Optional<User> lookup(IdentityClaims claims) {
        if (claims.hasGoogleId()) {
            Optional<User> byGoogleId = userRepository.findByGoogleId(claims.getGoogleId());
            if (byGoogleId.isPresent()) {
                return byGoogleId;
            }
        }
        return userRepository.findByEmail(claims.getEmail());
    }

    private User refresh(User user, IdentityClaims claims) {
        boolean changed = false;
        if (!Objects.equals(user.getName(), claims.getName())) {
            user.setName(claims.getName());
            changed = true;
        }
        if (claims.getPicture() != null && !claims.getPicture().equals(user.getPicture())) {
            user.setPicture(claims.getPicture());
            changed = true;
        }
        if (claims.hasGoogleId() && user.getGoogleId() == null) {
            // Email account logging in through Google for the first time
            user.setGoogleId(claims.getGoogleId());
            changed = true;
        }
        return changed ? userRepository.save(user) : user;
    }
}
