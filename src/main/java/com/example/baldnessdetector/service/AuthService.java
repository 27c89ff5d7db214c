package com.example.baldnessdetector.service;

import com.example.baldnessdetector.dto.request.EmailAuthRequest;
import com.example.baldnessdetector.dto.request.GoogleAuthRequest;
import com.example.baldnessdetector.dto.response.AuthResponse;
import com.example.baldnessdetector.dto.response.UserResponse;
import com.example.baldnessdetector.exception.InvalidTokenException;
import com.example.baldnessdetector.exception.UserNotFoundException;
import com.example.baldnessdetector.model.IdentityClaims;
import com.example.baldnessdetector.model.User;
import com.example.baldnessdetector.security.JwtUtil;
import com.example.baldnessdetector.service.wallet.WalletProvisioningQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final CredentialVerifier credentialVerifier;
    private final UserDirectoryService userDirectoryService;
    private final JwtUtil jwtUtil;
    private final WalletProvisioningQueue walletProvisioningQueue;

    public AuthResponse loginWithGoogle(GoogleAuthRequest req) {
        IdentityClaims claims = credentialVerifier.verifyGoogle(req.getAccessToken(), req.getIdToken());
        AuthResponse resp = completeLogin(claims);
        log.info("Successfully logged in user via Google OAuth: {}", claims.getEmail());
        return resp;
    }

    public AuthResponse loginWithEmail(EmailAuthRequest req) {
        IdentityClaims claims = credentialVerifier.acceptEmail(req.getEmail(), req.getName(), req.getPicture());
        AuthResponse resp = completeLogin(claims);
        log.info("Successfully logged in user via email: {}", claims.getEmail());
        return resp;
    }

    /**
     * A token whose user has disappeared is treated like any other unusable token.
     */
    public UserResponse getCurrentUser(Long userId) {
        try {
            return convertToResponse(userDirectoryService.getById(userId));
        } catch (UserNotFoundException ex) {
            throw new InvalidTokenException("User not found", ex);
        }
    }

    private AuthResponse completeLogin(IdentityClaims claims) {
        UserLookupResult result = userDirectoryService.findOrCreate(claims);
        User user = result.getUser();

        String accessToken = jwtUtil.generateAccessToken(user.getId(), user.getEmail());
        AuthResponse resp = AuthResponse.builder()
                .accessToken(accessToken)
                .expiresIn(jwtUtil.getExpiresInSeconds())
                .newUser(result.isNewUser())
                .user(convertToResponse(user))
                .build();

        // Response is complete; wallet creation must not hold it up
        if (result.isNewUser() && user.getWalletAddress() == null) {
            walletProvisioningQueue.submit(user.getId());
        }
        return resp;
    }

    private UserResponse convertToResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .picture(user.getPicture())
                .googleId(user.getGoogleId())
                .walletAddress(user.getWalletAddress())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
