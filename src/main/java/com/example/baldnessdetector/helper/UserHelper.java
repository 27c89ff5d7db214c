package com.example.baldnessdetector.helper;

import com.example.baldnessdetector.exception.InvalidTokenException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class UserHelper {

    /**
     * User id attached to the current request by the bearer token filter.
     */
    public Long getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new InvalidTokenException("User not authenticated");
        }
        Object principal = authentication.getPrincipal();
        if (principal instanceof Long userId) {
            return userId;
        }
        throw new InvalidTokenException("Unsupported principal type: " + principal.getClass().getSimpleName());
    }
}
