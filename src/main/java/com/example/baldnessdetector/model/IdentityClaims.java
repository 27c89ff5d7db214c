package com.example.baldnessdetector.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identity attributes asserted either by Google or, on the email path, by the client itself.
 */
@Value
@Builder
public class IdentityClaims {
    String email;
    String name;
    String picture;
    String googleId;

    public boolean hasGoogleId() {
        return googleId != null && !googleId.isBlank();
    }
}
