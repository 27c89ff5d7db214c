package com.example.baldnessdetector.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {
    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    @Builder.Default
    private String tokenType = "bearer";

    @JsonProperty("expires_in")
    private long expiresIn;

    @JsonProperty("is_new_user")
    private boolean newUser;

    private UserResponse user;
}
