package com.example.baldnessdetector.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private Long id;
    private String email;
    private String name;
    private String picture;
    @JsonProperty("google_id")
    private String googleId;
    @JsonProperty("wallet_address")
    private String walletAddress;
    @JsonProperty("created_at")
    private Instant createdAt;
}
