package com.example.baldnessdetector.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class GoogleUserInfo {
    // Fields returned by Google's userinfo endpoint (v2 uses "id", OpenID v3 uses "sub")
    @JsonAlias("sub")
    private String id;
    private String email;
    @JsonProperty("verified_email")
    @JsonAlias("email_verified")
    private Boolean verifiedEmail;
    private String name;
    private String picture;
}
