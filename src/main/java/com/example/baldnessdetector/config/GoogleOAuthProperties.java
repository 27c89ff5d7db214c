package com.example.baldnessdetector.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "google.oauth")
public class GoogleOAuthProperties {

    /** Expected audience of Google ID tokens. Audience checks are skipped when blank. */
    private String clientId;

    private String clientSecret;

    private String userinfoUri = "https://www.googleapis.com/oauth2/v2/userinfo";

    private String tokeninfoUri = "https://oauth2.googleapis.com/tokeninfo";

    private Duration timeout = Duration.ofSeconds(10);

    public boolean hasClientId() {
        return clientId != null && !clientId.isBlank();
    }
}
