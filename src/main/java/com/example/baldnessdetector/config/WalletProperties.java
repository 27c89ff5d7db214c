package com.example.baldnessdetector.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "wallet")
public class WalletProperties {

    private String secretKey;

    private String clientId;

    private String baseUrl = "https://api.thirdweb.com";

    private String createPath = "/v1/wallets/server";

    private String network = "polygon";

    private Duration timeout = Duration.ofSeconds(15);

    private final Provisioning provisioning = new Provisioning();

    public boolean hasSecretKey() {
        return secretKey != null && !secretKey.isBlank();
    }

    @Getter
    @Setter
    public static class Provisioning {
        private boolean enabled = true;
        private int queueCapacity = 100;
        private int maxAttempts = 3;
        /** Delay before retry n is n times this value. */
        private Duration retryBackoff = Duration.ofSeconds(2);
    }
}
