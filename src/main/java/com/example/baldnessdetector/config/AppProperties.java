package com.example.baldnessdetector.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** Application secret; also signs session tokens when {@code app.jwt.secret-key} is blank. */
    private String secretKey;

    private final Jwt jwt = new Jwt();

    private final Cors cors = new Cors();

    private final Detector detector = new Detector();

    @Getter
    @Setter
    public static class Jwt {
        private String secretKey;
        private String algorithm = "HS256";
        private int expirationHours = 24;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Getter
    @Setter
    public static class Detector {
        /** Uploads declaring more pixels than this are refused before decoding. */
        private long maxPixels = 40_000_000L;
    }
}
