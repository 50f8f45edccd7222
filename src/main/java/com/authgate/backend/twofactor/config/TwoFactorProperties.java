package com.authgate.backend.twofactor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.two-factor")
public class TwoFactorProperties {

    /** Signs magic-link tokens only. At least 32 bytes. */
    private String tokenSecret;

    private Duration tokenTtl = Duration.ofMinutes(10);

    /** Origin the mailed link points at; the path /auth/2fa/verify-link is appended. */
    private String redirectUrl = "http://localhost:8082";

    private int maxActiveLinks = 3;

    /** Unused rows are purged once they have been expired for this long. */
    private Duration cleanupGrace = Duration.ofDays(1);

    /** Lifetime of "invalidated" markers; null falls back to tokenTtl. */
    private Duration invalidatedMarkerTtl;

    private Cleanup cleanup = new Cleanup();

    public Duration effectiveInvalidatedMarkerTtl() {
        return invalidatedMarkerTtl != null ? invalidatedMarkerTtl : tokenTtl;
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 15 3 * * *";
    }
}
