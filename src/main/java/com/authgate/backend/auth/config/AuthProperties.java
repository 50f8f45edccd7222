package com.authgate.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    private Duration accessTtl = Duration.ofMinutes(15);
    private Duration refreshTtl = Duration.ofDays(30);

    /** Master secret; each app's signing key is derived from it and the app's own secret. */
    private String accessSecret;

    /** At least 32 bytes, HS256 rejects shorter keys. */
    private String verificationSecret;
    private Duration verificationTtl = Duration.ofHours(24);

    /** Public origin used to build the link mailed to new users. */
    private String verificationBaseUrl = "http://localhost:8080";

    private int bcryptStrength = 10;
}
