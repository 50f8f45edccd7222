package com.authgate.backend.common.guard;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-IP limits keyed by bucket name, e.g.
 * <pre>
 * app.guard.rate.rules.login.limit=10
 * app.guard.rate.rules.login.window=5m
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "app.guard.rate")
public class RateLimitProperties {

    private boolean enabled = true;

    private Map<String, Rule> rules = new LinkedHashMap<>();

    @Data
    public static class Rule {
        private int limit = 10;
        private Duration window = Duration.ofMinutes(5);
    }
}
