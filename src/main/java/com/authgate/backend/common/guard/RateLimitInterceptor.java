package com.authgate.backend.common.guard;

import com.authgate.backend.common.web.ClientIp;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    // "METHOD path" -> bucket name under app.guard.rate.rules
    private static final Map<String, String> BUCKETS = Map.of(
            "POST /auth/login", "login",
            "POST /auth/register", "register",
            "POST /auth/refresh", "refresh",
            "POST /auth/logout", "logout",
            "GET /auth/verify", "verify",
            "POST /auth/verify/resend", "verify-resend",
            "POST /auth/2fa/magic-link", "magic-link",
            "GET /auth/2fa/verify-link", "magic-link-verify"
    );

    private static final int EVICT_EVERY = 1024;

    private final RequestRateLimiter limiter;
    private final RateLimitProperties props;
    private final Clock clock;
    private int calls;

    public RateLimitInterceptor(RequestRateLimiter limiter, RateLimitProperties props) {
        this(limiter, props, Clock.systemUTC());
    }

    RateLimitInterceptor(RequestRateLimiter limiter, RateLimitProperties props, Clock clock) {
        this.limiter = limiter;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String bucket = BUCKETS.get(request.getMethod() + " " + request.getRequestURI());
        if (bucket == null) return true;
        RateLimitProperties.Rule rule = props.getRules().get(bucket);
        if (rule == null) return true;

        Instant now = clock.instant();
        maybeEvict(now);
        try {
            limiter.checkOrThrow(bucket, ClientIp.resolve(request), rule.getLimit(), rule.getWindow(), now);
        } catch (RateLimitedException e) {
            log.warn("rate limited bucket={} retryAfterSec={}", bucket, e.retryAfterSec());
            throw e;
        }
        return true;
    }

    private void maybeEvict(Instant now) {
        synchronized (this) {
            if (++calls % EVICT_EVERY != 0) return;
        }
        Duration longest = props.getRules().values().stream()
                .map(RateLimitProperties.Rule::getWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ofHours(1));
        limiter.evictStale(longest, now);
    }
}
