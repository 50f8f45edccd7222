package com.authgate.backend.twofactor.job;

import com.authgate.backend.twofactor.service.TwoFactorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.two-factor.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MagicLinkCleanupJob {

    private final TwoFactorService twoFactorService;

    // daily 03:15 by default
    @Scheduled(cron = "${app.two-factor.cleanup.cron:0 15 3 * * *}")
    public void runDaily() {
        try {
            int n = twoFactorService.cleanupExpired();
            if (n > 0) log.info("magic link cleanup done removed={}", n);
        } catch (RuntimeException e) {
            // next run picks up whatever is left
            log.warn("magic link cleanup failed: {}", e.getMessage(), e);
        }
    }
}
