package com.authgate.backend.common.guard;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window counter per (bucket, client key), held in process memory.
 * Several instances behind a balancer each count separately.
 */
public class RequestRateLimiter {

    private static final class Window {
        volatile long windowStartEpochSec;
        final AtomicInteger count = new AtomicInteger(0);

        Window(long start) {
            this.windowStartEpochSec = start;
        }
    }

    private final ConcurrentHashMap<String, Window> map = new ConcurrentHashMap<>();

    public void checkOrThrow(String bucket, String clientKey, int limit, Duration window, Instant now) {
        if (clientKey == null || clientKey.isBlank()) return;
        long windowSec = Math.max(1, window.getSeconds());
        long nowSec = now.getEpochSecond();
        long start = (nowSec / windowSec) * windowSec;

        Window w = map.computeIfAbsent(bucket + "|" + clientKey, k -> new Window(start));

        if (w.windowStartEpochSec != start) {
            synchronized (w) {
                if (w.windowStartEpochSec != start) {
                    w.windowStartEpochSec = start;
                    w.count.set(0);
                }
            }
        }

        int n = w.count.incrementAndGet();
        if (n > Math.max(1, limit)) {
            int retryAfter = (int) Math.max(1, (start + windowSec) - nowSec);
            throw new RateLimitedException(bucket, retryAfter);
        }
    }

    /** Drops windows that ended before {@code now}; keeps the map from growing with one-off clients. */
    public int evictStale(Duration longestWindow, Instant now) {
        long horizon = now.getEpochSecond() - Math.max(1, longestWindow.getSeconds());
        int before = map.size();
        map.entrySet().removeIf(e -> e.getValue().windowStartEpochSec < horizon);
        return before - map.size();
    }
}
