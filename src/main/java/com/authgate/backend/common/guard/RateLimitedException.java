package com.authgate.backend.common.guard;

public class RateLimitedException extends RuntimeException {

    private final String bucket;
    private final int retryAfterSec;

    public RateLimitedException(String bucket, int retryAfterSec) {
        super("Too many requests");
        this.bucket = bucket;
        this.retryAfterSec = retryAfterSec;
    }

    public String bucket() { return bucket; }
    public int retryAfterSec() { return retryAfterSec; }
}
