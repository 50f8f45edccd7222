package com.authgate.backend.twofactor.ephemeral;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with TTL. Failures surface as Spring's
 * {@link org.springframework.dao.DataAccessException}.
 */
public interface EphemeralStore {

    /** Atomic; true only for the caller that created the key. */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    Optional<String> get(String key);
}
