package com.authgate.backend.twofactor.ephemeral;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Fast-store markers keyed by token hash:
 * <ul>
 *   <li>{@code 2fa:pending:<hash>} = {@code userId:appId:createdAtEpoch} while the link is outstanding</li>
 *   <li>{@code 2fa:used:<hash>} = {@code used} or {@code invalidated}; set-if-absent decides who consumes</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MagicLinkMarkers {

    public static final String PENDING_PREFIX = "2fa:pending:";
    public static final String USED_PREFIX = "2fa:used:";
    public static final String USED = "used";
    public static final String INVALIDATED = "invalidated";

    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final EphemeralStore store;

    public static String pendingKey(String hash) { return PENDING_PREFIX + hash; }

    public static String usedKey(String hash) { return USED_PREFIX + hash; }

    public void putPending(String hash, long userId, int appId, Instant createdAt, Duration ttl) {
        store.set(pendingKey(hash), userId + ":" + appId + ":" + createdAt.getEpochSecond(), atLeastMin(ttl));
    }

    /**
     * Claims the link. True for exactly one caller per hash while the marker lives.
     *
     * @throws DataAccessException when the fast store is unreachable
     */
    public boolean claim(String hash, Duration ttl) {
        return store.setIfAbsent(usedKey(hash), USED, atLeastMin(ttl));
    }

    /** True when the link was already consumed or invalidated. */
    public boolean isMarkedUsed(String hash) {
        return store.get(usedKey(hash)).isPresent();
    }

    /** Undoes {@link #claim} after the durable write failed. */
    public void release(String hash) {
        store.delete(usedKey(hash));
    }

    public void clearPending(String hash) {
        store.delete(pendingKey(hash));
    }

    /** Best effort; a failure on one hash does not stop the rest. */
    public int invalidate(Collection<String> hashes, Duration ttl) {
        int written = 0;
        for (String h : hashes) {
            try {
                store.set(usedKey(h), INVALIDATED, atLeastMin(ttl));
                store.delete(pendingKey(h));
                written++;
            } catch (DataAccessException e) {
                log.warn("invalidated marker not written: {}", e.getMessage());
            }
        }
        return written;
    }

    private static Duration atLeastMin(Duration ttl) {
        return (ttl == null || ttl.compareTo(MIN_TTL) < 0) ? MIN_TTL : ttl;
    }
}
