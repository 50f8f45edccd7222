package com.authgate.backend.twofactor.store;

import com.authgate.backend.twofactor.entity.MagicLink;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Durable magic-link records; the system of record for used/unused. */
public interface MagicLinkStore {

    /**
     * Inserts the link. When the user already has the maximum number of active links, the oldest
     * ones are deleted first so the count after the insert equals the maximum.
     */
    MagicLink create(MagicLink link);

    Optional<MagicLink> getByTokenHash(String tokenHash);

    /** Atomic conditional flip; false when the link was already used. */
    boolean markUsed(long id, Instant usedAt);

    List<MagicLink> listActiveByUser(long userId, Instant now);

    int invalidateByUser(long userId, Instant now);

    int invalidateByTokenHashes(Collection<String> tokenHashes, Instant now);

    /** Deletes unused rows that expired before {@code cutoff}. */
    int cleanupExpired(Instant cutoff);
}
