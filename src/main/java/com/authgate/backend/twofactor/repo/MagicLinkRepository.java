package com.authgate.backend.twofactor.repo;

import com.authgate.backend.twofactor.entity.MagicLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MagicLinkRepository extends JpaRepository<MagicLink, Long> {

    Optional<MagicLink> findByTokenHash(String tokenHash);

    /** Oldest first, the order eviction walks. */
    @Query("""
            select m from MagicLink m
             where m.userId = :userId and m.used = false and m.expiresAt > :now
             order by m.createdAt asc, m.id asc
            """)
    List<MagicLink> findActiveByUser(@Param("userId") Long userId, @Param("now") Instant now);

    /** Conditional on used = false; 0 means another caller got there first. */
    @Modifying
    @Query("update MagicLink m set m.used = true, m.usedAt = :usedAt where m.id = :id and m.used = false")
    int markUsed(@Param("id") Long id, @Param("usedAt") Instant usedAt);

    @Modifying
    @Query("update MagicLink m set m.used = true, m.usedAt = :now where m.userId = :userId and m.used = false")
    int invalidateByUser(@Param("userId") Long userId, @Param("now") Instant now);

    @Modifying
    @Query("update MagicLink m set m.used = true, m.usedAt = :now where m.tokenHash in :hashes and m.used = false")
    int invalidateByTokenHashes(@Param("hashes") Collection<String> hashes, @Param("now") Instant now);

    @Modifying
    @Query("delete from MagicLink m where m.id in :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);

    @Modifying
    @Query("delete from MagicLink m where m.expiresAt < :cutoff and m.used = false")
    int deleteExpiredUnused(@Param("cutoff") Instant cutoff);
}
