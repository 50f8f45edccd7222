package com.authgate.backend.auth.repo;

import com.authgate.backend.auth.entity.RefreshToken;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.stream.Stream;

public interface RefreshTokenRepo extends JpaRepository<RefreshToken, Long> {

    /** Must be consumed inside a transaction and closed by the caller. */
    @QueryHints(@QueryHint(name = "org.hibernate.fetchSize", value = "100"))
    @Query("select t from RefreshToken t where t.expiresAt > :now")
    Stream<RefreshToken> streamUnexpired(@Param("now") Instant now);

    /** Compare-and-swap on the stored hash; the loser of a concurrent rotation sees 0. */
    @Modifying
    @Query("""
            update RefreshToken t
               set t.tokenHash = :newHash, t.expiresAt = :expiresAt
             where t.userId = :userId and t.tokenHash = :oldHash
            """)
    int rotate(@Param("userId") Long userId,
               @Param("oldHash") String oldHash,
               @Param("newHash") String newHash,
               @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("delete from RefreshToken t where t.tokenHash = :hash")
    int deleteByTokenHash(@Param("hash") String hash);
}
