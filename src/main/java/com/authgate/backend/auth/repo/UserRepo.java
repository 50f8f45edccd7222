package com.authgate.backend.auth.repo;

import com.authgate.backend.auth.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    // User#setEmail lower-cases too, IgnoreCase covers rows written by other tools
    Optional<User> findByEmailIgnoreCase(String email);

    /** Serializes per-user writers (magic-link issuance) on the user row. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    @Modifying
    @Query("update User u set u.verified = true, u.updatedAt = :now where u.id = :id")
    int markVerified(@Param("id") Long id, @Param("now") Instant now);
}
