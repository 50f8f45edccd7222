package com.authgate.backend.twofactor.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/** One 2FA challenge. Holds the SHA-256 of the mailed token, never the token itself. */
@Data
@Table(name = "magic_links",
        indexes = {
                @Index(name = "idx_magic_links_user_active", columnList = "user_id, used, expires_at"),
                @Index(name = "idx_magic_links_session_id", columnList = "session_id"),
                @Index(name = "idx_magic_links_expires", columnList = "expires_at")
        })
@Entity
public class MagicLink {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "app_id", nullable = false)
    private Integer appId;

    @ToString.Exclude
    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "session_id", nullable = false, length = 100)
    private String sessionId;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isActive(Instant now) {
        return !used && !isExpired(now);
    }
}
