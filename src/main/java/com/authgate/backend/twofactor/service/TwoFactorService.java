package com.authgate.backend.twofactor.service;

import com.authgate.backend.auth.token.TokenCodec;
import com.authgate.backend.auth.token.TwoFactorClaims;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.common.crypto.Digests;
import com.authgate.backend.notify.EmailJob;
import com.authgate.backend.notify.NotificationPublishException;
import com.authgate.backend.notify.NotificationPublisher;
import com.authgate.backend.twofactor.config.TwoFactorProperties;
import com.authgate.backend.twofactor.entity.MagicLink;
import com.authgate.backend.twofactor.ephemeral.MagicLinkMarkers;
import com.authgate.backend.twofactor.store.MagicLinkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Magic-link issuance and single-use consumption.
 *
 * <p>Two stores take part. The fast store's set-if-absent on {@code 2fa:used:<hash>} picks the one
 * winner among concurrent redemptions; the durable conditional update is the backstop and the
 * record. The fast store is optional: when it is down, consumption still works through the
 * durable update alone.
 */
@Slf4j
@Service
public class TwoFactorService {

    public static final String VERIFY_LINK_PATH = "/auth/2fa/verify-link?token=";

    private final MagicLinkStore links;
    private final MagicLinkMarkers markers;
    private final NotificationPublisher publisher;
    private final TokenCodec codec;
    private final TwoFactorProperties props;
    private final Clock clock;

    // last session timestamp handed out; keeps ids unique when two calls share a clock tick
    private final AtomicLong lastSessionNanos = new AtomicLong();

    public TwoFactorService(MagicLinkStore links,
                            MagicLinkMarkers markers,
                            NotificationPublisher publisher,
                            TokenCodec codec,
                            TwoFactorProperties props,
                            Clock clock) {
        this.links = links;
        this.markers = markers;
        this.publisher = publisher;
        this.codec = codec;
        this.props = props;
        this.clock = clock;
    }

    public MagicLinkIssued sendMagicLink(SendMagicLinkCommand cmd) {
        Instant now = clock.instant();
        String sessionId = nextSessionId(now, cmd.userId());
        String token = codec.mintTwoFactor(cmd.userId(), cmd.appId(), sessionId, now);
        String hash = Digests.sha256Hex(token);
        Instant expiresAt = now.plus(props.getTokenTtl());

        MagicLink link = new MagicLink();
        link.setUserId(cmd.userId());
        link.setAppId(cmd.appId());
        link.setTokenHash(hash);
        link.setSessionId(sessionId);
        link.setIpAddress(truncate(cmd.ipAddress(), 45));
        link.setUserAgent(truncate(cmd.userAgent(), 512));
        link.setUsed(false);
        link.setExpiresAt(expiresAt);
        link.setCreatedAt(now);
        links.create(link);

        try {
            markers.putPending(hash, cmd.userId(), cmd.appId(), now, props.getTokenTtl());
        } catch (DataAccessException e) {
            log.warn("pending marker not written userId={}: {}", cmd.userId(), e.getMessage());
        }

        String url = trimSlash(props.getRedirectUrl()) + VERIFY_LINK_PATH + token;
        try {
            publisher.publish(EmailJob.twoFactor(cmd.email(), url));
        } catch (NotificationPublishException e) {
            throw new AuthException(AuthErrorCode.INTERNAL_ERROR, "Could not send magic link", e);
        }

        log.info("magic link issued userId={} appId={} sessionId={}", cmd.userId(), cmd.appId(), sessionId);
        return new MagicLinkIssued(sessionId, expiresAt);
    }

    /** Signature, expiry, purpose 2fa, and presence of app_id and session_id. */
    public TwoFactorClaims parseToken(String token) {
        return codec.verifyTwoFactor(token);
    }

    /**
     * Redeems the link once. Every later or concurrent attempt fails with MAGIC_LINK_ALREADY_USED.
     */
    public MagicLinkConfirmation consume(String token) {
        TwoFactorClaims claims = parseToken(token);
        Instant now = clock.instant();
        String hash = Digests.sha256Hex(token);

        MagicLink link = links.getByTokenHash(hash)
                .orElseThrow(() -> new AuthException(AuthErrorCode.MAGIC_LINK_NOT_FOUND, "Magic link not found"));
        if (link.getUserId() != claims.userId() || !link.getSessionId().equals(claims.sessionId())) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Magic link does not match its session");
        }
        if (link.isUsed()) {
            throw alreadyUsed();
        }
        if (link.isExpired(now)) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Magic link expired");
        }

        if (seenUsed(hash) || !claimFast(hash, Duration.between(now, link.getExpiresAt()))) {
            throw alreadyUsed();
        }
        boolean marked;
        try {
            marked = links.markUsed(link.getId(), now);
        } catch (AuthException e) {
            // nothing was written durably, free the claim for a retry
            releaseFast(hash);
            throw e;
        }
        if (!marked) {
            throw alreadyUsed();
        }

        try {
            markers.clearPending(hash);
        } catch (DataAccessException e) {
            log.warn("pending marker not cleared userId={}: {}", link.getUserId(), e.getMessage());
        }

        log.info("magic link consumed userId={} appId={} sessionId={}",
                link.getUserId(), link.getAppId(), link.getSessionId());
        return new MagicLinkConfirmation(link.getUserId(), link.getAppId(), link.getSessionId(), now);
    }

    public int invalidateMagicLinksByUserId(long userId) {
        Instant now = clock.instant();
        List<String> hashes = links.listActiveByUser(userId, now).stream()
                .map(MagicLink::getTokenHash)
                .toList();
        int n = links.invalidateByUser(userId, now);
        markers.invalidate(hashes, props.effectiveInvalidatedMarkerTtl());
        log.info("magic links invalidated userId={} count={}", userId, n);
        return n;
    }

    public int invalidateMagicLinksByHashes(Collection<String> tokenHashes) {
        if (tokenHashes == null || tokenHashes.isEmpty()) return 0;
        int n = links.invalidateByTokenHashes(tokenHashes, clock.instant());
        markers.invalidate(tokenHashes, props.effectiveInvalidatedMarkerTtl());
        log.info("magic links invalidated by hash requested={} count={}", tokenHashes.size(), n);
        return n;
    }

    /** Removes unused links that expired more than the grace period ago. */
    public int cleanupExpired() {
        Instant cutoff = clock.instant().minus(props.getCleanupGrace());
        int n = links.cleanupExpired(cutoff);
        log.info("expired magic links removed count={}", n);
        return n;
    }

    private boolean claimFast(String hash, Duration remaining) {
        try {
            return markers.claim(hash, remaining);
        } catch (DataAccessException e) {
            // the durable conditional update still admits a single winner
            log.warn("fast store unavailable during consume, relying on durable guard: {}", e.getMessage());
            return true;
        }
    }

    // read-only look at the used marker; an unreachable fast store answers "not seen"
    private boolean seenUsed(String hash) {
        try {
            return markers.isMarkedUsed(hash);
        } catch (DataAccessException e) {
            return false;
        }
    }

    private void releaseFast(String hash) {
        try {
            markers.release(hash);
        } catch (DataAccessException e) {
            log.warn("used marker not released, link stays blocked until it expires: {}", e.getMessage());
        }
    }

    String nextSessionId(Instant now, long userId) {
        long nowNanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        long nanos = lastSessionNanos.updateAndGet(prev -> Math.max(prev + 1, nowNanos));
        return "sess_" + nanos + "_" + userId;
    }

    private static AuthException alreadyUsed() {
        return new AuthException(AuthErrorCode.MAGIC_LINK_ALREADY_USED, "Magic link already used");
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static String trimSlash(String base) {
        if (base == null) return "";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
