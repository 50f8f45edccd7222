package com.authgate.backend.auth.service;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.auth.entity.App;
import com.authgate.backend.auth.entity.RefreshToken;
import com.authgate.backend.auth.entity.User;
import com.authgate.backend.auth.store.CredentialReader;
import com.authgate.backend.auth.store.CredentialWriter;
import com.authgate.backend.auth.token.EmailVerificationClaims;
import com.authgate.backend.auth.token.TokenCodec;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.common.crypto.SecureToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Login, registration, refresh rotation, logout and email verification.
 *
 * <p>Refresh tokens are opaque random strings stored as BCrypt hashes. A rotation swaps the stored
 * hash with a conditional update on (user id, old hash); of two concurrent rotations of the same
 * token only one sees an affected row.
 */
@Slf4j
@Service
public class AuthService {

    private final CredentialReader reader;
    private final CredentialWriter writer;
    private final TokenCodec codec;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties props;
    private final Clock clock;

    public AuthService(CredentialReader reader,
                       CredentialWriter writer,
                       TokenCodec codec,
                       PasswordEncoder passwordEncoder,
                       AuthProperties props,
                       Clock clock) {
        this.reader = reader;
        this.writer = writer;
        this.codec = codec;
        this.passwordEncoder = passwordEncoder;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Creates an unverified user. Collisions are detected by the unique constraints, not a pre-check.
     * The caller is expected to issue the verification email afterwards.
     */
    public long registerNewUser(String email, String username, String rawPassword) {
        String hash = passwordEncoder.encode(rawPassword);
        long userId = writer.saveUser(email, username, hash);
        log.info("user registered userId={}", userId);
        return userId;
    }

    public TokenPair login(String email, String password, int appId) {
        User user = reader.getUserByEmail(email)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND, "User not found"));
        if (!user.isVerified()) {
            throw new AuthException(AuthErrorCode.EMAIL_NOT_VERIFIED, "Email address is not verified");
        }
        if (password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
        }
        App app = reader.getApp(appId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_APP_ID, "Unknown app"));

        Instant now = clock.instant();
        String access = codec.mintAccess(user, app, now);
        String refresh = SecureToken.newRefreshToken();
        Instant refreshExpiresAt = now.plus(props.getRefreshTtl());
        writer.saveRefreshToken(user.getId(), app.getId(), passwordEncoder.encode(refresh), refreshExpiresAt);

        log.info("login ok userId={} appId={}", user.getId(), app.getId());
        return new TokenPair(access, refresh, now, now.plus(props.getAccessTtl()), refreshExpiresAt);
    }

    /**
     * Exchanges a refresh token for a new pair. The presented token is unusable afterwards;
     * a replay, or the loser of a concurrent rotation, fails with INVALID_CREDENTIALS.
     */
    @Transactional
    public TokenPair refresh(String rawRefreshToken) {
        Instant now = clock.instant();
        RefreshToken current = findRefreshToken(rawRefreshToken, now)
                .orElseThrow(AuthService::invalidRefreshToken);

        User user = reader.getUserById(current.getUserId())
                .orElseThrow(AuthService::invalidRefreshToken);
        App app = reader.getApp(current.getAppId())
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_APP_ID, "Unknown app"));

        String access = codec.mintAccess(user, app, now);
        String next = SecureToken.newRefreshToken();
        Instant refreshExpiresAt = now.plus(props.getRefreshTtl());

        boolean rotated = writer.rotateRefreshToken(
                user.getId(), current.getTokenHash(), passwordEncoder.encode(next), refreshExpiresAt);
        if (!rotated) {
            log.info("refresh lost rotation race userId={}", user.getId());
            throw invalidRefreshToken();
        }
        log.info("refresh ok userId={} appId={}", user.getId(), app.getId());
        return new TokenPair(access, next, now, now.plus(props.getAccessTtl()), refreshExpiresAt);
    }

    @Transactional
    public void logout(String rawRefreshToken) {
        Instant now = clock.instant();
        RefreshToken current = findRefreshToken(rawRefreshToken, now)
                .orElseThrow(AuthService::invalidRefreshToken);
        if (!writer.deleteRefreshToken(current.getTokenHash())) {
            throw invalidRefreshToken();
        }
        log.info("logout ok userId={}", current.getUserId());
    }

    /**
     * Marks the token's user verified. Applying the same unexpired token again is a no-op success.
     */
    public long verifyUser(String token) {
        EmailVerificationClaims claims = codec.verifyEmailVerification(token);
        if (!writer.setEmailVerified(claims.userId())) {
            throw new AuthException(AuthErrorCode.USER_NOT_FOUND, "User not found");
        }
        log.info("email verified userId={}", claims.userId());
        return claims.userId();
    }

    public VerificationStatus checkUserVerification(String email) {
        User user = reader.getUserByEmail(email)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND, "User not found"));
        return new VerificationStatus(user.getId(), user.isVerified());
    }

    // Salted hashes cannot be looked up by value; scan the unexpired rows and compare each.
    private Optional<RefreshToken> findRefreshToken(String raw, Instant now) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try (Stream<RefreshToken> candidates = reader.findRefreshTokenCandidates(now)) {
            return candidates
                    .filter(t -> !t.isExpired(now))
                    .filter(t -> passwordEncoder.matches(raw, t.getTokenHash()))
                    .findFirst();
        }
    }

    private static AuthException invalidRefreshToken() {
        return new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid refresh token");
    }
}
