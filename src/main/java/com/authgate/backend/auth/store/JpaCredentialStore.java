package com.authgate.backend.auth.store;

import com.authgate.backend.auth.entity.App;
import com.authgate.backend.auth.entity.RefreshToken;
import com.authgate.backend.auth.entity.User;
import com.authgate.backend.auth.repo.AppRepo;
import com.authgate.backend.auth.repo.RefreshTokenRepo;
import com.authgate.backend.auth.repo.UserRepo;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaCredentialStore implements CredentialStore {

    private final UserRepo users;
    private final AppRepo apps;
    private final RefreshTokenRepo refreshTokens;
    private final Clock clock;

    /**
     * Runs in the repository's own transaction so a unique-constraint violation surfaces here,
     * with nothing partial left behind.
     */
    @Override
    public long saveUser(String email, String username, String passwordHash) {
        User u = new User();
        u.setEmail(email);
        u.setUsername(username);
        u.setPasswordHash(passwordHash);
        u.setVerified(false);
        Instant now = clock.instant();
        u.setCreatedAt(now);
        u.setUpdatedAt(now);
        try {
            return users.saveAndFlush(u).getId();
        } catch (DataIntegrityViolationException e) {
            throw new AuthException(AuthErrorCode.USER_ALREADY_EXISTS, "Email or username already registered", e);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("saveUser", e);
        }
    }

    @Override
    public Optional<User> getUserByEmail(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        try {
            return users.findByEmailIgnoreCase(email.trim());
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("getUserByEmail", e);
        }
    }

    @Override
    public Optional<User> getUserById(long userId) {
        try {
            return users.findById(userId);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("getUserById", e);
        }
    }

    @Override
    @Transactional
    public boolean setEmailVerified(long userId) {
        try {
            return users.markVerified(userId, clock.instant()) == 1;
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("setEmailVerified", e);
        }
    }

    @Override
    public Optional<App> getApp(int appId) {
        try {
            return apps.findById(appId);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("getApp", e);
        }
    }

    @Override
    @Transactional
    public void saveRefreshToken(long userId, int appId, String tokenHash, Instant expiresAt) {
        RefreshToken t = new RefreshToken();
        t.setUserId(userId);
        t.setAppId(appId);
        t.setTokenHash(tokenHash);
        t.setCreatedAt(clock.instant());
        t.setExpiresAt(expiresAt);
        try {
            refreshTokens.save(t);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("saveRefreshToken", e);
        }
    }

    @Override
    @Transactional
    public boolean rotateRefreshToken(long userId, String oldHash, String newHash, Instant expiresAt) {
        try {
            int n = refreshTokens.rotate(userId, oldHash, newHash, expiresAt);
            if (n > 1) {
                // token_hash is unique, more than one row means the constraint is missing
                log.error("refresh rotation touched {} rows userId={}", n, userId);
            }
            return n == 1;
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("rotateRefreshToken", e);
        }
    }

    @Override
    @Transactional
    public boolean deleteRefreshToken(String tokenHash) {
        try {
            return refreshTokens.deleteByTokenHash(tokenHash) > 0;
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("deleteRefreshToken", e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Stream<RefreshToken> findRefreshTokenCandidates(Instant now) {
        try {
            return refreshTokens.streamUnexpired(now);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("findRefreshTokenCandidates", e);
        }
    }
}
