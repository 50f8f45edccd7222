package com.authgate.backend.testsupport;

import com.authgate.backend.auth.entity.App;
import com.authgate.backend.auth.entity.RefreshToken;
import com.authgate.backend.auth.entity.User;
import com.authgate.backend.auth.store.CredentialStore;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/** Thread-safe fake; rows are copied in and out so callers never share mutable state. */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<Long, User> users = new LinkedHashMap<>();
    private final Map<Integer, App> apps = new LinkedHashMap<>();
    private final List<RefreshToken> refreshTokens = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public synchronized App addApp(int id, String name, String secret) {
        App a = new App();
        a.setId(id);
        a.setName(name);
        a.setSecret(secret);
        apps.put(id, a);
        return copy(a);
    }

    @Override
    public synchronized long saveUser(String email, String username, String passwordHash) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        boolean clash = users.values().stream()
                .anyMatch(u -> u.getEmail().equals(normalized) || u.getUsername().equals(username));
        if (clash) throw new AuthException(AuthErrorCode.USER_ALREADY_EXISTS, "Email or username already registered");
        User u = new User();
        u.setId(ids.incrementAndGet());
        u.setEmail(normalized);
        u.setUsername(username);
        u.setPasswordHash(passwordHash);
        u.setVerified(false);
        users.put(u.getId(), u);
        return u.getId();
    }

    @Override
    public synchronized Optional<User> getUserByEmail(String email) {
        if (email == null) return Optional.empty();
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return users.values().stream().filter(u -> u.getEmail().equals(normalized)).findFirst().map(this::copy);
    }

    @Override
    public synchronized Optional<User> getUserById(long userId) {
        return Optional.ofNullable(users.get(userId)).map(this::copy);
    }

    @Override
    public synchronized boolean setEmailVerified(long userId) {
        User u = users.get(userId);
        if (u == null) return false;
        u.setVerified(true);
        return true;
    }

    @Override
    public synchronized Optional<App> getApp(int appId) {
        return Optional.ofNullable(apps.get(appId)).map(this::copy);
    }

    @Override
    public synchronized void saveRefreshToken(long userId, int appId, String tokenHash, Instant expiresAt) {
        RefreshToken t = new RefreshToken();
        t.setId(ids.incrementAndGet());
        t.setUserId(userId);
        t.setAppId(appId);
        t.setTokenHash(tokenHash);
        t.setExpiresAt(expiresAt);
        refreshTokens.add(t);
    }

    @Override
    public synchronized boolean rotateRefreshToken(long userId, String oldHash, String newHash, Instant expiresAt) {
        for (RefreshToken t : refreshTokens) {
            if (t.getUserId() == userId && t.getTokenHash().equals(oldHash)) {
                t.setTokenHash(newHash);
                t.setExpiresAt(expiresAt);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized boolean deleteRefreshToken(String tokenHash) {
        return refreshTokens.removeIf(t -> t.getTokenHash().equals(tokenHash));
    }

    @Override
    public synchronized Stream<RefreshToken> findRefreshTokenCandidates(Instant now) {
        List<RefreshToken> snapshot = refreshTokens.stream()
                .filter(t -> t.getExpiresAt().isAfter(now))
                .map(this::copy)
                .toList();
        return snapshot.stream();
    }

    public synchronized int refreshTokenCount(long userId) {
        return (int) refreshTokens.stream().filter(t -> t.getUserId() == userId).count();
    }

    public synchronized List<RefreshToken> allRefreshTokens() {
        return refreshTokens.stream().map(this::copy).toList();
    }

    /** Test hook: move every stored token's expiry, e.g. into the past. */
    public synchronized void expireAllRefreshTokens(Instant at) {
        refreshTokens.forEach(t -> t.setExpiresAt(at));
    }

    private User copy(User u) {
        User c = new User();
        c.setId(u.getId());
        c.setEmail(u.getEmail());
        c.setUsername(u.getUsername());
        c.setPasswordHash(u.getPasswordHash());
        c.setVerified(u.isVerified());
        return c;
    }

    private App copy(App a) {
        App c = new App();
        c.setId(a.getId());
        c.setName(a.getName());
        c.setSecret(a.getSecret());
        return c;
    }

    private RefreshToken copy(RefreshToken t) {
        RefreshToken c = new RefreshToken();
        c.setId(t.getId());
        c.setUserId(t.getUserId());
        c.setAppId(t.getAppId());
        c.setTokenHash(t.getTokenHash());
        c.setExpiresAt(t.getExpiresAt());
        return c;
    }
}
