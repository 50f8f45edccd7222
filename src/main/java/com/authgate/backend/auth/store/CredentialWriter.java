package com.authgate.backend.auth.store;

import java.time.Instant;

public interface CredentialWriter {

    /**
     * Inserts an unverified user.
     *
     * @return the new user id
     * @throws com.authgate.backend.auth.web.AuthException USER_ALREADY_EXISTS when email or username collides
     */
    long saveUser(String email, String username, String passwordHash);

    /** @return false when no such user exists */
    boolean setEmailVerified(long userId);

    void saveRefreshToken(long userId, int appId, String tokenHash, Instant expiresAt);

    /** Swaps {@code oldHash} for {@code newHash}; false when the row was already rotated or deleted. */
    boolean rotateRefreshToken(long userId, String oldHash, String newHash, Instant expiresAt);

    /** @return false when no row carried that hash */
    boolean deleteRefreshToken(String tokenHash);
}
