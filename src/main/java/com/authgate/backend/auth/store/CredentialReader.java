package com.authgate.backend.auth.store;

import com.authgate.backend.auth.entity.App;
import com.authgate.backend.auth.entity.RefreshToken;
import com.authgate.backend.auth.entity.User;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read side of the durable credential store. Absent rows come back as {@link Optional#empty()};
 * infrastructure failures surface as {@link CredentialStoreException}.
 */
public interface CredentialReader {

    Optional<User> getUserByEmail(String email);

    Optional<User> getUserById(long userId);

    Optional<App> getApp(int appId);

    /**
     * Every refresh token that has not expired at {@code now}. Hashes are salted, so matching a raw
     * value is the caller's job. The stream holds a cursor: close it, and call from inside a transaction.
     */
    Stream<RefreshToken> findRefreshTokenCandidates(Instant now);
}
