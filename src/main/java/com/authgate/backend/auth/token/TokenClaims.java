package com.authgate.backend.auth.token;

import java.time.Instant;

/** Verified claim set. One implementation per {@link TokenPurpose}, each with a fixed shape. */
public interface TokenClaims {

    long userId();

    TokenPurpose purpose();

    Instant issuedAt();

    Instant expiresAt();
}
