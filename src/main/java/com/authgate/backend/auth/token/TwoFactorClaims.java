package com.authgate.backend.auth.token;

import java.time.Instant;

public record TwoFactorClaims(
        long userId,
        int appId,
        String sessionId,
        Instant issuedAt,
        Instant expiresAt
) implements TokenClaims {

    @Override
    public TokenPurpose purpose() {
        return TokenPurpose.TWO_FACTOR;
    }
}
