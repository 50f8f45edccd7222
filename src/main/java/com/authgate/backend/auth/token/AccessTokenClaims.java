package com.authgate.backend.auth.token;

import java.time.Instant;

public record AccessTokenClaims(
        long userId,
        String email,
        int appId,
        Instant issuedAt,
        Instant expiresAt
) implements TokenClaims {

    @Override
    public TokenPurpose purpose() {
        return TokenPurpose.ACCESS;
    }
}
