package com.authgate.backend.auth.token;

import java.time.Instant;

public record EmailVerificationClaims(
        long userId,
        Instant issuedAt,
        Instant expiresAt
) implements TokenClaims {

    @Override
    public TokenPurpose purpose() {
        return TokenPurpose.EMAIL_VERIFICATION;
    }
}
