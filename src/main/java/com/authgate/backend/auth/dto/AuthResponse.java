package com.authgate.backend.auth.dto;

import com.authgate.backend.auth.service.TokenPair;

import java.time.Duration;

public record AuthResponse(
        String accessToken,
        String refreshToken,
        String tokenType,          // always "Bearer"
        long accessExpiresInSec,
        long refreshExpiresInSec,
        long serverTimeEpochSec    // lets clients correct for a skewed device clock
) {
    public static AuthResponse of(TokenPair pair) {
        return new AuthResponse(
                pair.accessToken(),
                pair.refreshToken(),
                "Bearer",
                Duration.between(pair.issuedAt(), pair.accessExpiresAt()).getSeconds(),
                Duration.between(pair.issuedAt(), pair.refreshExpiresAt()).getSeconds(),
                pair.issuedAt().getEpochSecond()
        );
    }
}
