package com.authgate.backend.auth.service;

import java.time.Instant;

/** Result of login and refresh. The raw refresh token exists only in this object. */
public record TokenPair(
        String accessToken,
        String refreshToken,
        Instant issuedAt,
        Instant accessExpiresAt,
        Instant refreshExpiresAt
) {}
