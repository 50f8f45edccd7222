package com.authgate.backend.auth.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of both /auth/refresh and /auth/logout. */
public record RefreshRequest(@NotBlank String refreshToken) {}
