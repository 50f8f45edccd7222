package com.authgate.backend.twofactor.dto;

import java.time.Instant;

public record MagicLinkSentResponse(String status, String sessionId, Instant expiresAt) {}
