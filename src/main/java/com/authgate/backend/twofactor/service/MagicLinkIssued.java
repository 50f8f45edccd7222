package com.authgate.backend.twofactor.service;

import java.time.Instant;

public record MagicLinkIssued(String sessionId, Instant expiresAt) {}
