package com.authgate.backend.twofactor.service;

import java.time.Instant;

public record MagicLinkConfirmation(long userId, int appId, String sessionId, Instant confirmedAt) {}
