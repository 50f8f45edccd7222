package com.authgate.backend.twofactor.dto;

public record MagicLinkConfirmedResponse(String status, long userId, int appId, String sessionId) {}
