package com.authgate.backend.twofactor.service;

public record SendMagicLinkCommand(
        long userId,
        int appId,
        String email,
        String ipAddress,
        String userAgent
) {}
