package com.authgate.backend.auth.service;

public record VerificationStatus(long userId, boolean verified) {}
