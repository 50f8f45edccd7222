package com.authgate.backend.auth.dto;

public record RegisterResponse(long userId) {}
