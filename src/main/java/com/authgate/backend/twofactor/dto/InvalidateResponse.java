package com.authgate.backend.twofactor.dto;

public record InvalidateResponse(int invalidated) {}
