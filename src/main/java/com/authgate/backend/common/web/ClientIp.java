package com.authgate.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

public final class ClientIp {

    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private ClientIp() {}

    /** First hop of X-Forwarded-For when present, otherwise the socket peer. */
    public static String resolve(HttpServletRequest request) {
        String xff = request.getHeader(FORWARDED_FOR);
        if (xff != null && !xff.isBlank()) {
            int comma = xff.indexOf(',');
            String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
            if (!first.isEmpty()) return first;
        }
        return request.getRemoteAddr();
    }

    public static String userAgent(HttpServletRequest request) {
        return Optional.ofNullable(request.getHeader("User-Agent")).orElse("");
    }
}
