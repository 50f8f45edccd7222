package com.authgate.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id: taken from {@code X-Request-Id} when the caller sends one,
 * generated otherwise. The id is echoed back, exposed to error bodies and printed by the log pattern.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";
    public static final String MDC_CLIENT_IP = "ip";

    private static final int MAX_INBOUND_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);

        MDC.put(MDC_KEY, rid);
        MDC.put(MDC_CLIENT_IP, ClientIp.resolve(req));
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_CLIENT_IP);
        }
    }

    public static String currentOrNew(HttpServletRequest req) {
        Object v = (req == null) ? null : req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    // inbound ids end up in logs, keep them short and printable
    private static String sanitize(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
            return UUID.randomUUID().toString();
        }
        for (int i = 0; i < inbound.length(); i++) {
            char c = inbound.charAt(i);
            if (c < 0x21 || c > 0x7e) return UUID.randomUUID().toString();
        }
        return inbound;
    }
}
