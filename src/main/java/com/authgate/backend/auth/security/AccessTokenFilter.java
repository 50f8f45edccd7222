package com.authgate.backend.auth.security;

import com.authgate.backend.auth.token.AccessTokenClaims;
import com.authgate.backend.auth.token.TokenCodec;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Set;

/**
 * Bearer access-token check for the few endpoints that need a signed-in user.
 * Access tokens are stateless: the signature and expiry are all that is checked.
 */
@Slf4j
@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_APP_ID = "appId";
    public static final String ATTR_EMAIL = "email";

    static final Set<String> PROTECTED_PATHS = Set.of(
            "/auth/2fa/magic-link",
            "/auth/2fa/invalidate"
    );

    private final TokenCodec codec;

    public AccessTokenFilter(TokenCodec codec) {
        this.codec = codec;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        if (PROTECTED_PATHS.contains(p)) return false;
        return p.startsWith("/auth") || p.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            chain.doFilter(req, res); // the entry point answers 401 for protected paths
            return;
        }

        AccessTokenClaims claims;
        try {
            claims = codec.verifyAccess(auth.substring(7).trim());
        } catch (AuthException e) {
            if (e.kind() == AuthErrorCode.Kind.INTERNAL) throw e;
            unauthorized(res, e.getMessage());
            return;
        }

        // principal is the user id only, never an entity
        var authentication = new UsernamePasswordAuthenticationToken(
                claims.userId(),
                null,
                Collections.emptyList()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        req.setAttribute(ATTR_USER_ID, claims.userId());
        req.setAttribute(ATTR_APP_ID, claims.appId());
        req.setAttribute(ATTR_EMAIL, claims.email());

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res, String reason) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        String msg = (reason == null) ? "Invalid access token" : reason.replace("\"", "'");
        res.getWriter().write("{\"code\":\"INVALID_TOKEN\",\"message\":\"" + msg + "\"}");
    }
}
