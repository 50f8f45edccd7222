package com.authgate.backend.auth.security;

import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/** Reads what {@link AccessTokenFilter} attached to the current request. */
@Component
public class AuthContext {

    public long requireUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof Long l) {
            return l;
        }
        Object v = attribute(AccessTokenFilter.ATTR_USER_ID);
        if (v instanceof Long l) return l;
        throw unauthenticated();
    }

    public int requireAppId() {
        if (attribute(AccessTokenFilter.ATTR_APP_ID) instanceof Integer i) return i;
        throw unauthenticated();
    }

    public String requireEmail() {
        if (attribute(AccessTokenFilter.ATTR_EMAIL) instanceof String s && !s.isBlank()) return s;
        throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Access token carries no email");
    }

    private static Object attribute(String name) {
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs == null) return null;
        HttpServletRequest req = attrs.getRequest();
        return req.getAttribute(name);
    }

    private static AuthException unauthenticated() {
        return new AuthException(AuthErrorCode.INVALID_TOKEN, "Not authenticated");
    }
}
