package com.authgate.backend.auth.token;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.auth.entity.App;
import com.authgate.backend.auth.entity.User;
import com.authgate.backend.auth.store.CredentialReader;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.common.crypto.Digests;
import com.authgate.backend.twofactor.config.TwoFactorProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Mints and verifies the HS256 bearer tokens of this service.
 *
 * <p>Each purpose signs with its own key: email verification and 2FA use their configured secrets,
 * access tokens use a key derived per app from the master access secret and the app's own secret,
 * so rotating one app's secret revokes only that app's access tokens.
 */
@Slf4j
@Component
public class TokenCodec {

    public static final String CLAIM_PURPOSE = "purpose";
    public static final String CLAIM_APP_ID = "app_id";
    public static final String CLAIM_SESSION_ID = "session_id";
    public static final String CLAIM_EMAIL = "email";

    private static final SignatureAlgorithm ALG = SignatureAlgorithm.HS256;

    private final AuthProperties authProps;
    private final TwoFactorProperties twoFactorProps;
    private final CredentialReader credentials;
    private final Clock clock;
    private final SecretKey verificationKey;
    private final SecretKey twoFactorKey;

    public TokenCodec(AuthProperties authProps,
                      TwoFactorProperties twoFactorProps,
                      CredentialReader credentials,
                      Clock clock) {
        this.authProps = authProps;
        this.twoFactorProps = twoFactorProps;
        this.credentials = credentials;
        this.clock = clock;
        // fail at startup on missing or short secrets rather than on the first request
        this.verificationKey = staticKey("app.auth.verification-secret", authProps.getVerificationSecret());
        this.twoFactorKey = staticKey("app.two-factor.token-secret", twoFactorProps.getTokenSecret());
        if (authProps.getAccessSecret() == null || authProps.getAccessSecret().isBlank()) {
            throw new IllegalStateException("app.auth.access-secret is not configured");
        }
    }

    // ===== mint =====

    /**
     * Generic mint. {@code audience} is the app id, or null for tokens not scoped to an app.
     * Access tokens require an audience since their key is per app.
     */
    public String mint(long subject, Integer audience, TokenPurpose purpose, Duration ttl,
                       Map<String, Object> extraClaims) {
        return mint(subject, audience, purpose, clock.instant(), ttl, extraClaims);
    }

    public String mint(long subject, Integer audience, TokenPurpose purpose, Instant issuedAt, Duration ttl,
                       Map<String, Object> extraClaims) {
        Map<String, Object> claims = new HashMap<>();
        if (extraClaims != null) claims.putAll(extraClaims);

        JwtBuilder b = Jwts.builder()
                .setClaims(claims)
                // numeric sub, same as the rest of the claim set
                .claim(Claims.SUBJECT, subject)
                .claim(CLAIM_PURPOSE, purpose.claimValue())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plus(ttl)));
        if (audience != null) {
            b.setAudience(audience.toString()).claim(CLAIM_APP_ID, audience);
        }
        return b.signWith(signingKey(purpose, audience), ALG).compact();
    }

    public String mintAccess(User user, App app, Instant issuedAt) {
        return mint(user.getId(), app.getId(), TokenPurpose.ACCESS, issuedAt, authProps.getAccessTtl(),
                Map.of(CLAIM_EMAIL, user.getEmail()));
    }

    public String mintEmailVerification(long userId) {
        return mint(userId, null, TokenPurpose.EMAIL_VERIFICATION, authProps.getVerificationTtl(), null);
    }

    public String mintTwoFactor(long userId, int appId, String sessionId, Instant issuedAt) {
        return mint(userId, appId, TokenPurpose.TWO_FACTOR, issuedAt, twoFactorProps.getTokenTtl(),
                Map.of(CLAIM_SESSION_ID, sessionId));
    }

    // ===== verify =====

    /**
     * Checks signature, algorithm, expiry, required claims and purpose against one instant.
     *
     * @throws AuthException INVALID_TOKEN on any failure
     */
    public TokenClaims verify(String token, TokenPurpose expected) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token is missing");
        }
        Instant now = clock.instant();
        Claims c = parse(token, expected, now);

        String purpose = c.get(CLAIM_PURPOSE, String.class);
        if (!expected.claimValue().equals(purpose)) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token purpose mismatch");
        }
        if (c.getExpiration() == null) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token has no expiry");
        }
        long userId = subject(c);
        Instant iat = (c.getIssuedAt() == null) ? null : c.getIssuedAt().toInstant();
        Instant exp = c.getExpiration().toInstant();

        return switch (expected) {
            case ACCESS -> new AccessTokenClaims(userId, c.get(CLAIM_EMAIL, String.class),
                    requireAppId(c), iat, exp);
            case EMAIL_VERIFICATION -> new EmailVerificationClaims(userId, iat, exp);
            case TWO_FACTOR -> new TwoFactorClaims(userId, requireAppId(c), requireSessionId(c), iat, exp);
        };
    }

    public AccessTokenClaims verifyAccess(String token) {
        return (AccessTokenClaims) verify(token, TokenPurpose.ACCESS);
    }

    public EmailVerificationClaims verifyEmailVerification(String token) {
        return (EmailVerificationClaims) verify(token, TokenPurpose.EMAIL_VERIFICATION);
    }

    public TwoFactorClaims verifyTwoFactor(String token) {
        return (TwoFactorClaims) verify(token, TokenPurpose.TWO_FACTOR);
    }

    private Claims parse(String token, TokenPurpose expected, Instant now) {
        JwtParserBuilder pb = Jwts.parserBuilder()
                .setClock(() -> Date.from(now));
        if (expected == TokenPurpose.ACCESS) {
            pb.setSigningKeyResolver(new SigningKeyResolverAdapter() {
                @Override
                public Key resolveSigningKey(JwsHeader header, Claims claims) {
                    Integer appId = claims.get(CLAIM_APP_ID, Integer.class);
                    if (appId == null) throw new AppKeyUnavailableException("access token has no app_id");
                    return signingKey(TokenPurpose.ACCESS, appId);
                }
            });
        } else {
            pb.setSigningKey(signingKey(expected, null));
        }

        try {
            // parseClaimsJws rejects unsigned tokens outright
            Jws<Claims> jws = pb.build().parseClaimsJws(token);
            if (!ALG.getValue().equals(jws.getHeader().getAlgorithm())) {
                throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Unexpected signing algorithm");
            }
            return jws.getBody();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("token rejected purpose={} reason={}", expected, e.getClass().getSimpleName());
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token is invalid");
        }
    }

    private Key signingKey(TokenPurpose purpose, Integer appId) {
        return switch (purpose) {
            case EMAIL_VERIFICATION -> verificationKey;
            case TWO_FACTOR -> twoFactorKey;
            case ACCESS -> {
                if (appId == null) throw new IllegalArgumentException("access tokens need an app id");
                App app = credentials.getApp(appId)
                        .orElseThrow(() -> new AppKeyUnavailableException("unknown app " + appId));
                yield appKey(app);
            }
        };
    }

    private SecretKey appKey(App app) {
        byte[] derived = Digests.hmacSha256(authProps.getAccessSecret(), "app:" + app.getId() + ":" + app.getSecret());
        return Keys.hmacShaKeyFor(derived);
    }

    private static SecretKey staticKey(String property, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(property + " is not configured");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    private static long subject(Claims c) {
        String sub = c.getSubject();
        if (sub == null || sub.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token has no subject");
        }
        try {
            return Long.parseLong(sub);
        } catch (NumberFormatException e) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token subject is not a user id");
        }
    }

    private static int requireAppId(Claims c) {
        try {
            Integer appId = c.get(CLAIM_APP_ID, Integer.class);
            if (appId != null) return appId;
        } catch (JwtException ignored) {
            // wrong claim type, reported below
        }
        throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token has no app_id");
    }

    private static String requireSessionId(Claims c) {
        Object v = c.get(CLAIM_SESSION_ID);
        if (v instanceof String s && !s.isBlank()) return s;
        throw new AuthException(AuthErrorCode.INVALID_TOKEN, "Token has no session_id");
    }

    /** Thrown from inside the key resolver; jjwt propagates it as a parse failure. */
    static final class AppKeyUnavailableException extends JwtException {
        AppKeyUnavailableException(String message) {
            super(message);
        }
    }
}
