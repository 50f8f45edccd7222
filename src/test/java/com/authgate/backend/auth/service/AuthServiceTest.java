package com.authgate.backend.auth.service;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.auth.token.TokenCodec;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.testsupport.InMemoryCredentialStore;
import com.authgate.backend.testsupport.MutableClock;
import com.authgate.backend.testsupport.RecordingNotificationPublisher;
import com.authgate.backend.testsupport.TestProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuthServiceTest {

    private static final String EMAIL = "a@x.com";
    private static final String PASSWORD = "Secret123!";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final AuthProperties props = TestProps.auth();

    private InMemoryCredentialStore store;
    private TokenCodec codec;
    private AuthService service;
    private RecordingNotificationPublisher publisher;
    private EmailVerificationService verification;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        store.addApp(1, "default_app", "super-secret-key");
        codec = new TokenCodec(props, TestProps.twoFactor(), store, clock);
        service = new AuthService(store, store, codec, encoder, props, clock);
        publisher = new RecordingNotificationPublisher();
        verification = new EmailVerificationService(service, codec, publisher, props, Runnable::run);
    }

    @Test
    void fullLifecycle_registerVerifyLoginRefreshLogout() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);
        assertTrue(userId > 0);

        AuthException unverified = assertThrows(AuthException.class, () -> service.login(EMAIL, PASSWORD, 1));
        assertEquals(AuthErrorCode.EMAIL_NOT_VERIFIED, unverified.code());

        service.verifyUser(codec.mintEmailVerification(userId));
        assertTrue(service.checkUserVerification(EMAIL).verified());

        TokenPair pair = service.login(EMAIL, PASSWORD, 1);
        assertNotNull(pair.accessToken());
        assertEquals(1, store.refreshTokenCount(userId));
        assertTrue(encoder.matches(pair.refreshToken(), store.allRefreshTokens().get(0).getTokenHash()));
        assertEquals(userId, codec.verifyAccess(pair.accessToken()).userId());

        TokenPair rotated = service.refresh(pair.refreshToken());
        assertNotEquals(pair.refreshToken(), rotated.refreshToken());
        assertInvalidCredentials(() -> service.refresh(pair.refreshToken()));

        service.logout(rotated.refreshToken());
        assertInvalidCredentials(() -> service.logout(rotated.refreshToken()));
        assertEquals(0, store.refreshTokenCount(userId));
    }

    @Test
    void rawRefreshToken_isNeverStored() {
        long userId = registerVerified();

        TokenPair pair = service.login(EMAIL, PASSWORD, 1);

        store.allRefreshTokens().forEach(t -> assertNotEquals(pair.refreshToken(), t.getTokenHash()));
        assertEquals(userId, store.allRefreshTokens().get(0).getUserId());
    }

    @Test
    void login_failureModes_areDistinct() {
        registerVerified();

        assertEquals(AuthErrorCode.USER_NOT_FOUND,
                assertThrows(AuthException.class, () -> service.login("nobody@x.com", PASSWORD, 1)).code());
        assertEquals(AuthErrorCode.INVALID_CREDENTIALS,
                assertThrows(AuthException.class, () -> service.login(EMAIL, "wrong-password", 1)).code());
        assertEquals(AuthErrorCode.INVALID_APP_ID,
                assertThrows(AuthException.class, () -> service.login(EMAIL, PASSWORD, 99)).code());
    }

    @Test
    void login_emailLookupIgnoresCase() {
        registerVerified();

        assertNotNull(service.login("A@X.COM", PASSWORD, 1).refreshToken());
    }

    @Test
    void duplicateEmailOrUsername_failsWithAlreadyExists() {
        service.registerNewUser(EMAIL, "alice", PASSWORD);

        AuthException sameEmail = assertThrows(AuthException.class,
                () -> service.registerNewUser(EMAIL, "alice2", PASSWORD));
        AuthException sameName = assertThrows(AuthException.class,
                () -> service.registerNewUser("b@x.com", "alice", PASSWORD));

        assertEquals(AuthErrorCode.USER_ALREADY_EXISTS, sameEmail.code());
        assertEquals(AuthErrorCode.USER_ALREADY_EXISTS, sameName.code());
        assertEquals(AuthErrorCode.USER_NOT_FOUND,
                assertThrows(AuthException.class, () -> service.checkUserVerification("b@x.com")).code());
    }

    @Test
    void expiredRefreshToken_isNeverMatched() {
        registerVerified();
        TokenPair pair = service.login(EMAIL, PASSWORD, 1);

        clock.advance(props.getRefreshTtl().plusSeconds(1));

        assertInvalidCredentials(() -> service.refresh(pair.refreshToken()));
        assertInvalidCredentials(() -> service.logout(pair.refreshToken()));
    }

    @Test
    void refreshToken_matchingHashButExpiredRow_isIgnored() {
        registerVerified();
        TokenPair pair = service.login(EMAIL, PASSWORD, 1);

        store.expireAllRefreshTokens(clock.instant());

        assertInvalidCredentials(() -> service.refresh(pair.refreshToken()));
    }

    @Test
    void concurrentRefresh_ofSameToken_hasExactlyOneWinner() throws Exception {
        registerVerified();
        TokenPair pair = service.login(EMAIL, PASSWORD, 1);

        int threads = 2;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TokenPair>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(awaitThen(start, () -> service.refresh(pair.refreshToken()))));
            }
            start.countDown();

            List<TokenPair> winners = new ArrayList<>();
            int losers = 0;
            for (Future<TokenPair> f : futures) {
                try {
                    winners.add(f.get(10, TimeUnit.SECONDS));
                } catch (java.util.concurrent.ExecutionException e) {
                    AuthException ae = assertInstanceOf(AuthException.class, e.getCause());
                    assertEquals(AuthErrorCode.INVALID_CREDENTIALS, ae.code());
                    losers++;
                }
            }

            assertEquals(1, winners.size());
            assertEquals(threads - 1, losers);
            // the surviving token keeps working, the old one stays dead
            assertNotNull(service.refresh(winners.get(0).refreshToken()));
            assertInvalidCredentials(() -> service.refresh(pair.refreshToken()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void verifyUser_isIdempotent_andRejectsWrongPurpose() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);
        String token = codec.mintEmailVerification(userId);

        assertEquals(userId, service.verifyUser(token));
        assertEquals(userId, service.verifyUser(token));

        String twoFactor = codec.mintTwoFactor(userId, 1, "sess_x", clock.instant());
        assertEquals(AuthErrorCode.INVALID_TOKEN,
                assertThrows(AuthException.class, () -> service.verifyUser(twoFactor)).code());
    }

    @Test
    void verifyUser_forUnknownUser_isNotFound() {
        String token = codec.mintEmailVerification(999L);

        assertEquals(AuthErrorCode.USER_NOT_FOUND,
                assertThrows(AuthException.class, () -> service.verifyUser(token)).code());
    }

    @Test
    void issueVerification_queuesLinkToVerifyEndpoint() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);

        assertTrue(verification.issue(userId, EMAIL));

        var job = publisher.last();
        assertEquals(EMAIL, job.to());
        assertTrue(job.link().startsWith("http://auth.test/auth/verify?token="));
        assertEquals(userId, codec.verifyEmailVerification(publisher.lastToken()).userId());
    }

    @Test
    void issueVerification_handOffFailure_doesNotUndoRegistration() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);
        publisher.setFailing(true);

        assertFalse(verification.issue(userId, EMAIL));
        assertFalse(service.checkUserVerification(EMAIL).verified());
    }

    @Test
    void resend_behavesUniformly() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);

        assertDoesNotThrow(() -> verification.resend("unknown@x.com"));
        assertEquals(0, publisher.jobs().size());

        verification.resend(EMAIL);
        assertEquals(1, publisher.jobs().size());

        service.verifyUser(codec.mintEmailVerification(userId));
        assertDoesNotThrow(() -> verification.resend(EMAIL));
        assertEquals(1, publisher.jobs().size());
    }

    @Test
    void resend_returnsBeforeLookup_andNeverThrows() {
        service.registerNewUser(EMAIL, "alice", PASSWORD);
        List<Runnable> queued = new ArrayList<>();
        var deferred = new EmailVerificationService(service, codec, publisher, props, queued::add);

        deferred.resend(EMAIL);
        deferred.resend("unknown@x.com");
        assertEquals(2, queued.size());
        assertEquals(0, publisher.jobs().size());

        queued.forEach(Runnable::run);
        assertEquals(1, publisher.jobs().size());

        publisher.setFailing(true);
        var failing = new EmailVerificationService(service, codec, publisher, props, Runnable::run);
        assertDoesNotThrow(() -> failing.resend(EMAIL));
    }

    @Test
    void accessToken_expiresAfterAccessTtl() {
        registerVerified();
        TokenPair pair = service.login(EMAIL, PASSWORD, 1);
        assertEquals(clock.instant().plus(Duration.ofMinutes(15)), pair.accessExpiresAt());

        clock.advance(Duration.ofMinutes(16));

        assertEquals(AuthErrorCode.INVALID_TOKEN,
                assertThrows(AuthException.class, () -> codec.verifyAccess(pair.accessToken())).code());
    }

    private long registerVerified() {
        long userId = service.registerNewUser(EMAIL, "alice", PASSWORD);
        service.verifyUser(codec.mintEmailVerification(userId));
        return userId;
    }

    private static void assertInvalidCredentials(Executable call) {
        AuthException e = assertThrows(AuthException.class, call);
        assertEquals(AuthErrorCode.INVALID_CREDENTIALS, e.code());
    }

    private static <T> Callable<T> awaitThen(CountDownLatch start, Callable<T> body) {
        return () -> {
            start.await();
            return body.call();
        };
    }
}
