package com.authgate.backend.auth.service;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.auth.token.TokenCodec;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.notify.EmailJob;
import com.authgate.backend.notify.NotificationPublishException;
import com.authgate.backend.notify.NotificationPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class EmailVerificationService {

    public static final String VERIFY_PATH = "/auth/verify?token=";

    private final AuthService authService;
    private final TokenCodec codec;
    private final NotificationPublisher publisher;
    private final AuthProperties props;
    private final TaskExecutor handoff;

    public EmailVerificationService(AuthService authService,
                                    TokenCodec codec,
                                    NotificationPublisher publisher,
                                    AuthProperties props,
                                    @Qualifier("mailHandoffExecutor") TaskExecutor handoff) {
        this.authService = authService;
        this.codec = codec;
        this.publisher = publisher;
        this.props = props;
        this.handoff = handoff;
    }

    /**
     * Mints a verification token and queues the email. A failed hand-off is logged only,
     * the user can ask for another email.
     *
     * @return true when the job was queued
     */
    public boolean issue(long userId, String email) {
        String token = codec.mintEmailVerification(userId);
        String link = trimSlash(props.getVerificationBaseUrl()) + VERIFY_PATH + token;
        try {
            publisher.publish(EmailJob.emailVerification(email, link));
            return true;
        } catch (NotificationPublishException e) {
            log.warn("verification email not queued userId={}: {}", userId, e.getMessage());
            return false;
        }
    }

    /**
     * Re-sends the verification email when the address belongs to an unverified account.
     * The lookup and the queue write run on {@code mailHandoffExecutor}, so the caller returns
     * at the same speed whether or not the account exists or is verified.
     */
    public void resend(String email) {
        try {
            handoff.execute(() -> resendNow(email));
        } catch (TaskRejectedException e) {
            log.warn("resend dropped, hand-off queue full: {}", e.getMessage());
        }
    }

    void resendNow(String email) {
        try {
            VerificationStatus status = authService.checkUserVerification(email);
            if (status.verified()) {
                log.info("resend skipped, already verified userId={}", status.userId());
                return;
            }
            issue(status.userId(), email);
        } catch (AuthException e) {
            if (e.code() == AuthErrorCode.USER_NOT_FOUND) {
                log.info("resend requested for unknown address");
            } else {
                log.warn("resend failed code={}: {}", e.code(), e.getMessage());
            }
        }
    }

    static String trimSlash(String base) {
        if (base == null) return "";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
