package com.authgate.backend.notify;

/**
 * Queue payload for one outbound email. Serialized as JSON onto the mail queue.
 *
 * @param purpose {@link #PURPOSE_EMAIL_VERIFICATION} or {@link #PURPOSE_TWO_FACTOR}
 */
public record EmailJob(String to, String link, String subject, String purpose) {

    public static final String PURPOSE_EMAIL_VERIFICATION = "email_verification";
    public static final String PURPOSE_TWO_FACTOR = "2fa";

    public static EmailJob emailVerification(String to, String link) {
        return new EmailJob(to, link, "Confirm your email address", PURPOSE_EMAIL_VERIFICATION);
    }

    public static EmailJob twoFactor(String to, String link) {
        return new EmailJob(to, link, "Your sign-in link", PURPOSE_TWO_FACTOR);
    }
}
