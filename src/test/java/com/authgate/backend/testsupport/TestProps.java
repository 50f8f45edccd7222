package com.authgate.backend.testsupport;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.twofactor.config.TwoFactorProperties;

/** Property objects filled the way application-test.yml fills them. */
public final class TestProps {

    private TestProps() {}

    public static AuthProperties auth() {
        AuthProperties p = new AuthProperties();
        p.setAccessSecret("test-access-secret-0123456789-abcdefghij");
        p.setVerificationSecret("test-verification-secret-0123456789-abcdef");
        p.setVerificationBaseUrl("http://auth.test");
        p.setBcryptStrength(4);
        return p;
    }

    public static TwoFactorProperties twoFactor() {
        TwoFactorProperties p = new TwoFactorProperties();
        p.setTokenSecret("test-two-factor-secret-0123456789-abcdefgh");
        p.setRedirectUrl("http://app.test/");
        return p;
    }
}
