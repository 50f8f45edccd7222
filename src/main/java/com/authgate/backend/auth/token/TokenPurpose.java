package com.authgate.backend.auth.token;

/** Value of the {@code purpose} claim; a token only verifies for the purpose it was minted for. */
public enum TokenPurpose {
    ACCESS("access"),
    EMAIL_VERIFICATION("email_verification"),
    TWO_FACTOR("2fa");

    private final String claimValue;

    TokenPurpose(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
