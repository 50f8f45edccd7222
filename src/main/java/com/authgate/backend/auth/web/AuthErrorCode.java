package com.authgate.backend.auth.web;

/**
 * Caller-visible failure codes. Each one belongs to a coarse {@link Kind} so callers can
 * branch on the category without enumerating every code.
 */
public enum AuthErrorCode {
    USER_NOT_FOUND(Kind.NOT_FOUND),
    INVALID_APP_ID(Kind.NOT_FOUND),
    MAGIC_LINK_NOT_FOUND(Kind.NOT_FOUND),
    USER_ALREADY_EXISTS(Kind.ALREADY_EXISTS),
    INVALID_CREDENTIALS(Kind.INVALID_CREDENTIALS),
    MAGIC_LINK_ALREADY_USED(Kind.INVALID_CREDENTIALS),
    EMAIL_NOT_VERIFIED(Kind.UNVERIFIED),
    INVALID_TOKEN(Kind.INVALID_TOKEN),
    INTERNAL_ERROR(Kind.INTERNAL),
    TIMEOUT(Kind.INTERNAL);

    public enum Kind {
        NOT_FOUND,
        ALREADY_EXISTS,
        INVALID_CREDENTIALS,
        UNVERIFIED,
        INVALID_TOKEN,
        INTERNAL
    }

    private final Kind kind;

    AuthErrorCode(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
