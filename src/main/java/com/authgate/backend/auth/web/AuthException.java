package com.authgate.backend.auth.web;

public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthErrorCode code() {
        return code;
    }

    public AuthErrorCode.Kind kind() {
        return code.kind();
    }

    public static AuthException of(AuthErrorCode code) {
        return new AuthException(code, code.name());
    }
}
