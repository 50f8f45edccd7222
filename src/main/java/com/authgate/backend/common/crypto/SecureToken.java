package com.authgate.backend.common.crypto;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class SecureToken {

    /** 32 bytes -> 64 hex chars, still below the 72-byte input limit of BCrypt. */
    public static final int REFRESH_TOKEN_BYTES = 32;

    private static final SecureRandom RNG = new SecureRandom();

    private SecureToken() {}

    public static String newRefreshToken() {
        return newHex(REFRESH_TOKEN_BYTES);
    }

    public static String newHex(int bytes) {
        byte[] b = new byte[bytes];
        RNG.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }
}
