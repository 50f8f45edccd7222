package com.authgate.backend.auth.store;

import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * A storage call failed for infrastructure reasons. Carries the operation name so logs say
 * which call broke; the message never contains row data.
 */
public class CredentialStoreException extends AuthException {

    private final String operation;

    private CredentialStoreException(AuthErrorCode code, String operation, Throwable cause) {
        super(code, "store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public static CredentialStoreException wrap(String operation, Throwable cause) {
        boolean timedOut = cause instanceof QueryTimeoutException
                || cause instanceof TransactionTimedOutException;
        return new CredentialStoreException(
                timedOut ? AuthErrorCode.TIMEOUT : AuthErrorCode.INTERNAL_ERROR, operation, cause);
    }

    public String operation() {
        return operation;
    }
}
