package com.authgate.backend.auth.web;

import com.authgate.backend.common.guard.RateLimitedException;
import com.authgate.backend.common.web.ApiExceptionHandler;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "com.authgate.backend")
public class AuthExceptionAdvice {

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, Object>> handleAuth(AuthException ex, HttpServletRequest req) {
        AuthErrorCode code = ex.code();
        HttpStatus status = statusOf(code);
        String message;
        if (code.kind() == AuthErrorCode.Kind.INTERNAL) {
            log.error("auth failure code={} path={}", code, req.getRequestURI(), ex);
            message = (code == AuthErrorCode.TIMEOUT) ? "Upstream timed out" : "Internal error";
        } else {
            log.info("auth rejected code={} path={}", code, req.getRequestURI());
            message = ex.getMessage();
        }
        return ResponseEntity.status(status).body(ApiExceptionHandler.body(code.name(), message, req));
    }

    @ExceptionHandler({QueryTimeoutException.class, TransactionTimedOutException.class})
    public ResponseEntity<Map<String, Object>> handleTimeout(Exception ex, HttpServletRequest req) {
        log.warn("deadline exceeded path={}: {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiExceptionHandler.body(AuthErrorCode.TIMEOUT.name(), "Upstream timed out", req));
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfterSec()))
                .body(ApiExceptionHandler.body("RATE_LIMITED", ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "VALIDATION_FAILED"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(ApiExceptionHandler.body("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex, HttpServletRequest req) {
        String msg = (ex instanceof MissingServletRequestParameterException m)
                ? m.getParameterName() + " is required"
                : "Malformed request body";
        return ResponseEntity.badRequest().body(ApiExceptionHandler.body("VALIDATION_FAILED", msg, req));
    }

    static HttpStatus statusOf(AuthErrorCode code) {
        return switch (code) {
            case USER_NOT_FOUND, MAGIC_LINK_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_APP_ID -> HttpStatus.BAD_REQUEST;
            case USER_ALREADY_EXISTS, MAGIC_LINK_ALREADY_USED -> HttpStatus.CONFLICT;
            case INVALID_CREDENTIALS, INVALID_TOKEN -> HttpStatus.UNAUTHORIZED;
            case EMAIL_NOT_VERIFIED -> HttpStatus.FORBIDDEN;
            case TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
