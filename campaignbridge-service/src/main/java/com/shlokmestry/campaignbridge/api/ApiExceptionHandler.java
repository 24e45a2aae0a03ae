package com.shlokmestry.campaignbridge.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.shlokmestry.campaignbridge.provider.ProviderException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorBody> rateLimited(RateLimitExceededException e) {
        String retryAfter = String.valueOf(e.retryAfterSeconds());

        HttpHeaders h = new HttpHeaders();
        h.set("RateLimit-Limit", String.valueOf(e.limit()));
        h.set("RateLimit-Remaining", "0");
        h.set("RateLimit-Reset", retryAfter);
        h.set(HttpHeaders.RETRY_AFTER, retryAfter);

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(h)
                .body(new ErrorBody("rate_limit_exceeded", e.getMessage()));
    }

    @ExceptionHandler(NotAuthenticatedException.class)
    public ResponseEntity<ErrorBody> notAuthenticated(NotAuthenticatedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorBody("rate_limit_no_user", "User not authenticated"));
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorBody> provider(ProviderException e) {
        if (e.status() >= 500) {
            log.warn("provider error code={} status={}", e.code(), e.status(), e);
        } else {
            log.info("provider reject code={} status={} message={}", e.code(), e.status(), e.getMessage());
        }
        return ResponseEntity.status(e.status())
                .body(new ErrorBody(e.code(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorBody> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.badRequest()
                .body(new ErrorBody("invalid_request", message));
    }
}
