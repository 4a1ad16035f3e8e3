package com.prospect.linkedin.controller;

import com.prospect.linkedin.exception.EmailVerificationRequiredException;
import com.prospect.linkedin.exception.LinkedInScrapeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Maps the typed scraper failures onto HTTP statuses and the shared error body.
 */
@Slf4j
@RestControllerAdvice(basePackages = "com.prospect.linkedin.controller")
public class LinkedInExceptionAdvice {

    @ExceptionHandler(LinkedInScrapeException.class)
    public ResponseEntity<Map<String, Object>> handleScrapeException(LinkedInScrapeException e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", e.getCode().name());
        error.put("message", e.getMessage());
        error.put("retryable", e.isRetryable());
        if (e.getRetryAfterMs() != null) {
            error.put("retryAfterMs", e.getRetryAfterMs());
        }
        if (e.getUserAction() != null) {
            error.put("userAction", e.getUserAction());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        if (e instanceof EmailVerificationRequiredException verification) {
            body.put("verificationSessionId", verification.getVerificationSessionId());
        }

        HttpStatus status = e.getCode().getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getCode(), e.getMessage());
        } else {
            log.info("Request ended with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException e) {
        if (e.getCause() instanceof LinkedInScrapeException cause) {
            return handleScrapeException(cause);
        }
        return handleGeneric(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", Map.of("code", "VALIDATION_FAILED", "message", "Malformed request body", "retryable", false)
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", Map.of("code", "INTERNAL_ERROR", "message", "Unexpected error", "retryable", false)
        ));
    }
}
