package com.prospect.linkedin.controller;

import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.model.RateLimitStats;
import com.prospect.linkedin.model.ScrapeOptions;
import com.prospect.linkedin.model.ScrapedProfile;
import com.prospect.linkedin.model.VerificationResult;
import com.prospect.linkedin.model.request.CredentialRequest;
import com.prospect.linkedin.model.request.ScrapeRequest;
import com.prospect.linkedin.model.request.VerificationCodeRequest;
import com.prospect.linkedin.service.AccountHealthService;
import com.prospect.linkedin.service.CredentialVault;
import com.prospect.linkedin.service.LinkedInScraperService;
import com.prospect.linkedin.verification.CheckpointHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/linkedin")
public class LinkedInController {

    private final LinkedInScraperService scraperService;
    private final CredentialVault credentialVault;
    private final AccountHealthService accountHealthService;
    private final CheckpointHandler checkpointHandler;

    /**
     * Scrape one profile. Completes when the browser work is done; typed failures are mapped by
     * {@link LinkedInExceptionAdvice}.
     */
    @PostMapping("/scrape")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> scrape(@RequestBody ScrapeRequest request) {
        log.info("POST /api/v1/linkedin/scrape - user={} url={}", request.getUserId(), request.getProfileUrl());

        ScrapeOptions options = ScrapeOptions.builder()
                .userId(request.getUserId())
                .email(request.getEmail())
                .password(request.getPassword())
                .timeoutMs(request.getTimeoutMs())
                .build();

        return scraperService.scrapeProfile(request.getProfileUrl(), options)
                .thenApply(profile -> {
                    Map<String, Object> body = new HashMap<>();
                    body.put("success", true);
                    body.put("profile", profile);
                    return ResponseEntity.ok(body);
                });
    }

    @PostMapping("/verification-code")
    public CompletableFuture<ResponseEntity<VerificationResult>> submitVerificationCode(
            @RequestBody VerificationCodeRequest request) {
        log.info("POST /api/v1/linkedin/verification-code - session={}", request.getVerificationSessionId());
        return scraperService.submitVerificationCode(request.getVerificationSessionId(), request.getCode())
                .thenApply(ResponseEntity::ok);
    }

    @GetMapping("/verification/{id}")
    public ResponseEntity<?> verificationStatus(@PathVariable String id) {
        return checkpointHandler.getStatus(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of(
                        "success", false,
                        "error", Map.of("code", "NOT_FOUND", "message", "Session not found or expired"))));
    }

    @PutMapping("/credentials/{userId}")
    public ResponseEntity<Map<String, Object>> linkCredentials(@PathVariable String userId,
                                                               @RequestBody CredentialRequest request) {
        log.info("PUT /api/v1/linkedin/credentials/{}", userId);
        LinkedInCredential saved = credentialVault.store(userId, request.getEmail(), request.getPassword());

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("credentialId", saved.getId());
        body.put("linkedAt", saved.getLastValidatedAt());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/credentials/{userId}")
    public ResponseEntity<Map<String, Object>> revokeCredentials(@PathVariable String userId) {
        log.info("DELETE /api/v1/linkedin/credentials/{}", userId);
        boolean revoked = credentialVault.deactivate(userId);
        return ResponseEntity.ok(Map.of("success", revoked));
    }

    @GetMapping("/rate-limits/{userId}")
    public ResponseEntity<RateLimitStats> rateLimits(@PathVariable String userId) {
        return ResponseEntity.ok(accountHealthService.getRateLimitStats(userId));
    }

    @GetMapping("/account-health/{userId}")
    public ResponseEntity<?> accountHealth(@PathVariable String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now());
        accountHealthService.getAccountHealth(userId).ifPresentOrElse(
                report -> body.put("health", report),
                () -> body.put("message", "No activity recorded for this account"));
        return ResponseEntity.ok(body);
    }
}
