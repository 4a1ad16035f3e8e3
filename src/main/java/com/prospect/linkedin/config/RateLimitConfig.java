package com.prospect.linkedin.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Per-account usage envelope. Conservative on purpose: there is no proxy pool behind this scraper,
 * so request cadence is the only thing standing between an account and a checkpoint.
 */
@Data
@Configuration
public class RateLimitConfig {

    // ==================== REQUEST SPACING ====================

    @Value("${linkedin.rate-limit.min-delay-ms:90000}")
    private long minDelayBetweenRequestsMs = 90_000;

    @Value("${linkedin.rate-limit.max-delay-ms:150000}")
    private long maxDelayBetweenRequestsMs = 150_000;

    // ==================== THROUGHPUT ====================

    @Value("${linkedin.rate-limit.max-profiles-per-hour:20}")
    private int maxProfilesPerHour = 20;

    @Value("${linkedin.rate-limit.max-profiles-per-day:100}")
    private int maxProfilesPerDay = 100;

    // ==================== COOLDOWNS ====================

    @Value("${linkedin.rate-limit.session-cooldown-ms:3600000}")
    private long sessionCooldownMs = 3_600_000;

    @Value("${linkedin.rate-limit.checkpoint-cooldown-ms:86400000}")
    private long checkpointCooldownMs = 86_400_000;

    @Value("${linkedin.rate-limit.max-consecutive-failures:3}")
    private int maxConsecutiveFailures = 3;

    // ==================== SESSIONS ====================

    @Value("${linkedin.rate-limit.cookie-max-age-ms:86400000}")
    private long cookieMaxAgeMs = 86_400_000;

    @Value("${linkedin.rate-limit.validate-cookie-before-use:true}")
    private boolean validateCookieBeforeUse = true;
}
