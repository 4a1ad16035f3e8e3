package com.prospect.linkedin.service;

import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.entity.AccountHealth;
import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.entity.RequestLog;
import com.prospect.linkedin.enums.RateLimitDenial;
import com.prospect.linkedin.exception.EmailVerificationRequiredException;
import com.prospect.linkedin.exception.LinkedInScrapeException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.model.AccountHealthReport;
import com.prospect.linkedin.model.RateLimitDecision;
import com.prospect.linkedin.model.RateLimitStats;
import com.prospect.linkedin.repository.AccountHealthRepository;
import com.prospect.linkedin.repository.RequestLogRepository;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Admission control and health bookkeeping per LinkedIn account.
 *
 * Flow:
 *   canMakeRequest()  -> evaluated before any browser work, first failing rule wins
 *   logRequest()      -> called once per admitted attempt, whatever the outcome
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountHealthService {

    static final long HOUR_MS = Duration.ofHours(1).toMillis();
    static final long DAY_MS = Duration.ofDays(1).toMillis();
    private static final int MAX_ERROR_LENGTH = 2048;

    private final RateLimitConfig rateLimitConfig;
    private final CredentialVault credentialVault;
    private final AccountHealthRepository healthRepository;
    private final RequestLogRepository requestLogRepository;
    private final ScrapeFlowLogger flowLogger;
    private final ObjectProvider<TelegramAlertService> alertService;
    private final HumanBehaviorSimulator simulator;
    private final Clock clock;

    /**
     * Rules, in order: active credential, cooldown, minimum spacing, hourly cap, daily cap.
     */
    @Transactional(readOnly = true)
    public RateLimitDecision canMakeRequest(String userId) {
        RateLimitDecision decision = evaluate(userId);
        flowLogger.logRateLimit(userId, decision.isAllowed(), decision.getReason(), decision.getWaitTimeMs());
        return decision;
    }

    private RateLimitDecision evaluate(String userId) {
        Optional<LinkedInCredential> credential = credentialVault.findActive(userId);
        if (credential.isEmpty()) {
            return RateLimitDecision.deny(RateLimitDenial.NO_CREDENTIALS, "No active LinkedIn credentials", null);
        }

        Instant now = clock.instant();

        Optional<AccountHealth> health = healthRepository.findByAccountEmailHash(credential.get().getEmailHash());
        if (health.isPresent() && health.get().isOnCooldown(now)) {
            long wait = Duration.between(now, health.get().getCooldownUntil()).toMillis();
            return RateLimitDecision.deny(RateLimitDenial.COOLDOWN, "Account is cooling down", wait);
        }

        Optional<RequestLog> last = requestLogRepository.findFirstByUserIdOrderByRequestTimeDesc(userId);
        if (last.isPresent()) {
            long elapsed = Duration.between(last.get().getRequestTime(), now).toMillis();
            long minDelay = rateLimitConfig.getMinDelayBetweenRequestsMs();
            if (elapsed < minDelay) {
                return RateLimitDecision.deny(RateLimitDenial.TOO_SOON,
                        "Too soon since last request", minDelay - elapsed);
            }
        }

        long lastHour = requestLogRepository.countByUserIdAndSuccessTrueAndRequestTimeGreaterThanEqual(
                userId, now.minusMillis(HOUR_MS));
        if (lastHour >= rateLimitConfig.getMaxProfilesPerHour()) {
            return RateLimitDecision.deny(RateLimitDenial.HOURLY_LIMIT,
                    "Hourly limit reached (" + rateLimitConfig.getMaxProfilesPerHour() + ")", HOUR_MS);
        }

        long lastDay = requestLogRepository.countByUserIdAndSuccessTrueAndRequestTimeGreaterThanEqual(
                userId, now.minusMillis(DAY_MS));
        if (lastDay >= rateLimitConfig.getMaxProfilesPerDay()) {
            return RateLimitDecision.deny(RateLimitDenial.DAILY_LIMIT,
                    "Daily limit reached (" + rateLimitConfig.getMaxProfilesPerDay() + ")", DAY_MS);
        }

        return RateLimitDecision.allow();
    }

    /**
     * Append the attempt to the request log and fold it into the account's health row.
     *
     * @param error the failure, or null on success. Its checkpoint flag drives the cooldown.
     */
    @Transactional
    public void logRequest(String userId, String email, String profileUrl, boolean success,
                           long latencyMs, Throwable error) {
        String emailHash = IdentityHash.of(email);
        Instant now = clock.instant();
        boolean checkpoint = error instanceof LinkedInScrapeException lse && lse.isCheckpoint();
        // parked for a code; the verification submit logs the real outcome
        boolean awaitingCode = error instanceof EmailVerificationRequiredException;

        requestLogRepository.save(RequestLog.builder()
                .userId(userId)
                .accountEmailHash(emailHash)
                .profileUrl(profileUrl != null ? profileUrl : "")
                .requestTime(now)
                .responseTimeMs(latencyMs)
                .success(success)
                .checkpointTriggered(checkpoint)
                .errorMessage(errorText(error))
                .build());

        AccountHealth health = healthRepository.findByAccountEmailHash(emailHash)
                .orElseGet(() -> AccountHealth.builder()
                        .accountEmailHash(emailHash)
                        .userId(userId)
                        .build());

        health.setUserId(userId);
        health.setTotalRequests(health.getTotalRequests() + 1);
        health.setLastRequestAt(now);

        if (awaitingCode) {
            log.debug("Attempt for {} parked for email verification, failure streak unchanged",
                    IdentityHash.shorten(emailHash));
        } else if (success) {
            health.setSuccessfulRequests(health.getSuccessfulRequests() + 1);
            health.setConsecutiveFailures(0);
            health.setLastSuccessAt(now);
        } else {
            health.setFailedRequests(health.getFailedRequests() + 1);
            health.setConsecutiveFailures(health.getConsecutiveFailures() + 1);
            health.setLastFailureAt(now);
        }

        if (checkpoint) {
            Instant until = now.plusMillis(rateLimitConfig.getCheckpointCooldownMs());
            health.setCheckpointCount(health.getCheckpointCount() + 1);
            health.setLastCheckpointAt(now);
            health.setCooldownUntil(until);
            health.setActive(false);
            flowLogger.logCheckpoint(userId, emailHash, profileUrl);
            alertService.ifAvailable(alerts -> alerts.sendCheckpointAlert(userId, emailHash, until));
        } else if (!success && !awaitingCode && health.getConsecutiveFailures() >= rateLimitConfig.getMaxConsecutiveFailures()) {
            Instant until = now.plusMillis(rateLimitConfig.getSessionCooldownMs());
            int failures = health.getConsecutiveFailures();
            health.setCooldownUntil(until);
            flowLogger.logAccountPaused(emailHash, failures, rateLimitConfig.getSessionCooldownMs());
            alertService.ifAvailable(alerts -> alerts.sendAccountPausedAlert(userId, emailHash, failures, until));
        }

        healthRepository.save(health);
    }

    @Transactional(readOnly = true)
    public RateLimitStats getRateLimitStats(String userId) {
        Instant now = clock.instant();
        long hour = requestLogRepository.countByUserIdAndSuccessTrueAndRequestTimeGreaterThanEqual(
                userId, now.minusMillis(HOUR_MS));
        long day = requestLogRepository.countByUserIdAndSuccessTrueAndRequestTimeGreaterThanEqual(
                userId, now.minusMillis(DAY_MS));
        Instant lastRequestAt = requestLogRepository.findFirstByUserIdOrderByRequestTimeDesc(userId)
                .map(RequestLog::getRequestTime)
                .orElse(null);

        Instant cooldownUntil = findHealth(userId)
                .map(AccountHealth::getCooldownUntil)
                .filter(until -> until.isAfter(now))
                .orElse(null);

        Instant nextAllowedAt = lastRequestAt != null
                ? lastRequestAt.plusMillis(rateLimitConfig.getMinDelayBetweenRequestsMs())
                : now;
        // jittered slot inside [min, max] spacing so batch callers do not fire on the exact earliest instant
        Instant suggestedAt = lastRequestAt != null ? lastRequestAt.plus(simulator.nextRequestDelay()) : now;
        if (cooldownUntil != null && cooldownUntil.isAfter(nextAllowedAt)) {
            nextAllowedAt = cooldownUntil;
        }
        if (suggestedAt.isBefore(nextAllowedAt)) {
            suggestedAt = nextAllowedAt;
        }

        return RateLimitStats.builder()
                .requestsThisHour(hour)
                .requestsToday(day)
                .maxPerHour(rateLimitConfig.getMaxProfilesPerHour())
                .maxPerDay(rateLimitConfig.getMaxProfilesPerDay())
                .lastRequestAt(lastRequestAt)
                .nextAllowedAt(nextAllowedAt)
                .suggestedNextRequestAt(suggestedAt)
                .cooldownUntil(cooldownUntil)
                .build();
    }

    /**
     * @return empty when the user has no credential or has never made a request
     */
    @Transactional(readOnly = true)
    public Optional<AccountHealthReport> getAccountHealth(String userId) {
        Instant now = clock.instant();
        return findHealth(userId).map(h -> AccountHealthReport.builder()
                .totalRequests(h.getTotalRequests())
                .successfulRequests(h.getSuccessfulRequests())
                .failedRequests(h.getFailedRequests())
                .checkpointCount(h.getCheckpointCount())
                .consecutiveFailures(h.getConsecutiveFailures())
                .successRate(rate(h.getSuccessfulRequests(), h.getTotalRequests()))
                .checkpointRate(rate(h.getCheckpointCount(), h.getTotalRequests()))
                .active(h.isActive())
                .onCooldown(h.isOnCooldown(now))
                .cooldownUntil(h.getCooldownUntil())
                .lastRequestAt(h.getLastRequestAt())
                .lastSuccessAt(h.getLastSuccessAt())
                .lastFailureAt(h.getLastFailureAt())
                .lastCheckpointAt(h.getLastCheckpointAt())
                .build());
    }

    @Transactional(readOnly = true)
    public List<RequestLog> getRequestHistory(String userId, int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(Math.max(hours, 1)));
        return requestLogRepository.findByUserIdAndRequestTimeGreaterThanEqualOrderByRequestTimeDesc(userId, since);
    }

    private Optional<AccountHealth> findHealth(String userId) {
        return credentialVault.findActive(userId)
                .flatMap(c -> healthRepository.findByAccountEmailHash(c.getEmailHash()));
    }

    private static double rate(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    private static String errorText(Throwable error) {
        if (error == null) {
            return null;
        }
        String text = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        text = ScrapeFlowLogger.redact(text);
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) : text;
    }
}
