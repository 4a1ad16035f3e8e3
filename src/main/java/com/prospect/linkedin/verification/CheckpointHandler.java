package com.prospect.linkedin.verification;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.enums.LoginState;
import com.prospect.linkedin.enums.VerificationStatus;
import com.prospect.linkedin.exception.CheckpointRequiredException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.model.VerificationResult;
import com.prospect.linkedin.model.VerificationStatusReport;
import com.prospect.linkedin.service.AccountHealthService;
import com.prospect.linkedin.service.HumanBehaviorSimulator;
import com.prospect.linkedin.session.SessionManager;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads where a login landed and drives the one-time-code flow when LinkedIn asks for one.
 *
 * Flow:
 *   classify()               -> LOGGING_IN resolved to SUCCESS / LOGIN_FAILED / EMAIL_VERIFICATION_PENDING / PERMANENT_CHECKPOINT
 *   beginVerification()      -> park the page in the registry, hand an id to the caller
 *   submitVerificationCode() -> type the code into the parked page and re-classify
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckpointHandler {

    static final String SESSION_NOT_FOUND = "Session not found or expired";
    static final String INVALID_CODE = "Invalid verification code";
    static final String NO_ATTEMPTS_LEFT = "Invalid code - no attempts remaining";
    static final String ACCOUNT_LOCKED = "Account requires manual verification";
    static final String IN_PROGRESS = "Verification already in progress";

    private static final List<String> VERIFICATION_MARKERS = Arrays.asList(
            "input[name='pin']",
            "#input__email_verification_pin",
            "text=/verification code/i"
    );

    private static final List<String> LOGIN_ERROR_MARKERS = Arrays.asList(
            "#error-for-password",
            "#error-for-username",
            ".form__label--error"
    );

    private static final String CODE_INPUT = "input[name='pin'], #input__email_verification_pin";
    private static final String CODE_SUBMIT = "button[type='submit'], button[data-litms-control-urn*='verify']";

    private final VerificationSessionRegistry registry;
    private final SessionManager sessionManager;
    private final AccountHealthService accountHealthService;
    private final HumanBehaviorSimulator simulator;
    private final ScraperConfig scraperConfig;
    private final RateLimitConfig rateLimitConfig;
    private final ScrapeFlowLogger flowLogger;
    private final Clock clock;

    // ==================== CLASSIFICATION ====================

    /**
     * Resolve a just-submitted login form.
     */
    public LoginState classify(Page page, String emailHash) {
        LoginState state = LoginState.LOGGING_IN;
        String url = safeUrl(page);

        if (isChallengeUrl(url)) {
            state = advance(state, LoginState.CHECKPOINT_CHALLENGE, emailHash);
            return advance(state, refineChallenge(page), emailHash);
        }
        if (url.contains("/login") || anyPresent(page, LOGIN_ERROR_MARKERS)) {
            return advance(state, LoginState.LOGIN_FAILED, emailHash);
        }
        return advance(state, LoginState.SUCCESS, emailHash);
    }

    /**
     * Resolve a page after a verification code was submitted on it.
     */
    LoginState reclassify(Page page, String emailHash) {
        LoginState state = LoginState.EMAIL_VERIFICATION_PENDING;
        if (isChallengeUrl(safeUrl(page))) {
            return advance(state, refineChallenge(page), emailHash);
        }
        return advance(state, LoginState.SUCCESS, emailHash);
    }

    private LoginState refineChallenge(Page page) {
        return anyPresent(page, VERIFICATION_MARKERS)
                ? LoginState.EMAIL_VERIFICATION_PENDING
                : LoginState.PERMANENT_CHECKPOINT;
    }

    private LoginState advance(LoginState from, LoginState to, String emailHash) {
        LoginState next = from.transitionTo(to);
        flowLogger.logLoginTransition(emailHash, from, next);
        return next;
    }

    static boolean isChallengeUrl(String url) {
        return url.contains("/checkpoint") || url.contains("/challenge");
    }

    // ==================== VERIFICATION FLOW ====================

    /**
     * Park the page for a later code submission. The caller must not close the page or context after this.
     *
     * @return the verification session id
     */
    public String beginVerification(String userId, String accountEmail, String credentialId, String profileUrl,
                                    String userAgent, Page page, BrowserContext context) {
        Instant now = clock.instant();
        VerificationSession session = VerificationSession.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .accountEmail(accountEmail)
                .credentialId(credentialId)
                .profileUrl(profileUrl)
                .userAgent(userAgent)
                .createdAt(now)
                .expiresAt(now.plusMillis(scraperConfig.getVerificationTtlMs()))
                .page(page)
                .context(context)
                .attemptsRemaining(scraperConfig.getVerificationMaxAttempts())
                .build();

        registry.register(session);
        flowLogger.logVerificationPending(session.getId(), userId);
        return session.getId();
    }

    /**
     * Browser thread only.
     */
    public VerificationResult submitVerificationCode(String verificationSessionId, String code) {
        Optional<VerificationSession> found = registry.getPending(verificationSessionId);
        if (found.isEmpty()) {
            flowLogger.logVerificationResult(verificationSessionId, false, SESSION_NOT_FOUND);
            return VerificationResult.failed(SESSION_NOT_FOUND, null);
        }

        VerificationSession session = found.get();
        if (!session.getLock().tryLock()) {
            return VerificationResult.failed(IN_PROGRESS, session.getAttemptsRemaining());
        }
        try {
            if (!session.isPending()) {
                return VerificationResult.failed(SESSION_NOT_FOUND, null);
            }
            if (session.getAttemptsRemaining() <= 0) {
                registry.finish(session, VerificationStatus.FAILED);
                return VerificationResult.failed(NO_ATTEMPTS_LEFT, 0);
            }
            return submit(session, code);
        } finally {
            session.getLock().unlock();
        }
    }

    private VerificationResult submit(VerificationSession session, String code) {
        Page page = session.getPage();
        String emailHash = IdentityHash.of(session.getAccountEmail());
        long started = clock.millis();

        try {
            Locator input = page.locator(CODE_INPUT).first();
            input.click();
            simulator.hesitate();
            simulator.typeHumanLike(input, code == null ? "" : code.trim());
            simulator.pause(300, 700);
            page.locator(CODE_SUBMIT).first().click();
            page.waitForLoadState(LoadState.DOMCONTENTLOADED,
                    new Page.WaitForLoadStateOptions().setTimeout(scraperConfig.getVerificationSubmitTimeoutMs()));
        } catch (PlaywrightException e) {
            // classification below decides what the page state means
            log.warn("Verification submit for {} did not settle: {}", session.getId(), e.getMessage());
        }

        LoginState state = reclassify(page, emailHash);
        long latency = clock.millis() - started;

        switch (state) {
            case SUCCESS -> {
                RuntimeException failure = null;
                try {
                    sessionManager.saveSession(session.getContext().cookies(), session.getUserAgent(),
                            session.getCredentialId());
                } catch (RuntimeException e) {
                    failure = e;
                    throw e;
                } finally {
                    boolean saved = failure == null;
                    registry.finish(session, saved ? VerificationStatus.COMPLETED : VerificationStatus.FAILED);
                    flowLogger.logVerificationResult(session.getId(), saved, saved ? null : failure.getMessage());
                    accountHealthService.logRequest(session.getUserId(), session.getAccountEmail(),
                            session.getProfileUrl(), saved, latency, failure);
                }
                return VerificationResult.ok();
            }
            case PERMANENT_CHECKPOINT -> {
                sessionManager.invalidateSession(session.getAccountEmail());
                accountHealthService.logRequest(session.getUserId(), session.getAccountEmail(),
                        session.getProfileUrl(), false, latency,
                        new CheckpointRequiredException(rateLimitConfig.getCheckpointCooldownMs()));
                registry.finish(session, VerificationStatus.FAILED);
                flowLogger.logVerificationResult(session.getId(), false, ACCOUNT_LOCKED);
                return VerificationResult.failed(ACCOUNT_LOCKED, 0);
            }
            default -> {
                int remaining = session.getAttemptsRemaining() - 1;
                session.setAttemptsRemaining(remaining);
                if (remaining <= 0) {
                    registry.finish(session, VerificationStatus.FAILED);
                    flowLogger.logVerificationResult(session.getId(), false, NO_ATTEMPTS_LEFT);
                    return VerificationResult.failed(NO_ATTEMPTS_LEFT, 0);
                }
                flowLogger.logVerificationResult(session.getId(), false, INVALID_CODE);
                return VerificationResult.failed(INVALID_CODE, remaining);
            }
        }
    }

    public Optional<VerificationStatusReport> getStatus(String verificationSessionId) {
        return registry.get(verificationSessionId).map(s -> VerificationStatusReport.builder()
                .verificationSessionId(s.getId())
                .status(s.getStatus())
                .attemptsRemaining(s.getAttemptsRemaining())
                .expiresAt(s.getExpiresAt())
                .build());
    }

    // ==================== HELPERS ====================

    private static String safeUrl(Page page) {
        String url = page.url();
        return url != null ? url : "";
    }

    private static boolean anyPresent(Page page, List<String> selectors) {
        for (String selector : selectors) {
            try {
                if (page.locator(selector).count() > 0) {
                    return true;
                }
            } catch (PlaywrightException e) {
                log.debug("Selector {} not evaluable: {}", selector, e.getMessage());
            }
        }
        return false;
    }
}
