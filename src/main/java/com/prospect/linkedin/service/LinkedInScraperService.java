package com.prospect.linkedin.service;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.enums.LoginState;
import com.prospect.linkedin.enums.RateLimitDenial;
import com.prospect.linkedin.exception.CheckpointRequiredException;
import com.prospect.linkedin.exception.EmailVerificationRequiredException;
import com.prospect.linkedin.exception.LinkedInScrapeException;
import com.prospect.linkedin.exception.LoginFailedException;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.exception.RateLimitExceededException;
import com.prospect.linkedin.exception.ScrapingFailedException;
import com.prospect.linkedin.exception.ValidationException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.manager.BrowserManager;
import com.prospect.linkedin.manager.ProfileManager;
import com.prospect.linkedin.model.DecryptedCredential;
import com.prospect.linkedin.model.RateLimitDecision;
import com.prospect.linkedin.model.ScrapeOptions;
import com.prospect.linkedin.model.ScrapedProfile;
import com.prospect.linkedin.model.SessionPayload;
import com.prospect.linkedin.model.VerificationResult;
import com.prospect.linkedin.model.profile.UserAgentProfile;
import com.prospect.linkedin.session.SessionManager;
import com.prospect.linkedin.utils.IdentityHash;
import com.prospect.linkedin.utils.ProfileExtractor;
import com.prospect.linkedin.verification.CheckpointHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Scrapes one LinkedIn profile on behalf of a user.
 *
 * Flow:
 *   validate + resolve credentials   (caller thread, no browser)
 *   rate limiter admission           (caller thread, no browser, no request log)
 *   context -> session or login -> navigate -> extract   (browser thread)
 *   cleanup + request log            (every exit after admission)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkedInScraperService {

    private final CredentialVault credentialVault;
    private final AccountHealthService accountHealthService;
    private final SessionManager sessionManager;
    private final BrowserManager browserManager;
    private final ProfileManager profileManager;
    private final LinkedInLoginFlow loginFlow;
    private final CheckpointHandler checkpointHandler;
    private final HumanBehaviorSimulator simulator;
    private final ProfileExtractor profileExtractor;
    private final ScraperConfig scraperConfig;
    private final RateLimitConfig rateLimitConfig;
    private final ScrapeFlowLogger flowLogger;
    private final Clock clock;

    private record ScrapeAccount(String credentialId, String email, String password) {
    }

    public CompletableFuture<ScrapedProfile> scrapeProfile(String profileUrl, ScrapeOptions options) {
        ScrapeAccount account;
        try {
            account = admit(profileUrl, options);
        } catch (LinkedInScrapeException e) {
            return CompletableFuture.failedFuture(e);
        }

        flowLogger.logScrapeStart(options.getUserId(), profileUrl);
        return browserManager.submit(() -> runPipeline(profileUrl, options, account));
    }

    public CompletableFuture<VerificationResult> submitVerificationCode(String verificationSessionId, String code) {
        if (isBlank(verificationSessionId) || isBlank(code)) {
            return CompletableFuture.failedFuture(
                    new ValidationException("verificationSessionId and code are required"));
        }
        return browserManager.submit(() -> checkpointHandler.submitVerificationCode(verificationSessionId, code));
    }

    // ==================== ADMISSION ====================

    private ScrapeAccount admit(String profileUrl, ScrapeOptions options) {
        if (options == null || isBlank(options.getUserId())) {
            throw new ValidationException("userId is required");
        }
        if (isBlank(profileUrl)) {
            throw new ValidationException("profileUrl is required");
        }

        String userId = options.getUserId();
        ScrapeAccount account = resolveAccount(userId, options);

        RateLimitDecision decision = accountHealthService.canMakeRequest(userId);
        if (!decision.isAllowed()) {
            if (decision.getDenial() == RateLimitDenial.NO_CREDENTIALS) {
                throw new NoCredentialsException(decision.getReason());
            }
            long wait = decision.getWaitTimeMs() != null ? decision.getWaitTimeMs() : 0L;
            throw new RateLimitExceededException(decision.getDenial(), decision.getReason(), wait);
        }
        return account;
    }

    /**
     * Health, sessions and the request log are all keyed by the linked account's hash, so inline
     * credentials may only override the stored password for that same account.
     */
    private ScrapeAccount resolveAccount(String userId, ScrapeOptions options) {
        if (!isBlank(options.getEmail()) && !isBlank(options.getPassword())) {
            LinkedInCredential linked = credentialVault.findActive(userId)
                    .orElseThrow(() -> new NoCredentialsException(
                            "No LinkedIn account is linked for this user. Store credentials before scraping."));
            if (!IdentityHash.of(options.getEmail()).equals(linked.getEmailHash())) {
                throw new ValidationException("Supplied email does not match the LinkedIn account linked to this user");
            }
            return new ScrapeAccount(linked.getId(), IdentityHash.normalize(options.getEmail()), options.getPassword());
        }
        DecryptedCredential stored = credentialVault.retrieve(userId);
        return new ScrapeAccount(stored.getCredentialId(), stored.getEmail(), stored.getPassword());
    }

    // ==================== PIPELINE ====================

    private ScrapedProfile runPipeline(String profileUrl, ScrapeOptions options, ScrapeAccount account) {
        String userId = options.getUserId();
        String emailHash = IdentityHash.of(account.email());
        int timeout = options.getTimeoutMs() != null ? options.getTimeoutMs() : scraperConfig.getNavigationTimeoutMs();
        long started = clock.millis();

        BrowserContext context = null;
        Page page = null;
        boolean handedOff = false;
        String sessionType = "none";
        LinkedInScrapeException failure = null;

        try {
            UserAgentProfile fingerprint = profileManager.randomProfile();
            context = browserManager.newStealthContext(fingerprint);
            page = context.newPage();

            String restored = restoreSession(context, page, account);
            if (restored != null) {
                sessionType = restored;
            } else {
                LoginState state = loginFlow.login(page, account.email(), account.password(), emailHash);
                switch (state) {
                    case SUCCESS -> {
                        sessionManager.saveSession(context.cookies(), fingerprint.getUserAgent(), account.credentialId());
                        sessionType = "fresh";
                    }
                    case LOGIN_FAILED -> throw new LoginFailedException("Invalid email or password");
                    case PERMANENT_CHECKPOINT -> {
                        sessionManager.invalidateSession(account.email());
                        throw new CheckpointRequiredException(rateLimitConfig.getCheckpointCooldownMs());
                    }
                    case EMAIL_VERIFICATION_PENDING -> {
                        String id = checkpointHandler.beginVerification(userId, account.email(), account.credentialId(),
                                profileUrl, fingerprint.getUserAgent(), page, context);
                        handedOff = true;
                        throw new EmailVerificationRequiredException(id);
                    }
                    default -> throw new IllegalStateException("Unresolved login state " + state);
                }
            }

            simulator.hesitate();
            page.navigate(profileUrl, new Page.NavigateOptions()
                    .setTimeout(timeout)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));

            String landed = page.url() != null ? page.url() : "";
            if (landed.contains("/checkpoint") || landed.contains("/authwall")) {
                sessionManager.invalidateSession(account.email());
                throw new CheckpointRequiredException(
                        "LinkedIn redirected the profile request to a checkpoint",
                        rateLimitConfig.getCheckpointCooldownMs());
            }

            simulator.moveMouse(page, 3);
            simulator.scroll(page);
            profileExtractor.waitForProfileSections(page);

            ScrapedProfile profile = profileExtractor.extract(page, profileUrl, clock.instant());
            simulator.read(length(profile.getName()) + length(profile.getTitle()) + length(profile.getBio()));
            return profile;

        } catch (LinkedInScrapeException e) {
            failure = e;
            throw e;
        } catch (RuntimeException e) {
            failure = new ScrapingFailedException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
            throw failure;
        } finally {
            if (!handedOff) {
                closePage(page);
                browserManager.closeQuietly(context);
            }

            long latency = clock.millis() - started;
            flowLogger.logScrapingAttempt(profileUrl, userId, failure == null, latency, sessionType);
            try {
                accountHealthService.logRequest(userId, account.email(), profileUrl, failure == null, latency, failure);
            } catch (RuntimeException e) {
                log.error("Failed to record request outcome for user {}", userId, e);
            }
        }
    }

    /**
     * @return "cached" when a stored session was installed and accepted, otherwise null
     */
    private String restoreSession(BrowserContext context, Page page, ScrapeAccount account) {
        Optional<SessionPayload> cached = sessionManager.loadSession(account.email());
        if (cached.isEmpty()) {
            return null;
        }

        sessionManager.applySession(context, cached.get());
        if (rateLimitConfig.isValidateCookieBeforeUse()
                && !sessionManager.validateSession(page, scraperConfig.getSessionValidationTimeoutMs())) {
            sessionManager.invalidateSession(account.email());
            context.clearCookies();
            return null;
        }
        return "cached";
    }

    private static void closePage(Page page) {
        if (page == null) {
            return;
        }
        try {
            page.close();
        } catch (PlaywrightException e) {
            log.debug("Page already closed: {}", e.getMessage());
        }
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
