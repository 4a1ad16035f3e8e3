package com.prospect.linkedin.session;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitUntilState;
import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.enums.SessionAction;
import com.prospect.linkedin.exception.NoCookiesException;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.model.SessionCookie;
import com.prospect.linkedin.model.SessionPayload;
import com.prospect.linkedin.repository.LinkedInCredentialRepository;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Saves, restores and revokes authenticated LinkedIn cookie jars.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    private final SessionStore sessionStore;
    private final LinkedInCredentialRepository credentialRepository;
    private final RateLimitConfig rateLimitConfig;
    private final ScrapeFlowLogger flowLogger;
    private final Clock clock;

    /**
     * Keep only well-formed linkedin.com cookies and persist them to both tiers.
     *
     * @throws NoCookiesException if no LinkedIn cookie survives filtering
     */
    public SessionPayload saveSession(List<Cookie> rawCookies, String userAgent, String credentialId) {
        String emailHash = credentialRepository.findById(credentialId)
                .orElseThrow(() -> new NoCredentialsException("Credential " + credentialId + " not found"))
                .getEmailHash();

        List<SessionCookie> cookies = rawCookies == null ? List.of() : rawCookies.stream()
                .map(SessionCookie::fromPlaywright)
                .flatMap(Optional::stream)
                .filter(c -> c.belongsTo(ScraperConfig.COOKIE_DOMAIN))
                .collect(Collectors.toList());

        if (cookies.isEmpty()) {
            throw new NoCookiesException(ScraperConfig.COOKIE_DOMAIN);
        }

        Instant now = clock.instant();
        SessionPayload payload = SessionPayload.builder()
                .cookies(cookies)
                .userAgent(userAgent)
                .savedAt(now)
                .expiresAt(now.plusMillis(rateLimitConfig.getCookieMaxAgeMs()))
                .build();

        sessionStore.save(emailHash, credentialId, payload);
        flowLogger.logSessionAction(SessionAction.CREATED, emailHash, cookies.size() + " cookies");
        return payload;
    }

    public Optional<SessionPayload> loadSession(String email) {
        String emailHash = IdentityHash.of(email);
        Optional<SessionPayload> payload = sessionStore.load(emailHash);
        payload.ifPresent(p -> flowLogger.logSessionAction(SessionAction.REUSED, emailHash,
                "saved at " + p.getSavedAt()));
        return payload;
    }

    public void invalidateSession(String email) {
        String emailHash = IdentityHash.of(email);
        sessionStore.invalidate(emailHash);
        flowLogger.logSessionAction(SessionAction.INVALIDATED, emailHash, "cleared from both tiers");
    }

    public void applySession(BrowserContext context, SessionPayload payload) {
        context.addCookies(payload.getCookies().stream()
                .map(SessionCookie::toPlaywright)
                .collect(Collectors.toList()));
    }

    /**
     * Open the feed with the installed cookies. A bounce to login, checkpoint or authwall means the
     * session is dead.
     */
    public boolean validateSession(Page page, int timeoutMs) {
        try {
            page.navigate(ScraperConfig.FEED_URL, new Page.NavigateOptions()
                    .setTimeout(timeoutMs)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            String url = page.url();
            boolean valid = !(url.contains("/login") || url.contains("/checkpoint") || url.contains("/authwall"));
            log.debug("Session validation landed on {} -> {}", url, valid ? "valid" : "invalid");
            return valid;
        } catch (PlaywrightException e) {
            log.warn("Session validation failed: {}", e.getMessage());
            return false;
        }
    }
}
