package com.prospect.linkedin.verification;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.prospect.linkedin.enums.VerificationStatus;
import com.prospect.linkedin.manager.BrowserManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory table of paused logins keyed by verification session id.
 * <p>
 * Finished entries stay queryable (without their page) until they expire; the sweep then drops them.
 * Pages are always closed on the browser thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationSessionRegistry {

    private final BrowserManager browserManager;
    private final Clock clock;

    private final ConcurrentMap<String, VerificationSession> sessions = new ConcurrentHashMap<>();

    public void register(VerificationSession session) {
        sessions.put(session.getId(), session);
        log.info("Verification session {} registered, expires at {}", session.getId(), session.getExpiresAt());
    }

    /**
     * Any entry that has not yet expired, whatever its status.
     */
    public Optional<VerificationSession> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        VerificationSession session = sessions.get(id);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(clock.instant())) {
            expire(session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * A pending, unexpired entry: the only kind a code can be submitted against.
     */
    public Optional<VerificationSession> getPending(String id) {
        return get(id).filter(VerificationSession::isPending);
    }

    /**
     * Settle an entry with a final status and release its browser resources. The entry stays
     * readable until it expires.
     */
    public void finish(VerificationSession session, VerificationStatus status) {
        session.setStatus(status);
        closeResources(session);
    }

    public void remove(String id) {
        VerificationSession session = sessions.remove(id);
        if (session != null) {
            closeResources(session);
        }
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${linkedin.verification.sweep-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        int expired = 0;
        for (VerificationSession session : sessions.values()) {
            if (session.isExpired(now)) {
                expire(session);
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Swept {} expired verification session(s), {} remaining", expired, sessions.size());
        }
    }

    private void expire(VerificationSession session) {
        if (sessions.remove(session.getId(), session)) {
            if (session.isPending()) {
                session.setStatus(VerificationStatus.EXPIRED);
                log.info("Verification session {} expired", session.getId());
            }
            closeResources(session);
        }
    }

    private void closeResources(VerificationSession session) {
        Page page = session.getPage();
        session.setPage(null);
        BrowserContext context = session.getContext();
        session.setContext(null);
        if (page == null && context == null) {
            return;
        }

        browserManager.executor().execute(() -> {
            if (page != null) {
                try {
                    page.close();
                } catch (PlaywrightException e) {
                    log.debug("Verification page already closed: {}", e.getMessage());
                }
            }
            browserManager.closeQuietly(context);
        });
    }
}
