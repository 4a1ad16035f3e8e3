package com.prospect.linkedin.logservice;

import com.prospect.linkedin.enums.LoginState;
import com.prospect.linkedin.enums.SessionAction;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Centralized logger for scrape flow events.
 * Identity hashes are shortened and secrets are redacted before anything is written.
 */
@Slf4j
@Component
public class ScrapeFlowLogger {

    private static final String EMOJI_START = "🎯";
    private static final String EMOJI_KEY = "🔑";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_SESSION = "🍪";
    private static final String EMOJI_NAVIGATION = "🧭";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_CLOCK = "⏰";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_BLOCK = "🚫";
    private static final String EMOJI_MAIL = "📧";

    private static final Pattern[] SECRET_PATTERNS = {
            Pattern.compile("(?i)password[:\\s=]+\\S+"),
            Pattern.compile("(?i)cookie[:\\s=]+\\S+"),
            Pattern.compile("(?i)token[:\\s=]+\\S+"),
            Pattern.compile("(?i)authorization[:\\s=]+\\S+"),
            Pattern.compile("(?i)li_at=[^;\\s]+")
    };
    private static final String[] SECRET_REPLACEMENTS = {
            "password=[REDACTED]",
            "cookie=[REDACTED]",
            "token=[REDACTED]",
            "authorization=[REDACTED]",
            "li_at=[REDACTED]"
    };

    /**
     * Strip credentials and cookie values from free text
     */
    public static String redact(String message) {
        if (message == null) {
            return null;
        }
        String out = message;
        for (int i = 0; i < SECRET_PATTERNS.length; i++) {
            out = SECRET_PATTERNS[i].matcher(out).replaceAll(SECRET_REPLACEMENTS[i]);
        }
        return out;
    }

    // ==========================================
    // AUTH
    // ==========================================

    public void logAuthAttempt(String userId, String emailHash, boolean success, String detail) {
        if (success) {
            log.info("{} {} Auth | User: {} | Account: {} | {}",
                    EMOJI_SUCCESS, EMOJI_KEY, userId, IdentityHash.shorten(emailHash), redact(detail));
        } else {
            log.error("{} {} Auth failed | User: {} | Account: {} | {}",
                    EMOJI_ERROR, EMOJI_KEY, userId, IdentityHash.shorten(emailHash), redact(detail));
        }
    }

    public void logLoginTransition(String emailHash, LoginState from, LoginState to) {
        log.info("{} Login state {} -> {} | Account: {}", EMOJI_KEY, from, to, IdentityHash.shorten(emailHash));
    }

    // ==========================================
    // SESSIONS
    // ==========================================

    public void logSessionAction(SessionAction action, String emailHash, String detail) {
        log.info("{} Session {} | Account: {} | {}",
                EMOJI_SESSION, action, IdentityHash.shorten(emailHash), detail);
    }

    // ==========================================
    // RATE LIMITS
    // ==========================================

    public void logRateLimit(String userId, boolean allowed, String reason, Long waitTimeMs) {
        if (allowed) {
            log.debug("{} Rate limit passed | User: {}", EMOJI_CLOCK, userId);
        } else {
            log.info("{} {} Rate limited | User: {} | Reason: {} | Wait: {}ms",
                    EMOJI_CLOCK, EMOJI_WARNING, userId, reason, waitTimeMs);
        }
    }

    public void logCheckpoint(String userId, String emailHash, String profileUrl) {
        log.warn("{} {} Checkpoint triggered | User: {} | Account: {} | Url: {}",
                EMOJI_BLOCK, EMOJI_WARNING, userId, IdentityHash.shorten(emailHash), profileUrl);
    }

    public void logAccountPaused(String emailHash, int consecutiveFailures, long cooldownMs) {
        log.warn("{} {} Account paused after {} consecutive failures | Account: {} | Cooldown: {}ms",
                EMOJI_WARNING, EMOJI_CLOCK, consecutiveFailures, IdentityHash.shorten(emailHash), cooldownMs);
    }

    // ==========================================
    // SCRAPING
    // ==========================================

    public void logScrapeStart(String userId, String profileUrl) {
        log.info("{} {} Starting scrape | User: {} | Url: {}", EMOJI_START, EMOJI_NAVIGATION, userId, profileUrl);
    }

    public void logScrapingAttempt(String profileUrl, String userId, boolean success, Long durationMs, String sessionType) {
        if (success) {
            log.info("{} Scrape finished | User: {} | Url: {} | {}ms | Session: {}",
                    EMOJI_SUCCESS, userId, profileUrl, durationMs, sessionType);
        } else {
            log.warn("{} Scrape failed | User: {} | Url: {} | {}ms | Session: {}",
                    EMOJI_ERROR, userId, profileUrl, durationMs, sessionType);
        }
    }

    // ==========================================
    // VERIFICATION
    // ==========================================

    public void logVerificationPending(String sessionId, String userId) {
        log.info("{} Email verification pending | Session: {} | User: {}", EMOJI_MAIL, sessionId, userId);
    }

    public void logVerificationResult(String sessionId, boolean success, String detail) {
        if (success) {
            log.info("{} {} Verification completed | Session: {}", EMOJI_SUCCESS, EMOJI_MAIL, sessionId);
        } else {
            log.warn("{} {} Verification failed | Session: {} | {}", EMOJI_WARNING, EMOJI_MAIL, sessionId, detail);
        }
    }
}
