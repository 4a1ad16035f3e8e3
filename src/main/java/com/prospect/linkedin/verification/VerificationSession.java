package com.prospect.linkedin.verification;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.prospect.linkedin.enums.VerificationStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A login paused on LinkedIn's "enter the code we emailed you" screen. Holds the live page until the
 * code arrives, the attempts run out or the entry expires.
 */
@Getter
@Setter
@Builder
@ToString(exclude = {"page", "context", "lock", "accountEmail"})
public class VerificationSession {

    private final String id;
    private final String userId;
    private final String accountEmail;
    private final String credentialId;
    private final String profileUrl;
    private final String userAgent;
    private final Instant createdAt;
    private final Instant expiresAt;

    private Page page;
    private BrowserContext context;

    @Builder.Default
    private final ReentrantLock lock = new ReentrantLock();

    private volatile int attemptsRemaining;

    @Builder.Default
    private volatile VerificationStatus status = VerificationStatus.PENDING;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isPending() {
        return status == VerificationStatus.PENDING;
    }
}
