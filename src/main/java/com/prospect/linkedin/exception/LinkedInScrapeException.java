package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;
import lombok.Getter;

/**
 * Root of every failure surfaced by the scraper core.
 * <p>
 * Callers branch on the concrete type or on {@link #getCode()}; the message is for humans only.
 * The checkpoint flag is fixed when the exception is created so downstream logging never has to
 * re-parse message text.
 */
@Getter
public abstract class LinkedInScrapeException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;
    private final Long retryAfterMs;
    private final String userAction;

    protected LinkedInScrapeException(ErrorCode code, String message, boolean retryable,
                                      Long retryAfterMs, String userAction) {
        this(code, message, retryable, retryAfterMs, userAction, null);
    }

    protected LinkedInScrapeException(ErrorCode code, String message, boolean retryable,
                                      Long retryAfterMs, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
        this.retryAfterMs = retryAfterMs;
        this.userAction = userAction;
    }

    public boolean isCheckpoint() {
        return false;
    }
}
