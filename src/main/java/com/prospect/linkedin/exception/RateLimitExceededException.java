package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;
import com.prospect.linkedin.enums.RateLimitDenial;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends LinkedInScrapeException {

    private final RateLimitDenial denial;

    public RateLimitExceededException(RateLimitDenial denial, String reason, long waitTimeMs) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded: " + reason,
                true,
                waitTimeMs,
                "Wait " + (long) Math.ceil(waitTimeMs / 1000.0) + " seconds before trying again.");
        this.denial = denial;
    }

    public long getWaitTimeMs() {
        return getRetryAfterMs();
    }
}
