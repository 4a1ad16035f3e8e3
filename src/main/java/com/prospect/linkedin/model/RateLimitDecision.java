package com.prospect.linkedin.model;

import com.prospect.linkedin.enums.RateLimitDenial;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null, null, null);

    private final boolean allowed;
    private final RateLimitDenial denial;
    private final String reason;
    private final Long waitTimeMs;

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision deny(RateLimitDenial denial, String reason, Long waitTimeMs) {
        return new RateLimitDecision(false, denial, reason, waitTimeMs);
    }
}
