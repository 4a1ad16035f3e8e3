package com.prospect.linkedin.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class RateLimitStats {
    private long requestsThisHour;
    private long requestsToday;
    private int maxPerHour;
    private int maxPerDay;
    private Instant lastRequestAt;
    private Instant nextAllowedAt;
    private Instant suggestedNextRequestAt;
    private Instant cooldownUntil;
}
