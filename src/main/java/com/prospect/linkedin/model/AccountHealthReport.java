package com.prospect.linkedin.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AccountHealthReport {
    private int totalRequests;
    private int successfulRequests;
    private int failedRequests;
    private int checkpointCount;
    private int consecutiveFailures;
    private double successRate;
    private double checkpointRate;
    private boolean active;
    private boolean onCooldown;
    private Instant cooldownUntil;
    private Instant lastRequestAt;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private Instant lastCheckpointAt;
}
