package com.prospect.linkedin.model;

import com.prospect.linkedin.enums.VerificationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class VerificationStatusReport {
    private String verificationSessionId;
    private VerificationStatus status;
    private int attemptsRemaining;
    private Instant expiresAt;
}
