package com.prospect.linkedin.enums;

public enum VerificationStatus {
    PENDING,
    COMPLETED,
    FAILED,
    EXPIRED
}
