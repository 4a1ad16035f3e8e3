package com.prospect.linkedin.enums;

public enum RateLimitDenial {
    NO_CREDENTIALS,
    COOLDOWN,
    TOO_SOON,
    HOURLY_LIMIT,
    DAILY_LIMIT
}
