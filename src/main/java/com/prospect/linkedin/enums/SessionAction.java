package com.prospect.linkedin.enums;

public enum SessionAction {
    CREATED,
    REUSED,
    INVALIDATED
}
