package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class LoginFailedException extends LinkedInScrapeException {

    public LoginFailedException() {
        this("Invalid credentials or login blocked");
    }

    public LoginFailedException(String message) {
        super(ErrorCode.LOGIN_FAILED, message, false, null,
                "Check your LinkedIn email and password and try again.");
    }

    public LoginFailedException(String message, Throwable e) {
        super(ErrorCode.LOGIN_FAILED, message, false, null,
                "Check your LinkedIn email and password and try again.", e);
    }
}
