package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class NoCredentialsException extends LinkedInScrapeException {

    public NoCredentialsException() {
        this("No LinkedIn credentials stored for user");
    }

    public NoCredentialsException(String message) {
        super(ErrorCode.NO_CREDENTIALS, message, false, null,
                "Please provide your LinkedIn email and password.");
    }
}
