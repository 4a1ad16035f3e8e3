package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class ValidationException extends LinkedInScrapeException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message, false, null, "Check the request parameters and try again.");
    }
}
