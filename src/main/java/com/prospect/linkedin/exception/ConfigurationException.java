package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class ConfigurationException extends LinkedInScrapeException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message, false, null, null);
    }

    public ConfigurationException(String message, Throwable e) {
        super(ErrorCode.CONFIGURATION_ERROR, message, false, null, null, e);
    }
}
