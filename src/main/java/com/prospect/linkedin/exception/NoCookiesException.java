package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class NoCookiesException extends LinkedInScrapeException {

    public NoCookiesException(String domain) {
        super(ErrorCode.NO_COOKIES, "No " + domain + " cookies found after login", true, null,
                "Please try again in a few minutes.");
    }
}
