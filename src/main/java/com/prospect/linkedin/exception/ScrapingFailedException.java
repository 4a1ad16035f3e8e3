package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;
import lombok.Getter;

@Getter
public class ScrapingFailedException extends LinkedInScrapeException {

    private final String detail;

    public ScrapingFailedException(String detail) {
        this(detail, null);
    }

    public ScrapingFailedException(String detail, Throwable e) {
        super(ErrorCode.SCRAPING_FAILED,
                "Failed to scrape LinkedIn profile" + (detail != null ? ": " + detail : ""),
                true, null, "Please try again in a few minutes.", e);
        this.detail = detail;
    }
}
