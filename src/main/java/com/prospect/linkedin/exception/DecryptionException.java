package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

public class DecryptionException extends LinkedInScrapeException {

    public DecryptionException(String message) {
        super(ErrorCode.DECRYPTION_FAILED, message, false, null, "Re-link the LinkedIn account.");
    }

    public DecryptionException(String message, Throwable e) {
        super(ErrorCode.DECRYPTION_FAILED, message, false, null, "Re-link the LinkedIn account.", e);
    }
}
