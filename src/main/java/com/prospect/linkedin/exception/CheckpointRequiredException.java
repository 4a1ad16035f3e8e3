package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;

/**
 * The account hit a LinkedIn security checkpoint. It must cool down before any further request.
 */
public class CheckpointRequiredException extends LinkedInScrapeException {

    public CheckpointRequiredException(long retryAfterMs) {
        this("LinkedIn requires additional verification (CAPTCHA/2FA)", retryAfterMs);
    }

    public CheckpointRequiredException(String message, long retryAfterMs) {
        super(ErrorCode.CHECKPOINT_REQUIRED, message, false, retryAfterMs,
                "Please log in to LinkedIn on your desktop browser to complete verification, then try again later.");
    }

    @Override
    public boolean isCheckpoint() {
        return true;
    }
}
