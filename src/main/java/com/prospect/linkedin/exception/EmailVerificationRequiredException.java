package com.prospect.linkedin.exception;

import com.prospect.linkedin.enums.ErrorCode;
import lombok.Getter;

@Getter
public class EmailVerificationRequiredException extends LinkedInScrapeException {

    private final String verificationSessionId;

    public EmailVerificationRequiredException(String verificationSessionId) {
        super(ErrorCode.EMAIL_VERIFICATION_REQUIRED,
                "LinkedIn sent a verification code to the account email",
                true,
                null,
                "Enter the verification code LinkedIn emailed you to continue.");
        this.verificationSessionId = verificationSessionId;
    }
}
