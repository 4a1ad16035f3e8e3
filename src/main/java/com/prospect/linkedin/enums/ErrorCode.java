package com.prospect.linkedin.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    NO_CREDENTIALS(HttpStatus.UNAUTHORIZED),
    LOGIN_FAILED(HttpStatus.UNAUTHORIZED),
    CHECKPOINT_REQUIRED(HttpStatus.FORBIDDEN),
    EMAIL_VERIFICATION_REQUIRED(HttpStatus.ACCEPTED),
    DECRYPTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    NO_COOKIES(HttpStatus.INTERNAL_SERVER_ERROR),
    SCRAPING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;
}
