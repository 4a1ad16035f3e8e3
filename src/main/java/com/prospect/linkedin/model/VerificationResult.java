package com.prospect.linkedin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {
    private final boolean success;
    private final String error;
    private final Integer attemptsRemaining;

    public static VerificationResult ok() {
        return new VerificationResult(true, null, null);
    }

    public static VerificationResult failed(String error, Integer attemptsRemaining) {
        return new VerificationResult(false, error, attemptsRemaining);
    }
}
