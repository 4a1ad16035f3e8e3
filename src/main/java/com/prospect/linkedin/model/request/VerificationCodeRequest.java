package com.prospect.linkedin.model.request;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class VerificationCodeRequest {
    private String verificationSessionId;
    private String code;
}
