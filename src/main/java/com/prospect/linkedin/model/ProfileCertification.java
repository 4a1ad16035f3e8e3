package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileCertification {
    private String name;
    private String issuer;
    private String issueDate;
    private String expirationDate;
    private String credentialUrl;
}
