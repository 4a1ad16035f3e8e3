package com.prospect.linkedin.model.request;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(exclude = "password")
public class CredentialRequest {
    private String email;
    private String password;
}
