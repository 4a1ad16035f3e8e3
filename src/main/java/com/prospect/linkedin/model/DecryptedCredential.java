package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString(exclude = {"email", "password"})
public class DecryptedCredential {
    private final String credentialId;
    private final String email;
    private final String password;
}
