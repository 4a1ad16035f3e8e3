package com.prospect.linkedin.model.request;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(exclude = "password")
public class ScrapeRequest {
    private String userId;
    private String profileUrl;
    private String email;
    private String password;
    private Integer timeoutMs;
}
