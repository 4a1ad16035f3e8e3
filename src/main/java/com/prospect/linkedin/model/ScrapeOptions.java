package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class ScrapeOptions {
    private String userId;
    private String email;
    private String password;
    private Integer timeoutMs;
}
