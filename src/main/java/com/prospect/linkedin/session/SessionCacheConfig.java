package com.prospect.linkedin.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.model.SessionPayload;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SessionCacheConfig {

    @Bean("sessionCache")
    public Cache<String, SessionPayload> sessionCache(
            RateLimitConfig rateLimitConfig,
            @Value("${linkedin.session.cache.max-size:10000}") long maxSize
    ) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(rateLimitConfig.getCookieMaxAgeMs()))
                .maximumSize(maxSize)
                .build();
    }
}
