package com.prospect.linkedin.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

@Data
@Configuration
public class ScraperConfig {

    public static final String BASE_URL = "https://www.linkedin.com";
    public static final String LOGIN_URL = BASE_URL + "/login";
    public static final String FEED_URL = BASE_URL + "/feed/";
    public static final String COOKIE_DOMAIN = "linkedin.com";
    public static final String PLATFORM = "linkedin";

    private final List<String> browserFlags = Arrays.asList(
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-accelerated-2d-canvas",
            "--disable-gpu",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    @Value("${linkedin.scraper.headless:true}")
    private boolean headless = true;

    @Value("${linkedin.scraper.launch-timeout-ms:120000}")
    private int launchTimeoutMs = 120_000;

    @Value("${linkedin.scraper.navigation-timeout-ms:30000}")
    private int navigationTimeoutMs = 30_000;

    @Value("${linkedin.scraper.login-timeout-ms:30000}")
    private int loginTimeoutMs = 30_000;

    @Value("${linkedin.scraper.session-validation-timeout-ms:10000}")
    private int sessionValidationTimeoutMs = 10_000;

    @Value("${linkedin.scraper.profile-header-timeout-ms:10000}")
    private int profileHeaderTimeoutMs = 10_000;

    // per lazy-loaded section; a missing section costs this much once
    @Value("${linkedin.scraper.section-timeout-ms:5000}")
    private int sectionTimeoutMs = 5_000;

    // ==================== VERIFICATION ====================

    @Value("${linkedin.verification.ttl-ms:300000}")
    private long verificationTtlMs = 300_000;

    @Value("${linkedin.verification.max-attempts:3}")
    private int verificationMaxAttempts = 3;

    @Value("${linkedin.verification.submit-timeout-ms:15000}")
    private int verificationSubmitTimeoutMs = 15_000;
}
