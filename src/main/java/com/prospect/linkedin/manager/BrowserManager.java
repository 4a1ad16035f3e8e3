package com.prospect.linkedin.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.model.profile.UserAgentProfile;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Owns the one Playwright driver and the shared Chromium browser.
 * <p>
 * Playwright objects are not thread safe, so every browser call must run on {@link #executor()}.
 * The browser is launched lazily and relaunched when the connection drops.
 */
@Component
@Slf4j
public class BrowserManager {

    private final ScraperConfig scraperConfig;
    private final ObjectMapper objectMapper;
    private final ExecutorService driverThread;

    private Playwright playwright;
    private Browser browser;

    public BrowserManager(ScraperConfig scraperConfig, ObjectMapper objectMapper) {
        this.scraperConfig = scraperConfig;
        this.objectMapper = objectMapper;
        this.driverThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "playwright-driver");
            t.setDaemon(true);
            return t;
        });
    }

    public Executor executor() {
        return driverThread;
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, driverThread);
    }

    /**
     * Driver thread only.
     */
    public Browser getOrCreateBrowser() {
        if (browser != null && browser.isConnected()) {
            return browser;
        }
        if (browser != null) {
            log.warn("Browser disconnected, relaunching");
            closeBrowserQuietly();
        }
        if (playwright == null) {
            playwright = Playwright.create();
        }
        browser = launchBrowser(playwright);
        log.info("Chromium launched (headless={})", scraperConfig.isHeadless());
        return browser;
    }

    /**
     * Isolated context carrying the fingerprint of {@code profile} and the stealth init script. Driver thread only.
     */
    public BrowserContext newStealthContext(UserAgentProfile profile) {
        BrowserContext context = getOrCreateBrowser().newContext(createStealthContextOptions(profile));
        context.setDefaultNavigationTimeout(scraperConfig.getNavigationTimeoutMs());
        context.setDefaultTimeout(scraperConfig.getNavigationTimeoutMs());
        context.addInitScript(buildStealthScript(profile));
        return context;
    }

    public Browser.NewContextOptions createStealthContextOptions(UserAgentProfile profile) {
        UserAgentProfile.Viewport viewport = profile.getViewport();

        return new Browser.NewContextOptions()
                .setUserAgent(profile.getUserAgent())
                .setViewportSize(viewport.getWidth(), viewport.getHeight())
                .setLocale(profile.getLocale() != null ? profile.getLocale() : "en-US")
                .setTimezoneId(profile.getTimeZone() != null ? profile.getTimeZone() : "America/New_York")
                .setExtraHTTPHeaders(profile.headersOrEmpty())
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);
    }

    public void closeQuietly(BrowserContext context) {
        if (context == null) {
            return;
        }
        try {
            context.close();
        } catch (PlaywrightException e) {
            log.debug("Context already closed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down Playwright driver");
        try {
            driverThread.submit(() -> {
                closeBrowserQuietly();
                if (playwright != null) {
                    playwright.close();
                    playwright = null;
                }
            }).get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Playwright did not shut down cleanly: {}", e.getMessage());
        } finally {
            driverThread.shutdownNow();
        }
    }

    private Browser launchBrowser(Playwright pw) {
        List<String> args = new ArrayList<>(scraperConfig.getBrowserFlags());

        return pw.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(scraperConfig.isHeadless())
                .setTimeout(scraperConfig.getLaunchTimeoutMs())
                .setArgs(args));
    }

    private void closeBrowserQuietly() {
        if (browser == null) {
            return;
        }
        try {
            browser.close();
        } catch (PlaywrightException e) {
            log.debug("Browser close failed: {}", e.getMessage());
        }
        browser = null;
    }

    String buildStealthScript(UserAgentProfile profile) {
        String profileJson;
        try {
            profileJson = objectMapper.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Fingerprint preset is not serializable", e);
        }

        return String.format("""
        // === Profile Configuration ===
        const profile = %s;

        // === Remove Automation Indicators ===
        Object.defineProperty(navigator, 'webdriver', {
            get: () => undefined,
            configurable: true
        });
        delete navigator.__proto__.webdriver;
        window.chrome = { runtime: {}, loadTimes: function() {}, csi: function() {}, app: {} };

        // === Languages & Platform ===
        Object.defineProperty(navigator, 'languages', {
            get: () => profile.languages || ['en-US', 'en'],
            configurable: true
        });
        Object.defineProperty(navigator, 'platform', {
            get: () => profile.platform,
            configurable: true
        });

        // === Hardware ===
        Object.defineProperty(navigator, 'hardwareConcurrency', {
            get: () => profile.hardwareConcurrency,
            configurable: true
        });
        Object.defineProperty(navigator, 'deviceMemory', {
            get: () => profile.deviceMemory,
            configurable: true
        });

        // === Plugins ===
        Object.defineProperty(navigator, 'plugins', {
            get: () => (profile.plugins || []).map(p => ({ name: p.name, filename: p.filename, description: p.description })),
            configurable: true
        });

        // === Permissions ===
        const originalQuery = window.navigator.permissions.query;
        window.navigator.permissions.query = (parameters) => (
            parameters.name === 'notifications'
                ? Promise.resolve({ state: Notification.permission })
                : originalQuery(parameters)
        );

        // === WebGL Vendor/Renderer ===
        const getParameter = WebGLRenderingContext.prototype.getParameter;
        WebGLRenderingContext.prototype.getParameter = function(parameter) {
            if (parameter === 37445) return profile.webglVendor;
            if (parameter === 37446) return profile.webglRenderer;
            return getParameter.call(this, parameter);
        };
        """, profileJson);
    }
}
