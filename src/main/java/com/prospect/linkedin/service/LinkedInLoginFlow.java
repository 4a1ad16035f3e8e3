package com.prospect.linkedin.service;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.enums.LoginState;
import com.prospect.linkedin.exception.LoginFailedException;
import com.prospect.linkedin.verification.CheckpointHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fills and submits the LinkedIn login form with human pacing, then hands the landing page to
 * {@link CheckpointHandler#classify} for the verdict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LinkedInLoginFlow {

    static final String USERNAME_FIELD = "#username";
    static final String PASSWORD_FIELD = "#password";
    static final String SUBMIT_BUTTON = "button[type='submit']";

    private final HumanBehaviorSimulator simulator;
    private final CheckpointHandler checkpointHandler;
    private final ScraperConfig scraperConfig;

    /**
     * Browser thread only.
     *
     * @return the resolved login state: never LOGGING_IN or CHECKPOINT_CHALLENGE
     * @throws LoginFailedException if the login form cannot be found or filled
     */
    public LoginState login(Page page, String email, String password, String emailHash) {
        int timeout = scraperConfig.getLoginTimeoutMs();
        log.info("Logging in to LinkedIn");

        try {
            page.navigate(ScraperConfig.LOGIN_URL, new Page.NavigateOptions()
                    .setTimeout(timeout)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            simulator.hesitate();
            simulator.moveMouse(page, 2);

            Locator username = page.locator(USERNAME_FIELD);
            username.waitFor(new Locator.WaitForOptions().setTimeout(timeout));
            username.click();
            simulator.pause(200, 400);
            simulator.typeHumanLike(username, email);
            simulator.pause(300, 500);

            Locator passwordField = page.locator(PASSWORD_FIELD);
            passwordField.click();
            simulator.pause(200, 400);
            simulator.typeHumanLike(passwordField, password);
            simulator.pause(500, 800);

            simulator.hesitate();
            page.locator(SUBMIT_BUTTON).first().click();
        } catch (PlaywrightException e) {
            throw new LoginFailedException("Login form not available: " + e.getMessage(), e);
        }

        try {
            page.waitForURL(url -> !url.contains("/login"), new Page.WaitForURLOptions().setTimeout(timeout));
        } catch (TimeoutError e) {
            log.info("Still on login page after {}ms", timeout);
        }

        return checkpointHandler.classify(page, emailHash);
    }
}
