package com.prospect.linkedin.service;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.Cookie;
import com.prospect.linkedin.config.RateLimitConfig;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.enums.LoginState;
import com.prospect.linkedin.enums.RateLimitDenial;
import com.prospect.linkedin.exception.CheckpointRequiredException;
import com.prospect.linkedin.exception.EmailVerificationRequiredException;
import com.prospect.linkedin.exception.LoginFailedException;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.exception.RateLimitExceededException;
import com.prospect.linkedin.exception.ScrapingFailedException;
import com.prospect.linkedin.exception.ValidationException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.manager.BrowserManager;
import com.prospect.linkedin.manager.ProfileManager;
import com.prospect.linkedin.model.DecryptedCredential;
import com.prospect.linkedin.model.RateLimitDecision;
import com.prospect.linkedin.model.ScrapeOptions;
import com.prospect.linkedin.model.ScrapedProfile;
import com.prospect.linkedin.model.SessionPayload;
import com.prospect.linkedin.model.VerificationResult;
import com.prospect.linkedin.model.profile.UserAgentProfile;
import com.prospect.linkedin.session.SessionManager;
import com.prospect.linkedin.utils.IdentityHash;
import com.prospect.linkedin.utils.ProfileExtractor;
import com.prospect.linkedin.verification.CheckpointHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkedInScraperServiceTest {

    private static final String USER = "user-1";
    private static final String EMAIL = "jane@example.com";
    private static final String PASSWORD = "s3cret";
    private static final String PROFILE = "https://www.linkedin.com/in/someone/";
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private CredentialVault credentialVault;
    @Mock
    private AccountHealthService accountHealthService;
    @Mock
    private SessionManager sessionManager;
    @Mock
    private BrowserManager browserManager;
    @Mock
    private ProfileManager profileManager;
    @Mock
    private LinkedInLoginFlow loginFlow;
    @Mock
    private CheckpointHandler checkpointHandler;
    @Mock
    private HumanBehaviorSimulator simulator;
    @Mock
    private ProfileExtractor profileExtractor;
    @Mock
    private ScrapeFlowLogger flowLogger;
    @Mock
    private BrowserContext context;
    @Mock
    private Page page;

    private final UserAgentProfile fingerprint = UserAgentProfile.builder()
            .id("win-chrome-1080").userAgent("Mozilla/5.0 (Windows NT 10.0)").build();

    private LinkedInScraperService service;

    @BeforeEach
    void setUp() {
        service = new LinkedInScraperService(credentialVault, accountHealthService, sessionManager, browserManager,
                profileManager, loginFlow, checkpointHandler, simulator, profileExtractor, new ScraperConfig(),
                new RateLimitConfig(), flowLogger, Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(browserManager.submit(any())).thenAnswer(inv -> {
            Supplier<?> task = inv.getArgument(0);
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    private static ScrapeOptions forUser() {
        return ScrapeOptions.builder().userId(USER).build();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            return e.getCause();
        }
        return fail("expected the future to fail");
    }

    private void storedCredential() {
        when(credentialVault.retrieve(USER)).thenReturn(new DecryptedCredential("cred-1", EMAIL, PASSWORD));
    }

    private static LinkedInCredential linked() {
        return LinkedInCredential.builder().id("cred-1").userId(USER).emailHash(IdentityHash.of(EMAIL)).active(true).build();
    }

    private void admitted() {
        storedCredential();
        when(accountHealthService.canMakeRequest(USER)).thenReturn(RateLimitDecision.allow());
    }

    private void browserReady() {
        when(profileManager.randomProfile()).thenReturn(fingerprint);
        when(browserManager.newStealthContext(fingerprint)).thenReturn(context);
        when(context.newPage()).thenReturn(page);
    }

    private void cachedSessionAccepted() {
        SessionPayload payload = SessionPayload.builder().savedAt(NOW).expiresAt(NOW.plusSeconds(3600)).build();
        when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.of(payload));
        when(sessionManager.validateSession(eq(page), anyInt())).thenReturn(true);
    }

    private static ScrapedProfile extracted() {
        return ScrapedProfile.builder().name("Jane Doe").title("Engineer at Acme").company("Acme")
                .profileUrl(PROFILE).platform("linkedin").scrapedAt(NOW).missingFields(List.of()).build();
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        void missingCredentialsFailWithoutBrowserOrLog() {
            when(credentialVault.retrieve(USER)).thenThrow(new NoCredentialsException());

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(NoCredentialsException.class);
            verifyNoInteractions(browserManager, accountHealthService);
        }

        @Test
        void blankUrlIsValidationFailure() {
            Throwable failure = failureOf(service.scrapeProfile(" ", forUser()));

            assertThat(failure).isInstanceOf(ValidationException.class);
            verifyNoInteractions(credentialVault, browserManager);
        }

        @Test
        void missingUserIsValidationFailure() {
            Throwable failure = failureOf(service.scrapeProfile(PROFILE, new ScrapeOptions()));

            assertThat(failure).isInstanceOf(ValidationException.class);
        }

        @Test
        void rateLimitDenialCarriesWaitTime() {
            storedCredential();
            when(accountHealthService.canMakeRequest(USER)).thenReturn(
                    RateLimitDecision.deny(RateLimitDenial.TOO_SOON, "Too soon since last request", 60_000L));

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(RateLimitExceededException.class);
            RateLimitExceededException limited = (RateLimitExceededException) failure;
            assertThat(limited.getWaitTimeMs()).isEqualTo(60_000L);
            assertThat(limited.getDenial()).isEqualTo(RateLimitDenial.TOO_SOON);
            verifyNoInteractions(browserManager);
            verify(accountHealthService, never()).logRequest(any(), any(), any(), anyBoolean(), anyLong(), any());
        }

        @Test
        void inlineCredentialsWithoutLinkedAccountAreRejected() {
            when(credentialVault.findActive(USER)).thenReturn(Optional.empty());
            ScrapeOptions options = ScrapeOptions.builder().userId(USER).email(EMAIL).password(PASSWORD).build();

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, options));

            assertThat(failure).isInstanceOf(NoCredentialsException.class);
            verify(credentialVault, never()).retrieve(anyString());
            verifyNoInteractions(accountHealthService, browserManager);
        }

        @Test
        @DisplayName("inline email for another account cannot dodge the linked account's cooldown")
        void inlineEmailForDifferentAccountIsRejected() {
            when(credentialVault.findActive(USER)).thenReturn(Optional.of(linked()));
            ScrapeOptions options = ScrapeOptions.builder()
                    .userId(USER).email("someone.else@example.com").password(PASSWORD).build();

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, options));

            assertThat(failure).isInstanceOf(ValidationException.class);
            verifyNoInteractions(accountHealthService, browserManager, sessionManager);
        }

        @Test
        void inlinePasswordForLinkedAccountRunsUnderStoredIdentity() {
            when(credentialVault.findActive(USER)).thenReturn(Optional.of(linked()));
            when(accountHealthService.canMakeRequest(USER)).thenReturn(RateLimitDecision.allow());
            browserReady();
            when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.empty());
            when(loginFlow.login(eq(page), eq(EMAIL), eq("new-password"), anyString())).thenReturn(LoginState.SUCCESS);
            List<Cookie> cookies = List.of(new Cookie("li_at", "t").setDomain(".linkedin.com"));
            when(context.cookies()).thenReturn(cookies);
            when(page.url()).thenReturn(PROFILE);
            when(profileExtractor.extract(page, PROFILE, NOW)).thenReturn(extracted());
            ScrapeOptions options = ScrapeOptions.builder()
                    .userId(USER).email("  Jane@Example.com ").password("new-password").build();

            service.scrapeProfile(PROFILE, options).join();

            verify(credentialVault, never()).retrieve(anyString());
            verify(sessionManager).saveSession(cookies, fingerprint.getUserAgent(), "cred-1");
            verify(accountHealthService).logRequest(eq(USER), eq(EMAIL), eq(PROFILE), eq(true), anyLong(), isNull());
        }
    }

    @Nested
    @DisplayName("pipeline")
    class Pipeline {

        @Test
        void cachedSessionScrapesAndCleansUp() {
            admitted();
            browserReady();
            cachedSessionAccepted();
            when(page.url()).thenReturn(PROFILE);
            ScrapedProfile profile = extracted();
            when(profileExtractor.extract(page, PROFILE, NOW)).thenReturn(profile);

            ScrapedProfile result = service.scrapeProfile(PROFILE, forUser()).join();

            assertThat(result).isSameAs(profile);
            InOrder order = inOrder(simulator, profileExtractor);
            order.verify(simulator).scroll(page);
            order.verify(profileExtractor).waitForProfileSections(page);
            order.verify(profileExtractor).extract(page, PROFILE, NOW);
            verify(loginFlow, never()).login(any(), any(), any(), any());
            verify(sessionManager).applySession(eq(context), any());
            verify(page).close();
            verify(browserManager).closeQuietly(context);
            verify(flowLogger).logScrapingAttempt(eq(PROFILE), eq(USER), eq(true), anyLong(), eq("cached"));
            verify(accountHealthService).logRequest(eq(USER), eq(EMAIL), eq(PROFILE), eq(true), anyLong(), isNull());
        }

        @Test
        void rejectedSessionFallsBackToFreshLogin() {
            admitted();
            browserReady();
            SessionPayload stale = SessionPayload.builder().expiresAt(NOW.plusSeconds(60)).build();
            when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.of(stale));
            when(sessionManager.validateSession(eq(page), anyInt())).thenReturn(false);
            when(loginFlow.login(eq(page), eq(EMAIL), eq(PASSWORD), anyString())).thenReturn(LoginState.SUCCESS);
            List<Cookie> cookies = List.of(new Cookie("li_at", "t").setDomain(".linkedin.com"));
            when(context.cookies()).thenReturn(cookies);
            when(page.url()).thenReturn(PROFILE);
            when(profileExtractor.extract(page, PROFILE, NOW)).thenReturn(extracted());

            service.scrapeProfile(PROFILE, forUser()).join();

            verify(sessionManager).invalidateSession(EMAIL);
            verify(context).clearCookies();
            verify(sessionManager).saveSession(cookies, fingerprint.getUserAgent(), "cred-1");
            verify(flowLogger).logScrapingAttempt(eq(PROFILE), eq(USER), eq(true), anyLong(), eq("fresh"));
        }

        @Test
        void badPasswordFailsAndIsLogged() {
            admitted();
            browserReady();
            when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.empty());
            when(loginFlow.login(eq(page), eq(EMAIL), eq(PASSWORD), anyString())).thenReturn(LoginState.LOGIN_FAILED);

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(LoginFailedException.class);
            verify(page).close();
            verify(accountHealthService).logRequest(eq(USER), eq(EMAIL), eq(PROFILE), eq(false), anyLong(),
                    any(LoginFailedException.class));
            verify(sessionManager, never()).saveSession(any(), any(), any());
        }

        @Test
        void checkpointAfterNavigationInvalidatesSession() {
            admitted();
            browserReady();
            cachedSessionAccepted();
            when(page.url()).thenReturn("https://www.linkedin.com/checkpoint/challenge/AgF");

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(CheckpointRequiredException.class);
            assertThat(((CheckpointRequiredException) failure).isCheckpoint()).isTrue();
            verify(sessionManager).invalidateSession(EMAIL);
            verify(accountHealthService).logRequest(eq(USER), eq(EMAIL), eq(PROFILE), eq(false), anyLong(),
                    any(CheckpointRequiredException.class));
            verifyNoInteractions(profileExtractor);
        }

        @Test
        void permanentCheckpointAtLoginInvalidatesSession() {
            admitted();
            browserReady();
            when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.empty());
            when(loginFlow.login(eq(page), eq(EMAIL), eq(PASSWORD), anyString()))
                    .thenReturn(LoginState.PERMANENT_CHECKPOINT);

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(CheckpointRequiredException.class);
            assertThat(((CheckpointRequiredException) failure).getRetryAfterMs()).isEqualTo(86_400_000L);
            verify(sessionManager).invalidateSession(EMAIL);
        }

        @Test
        void emailVerificationHandsPageOff() {
            admitted();
            browserReady();
            when(sessionManager.loadSession(EMAIL)).thenReturn(Optional.empty());
            when(loginFlow.login(eq(page), eq(EMAIL), eq(PASSWORD), anyString()))
                    .thenReturn(LoginState.EMAIL_VERIFICATION_PENDING);
            when(checkpointHandler.beginVerification(USER, EMAIL, "cred-1", PROFILE,
                    fingerprint.getUserAgent(), page, context)).thenReturn("v-123");

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(EmailVerificationRequiredException.class);
            assertThat(((EmailVerificationRequiredException) failure).getVerificationSessionId()).isEqualTo("v-123");
            verify(page, never()).close();
            verify(browserManager, never()).closeQuietly(any());
        }

        @Test
        void unexpectedErrorBecomesScrapingFailure() {
            admitted();
            browserReady();
            cachedSessionAccepted();
            when(page.url()).thenReturn(PROFILE);
            when(profileExtractor.extract(page, PROFILE, NOW)).thenThrow(new IllegalStateException("detached"));

            Throwable failure = failureOf(service.scrapeProfile(PROFILE, forUser()));

            assertThat(failure).isInstanceOf(ScrapingFailedException.class).hasMessageContaining("detached");
            verify(page).close();
            verify(accountHealthService).logRequest(eq(USER), eq(EMAIL), eq(PROFILE), eq(false), anyLong(),
                    any(ScrapingFailedException.class));
        }

        @Test
        void logFailureDoesNotMaskResult() {
            admitted();
            browserReady();
            cachedSessionAccepted();
            when(page.url()).thenReturn(PROFILE);
            when(profileExtractor.extract(page, PROFILE, NOW)).thenReturn(extracted());
            doThrow(new IllegalStateException("db down")).when(accountHealthService)
                    .logRequest(any(), any(), any(), anyBoolean(), anyLong(), any());

            assertThat(service.scrapeProfile(PROFILE, forUser()).join().getName()).isEqualTo("Jane Doe");
        }
    }

    @Nested
    @DisplayName("submitVerificationCode")
    class SubmitVerificationCode {

        @Test
        void blankCodeIsValidationFailure() {
            Throwable failure = failureOf(service.submitVerificationCode("v-1", "  "));

            assertThat(failure).isInstanceOf(ValidationException.class);
            verifyNoInteractions(checkpointHandler);
        }

        @Test
        void delegatesOnBrowserThread() {
            when(checkpointHandler.submitVerificationCode("v-1", "123456")).thenReturn(VerificationResult.ok());

            assertThat(service.submitVerificationCode("v-1", "123456").join().isSuccess()).isTrue();
            verify(browserManager).submit(any());
        }
    }
}
