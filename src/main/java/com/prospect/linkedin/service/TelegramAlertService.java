package com.prospect.linkedin.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospect.linkedin.interceptor.SimpleHttpLoggingInterceptor;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Operator alerts for accounts that need a human: checkpoints and failure pauses.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "monitoring.alerts.telegram.enabled", havingValue = "true")
public class TelegramAlertService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_BASE = "https://api.telegram.org";

    private final String botToken;
    private final String chatId;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public TelegramAlertService(@Value("${monitoring.alerts.telegram.bot-token}") String botToken,
                                @Value("${monitoring.alerts.telegram.chat-id}") String chatId,
                                ObjectMapper objectMapper) {
        this.botToken = botToken;
        this.chatId = chatId;
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }

    public void sendCheckpointAlert(String userId, String emailHash, Instant cooldownUntil) {
        String message = String.format(
                "🚨 LINKEDIN CHECKPOINT 🚨\n\n" +
                        "User: %s\n" +
                        "Account: %s\n" +
                        "Cooldown until: %s\n\n" +
                        "⚠️ Manual verification required on the account",
                userId, IdentityHash.shorten(emailHash), cooldownUntil
        );

        sendTelegramMessage(message);
    }

    public void sendAccountPausedAlert(String userId, String emailHash, int consecutiveFailures, Instant cooldownUntil) {
        String message = String.format(
                "⚠️ LINKEDIN ACCOUNT PAUSED\n\n" +
                        "User: %s\n" +
                        "Account: %s\n" +
                        "Consecutive failures: %d\n" +
                        "Paused until: %s",
                userId, IdentityHash.shorten(emailHash), consecutiveFailures, cooldownUntil
        );

        sendTelegramMessage(message);
    }

    private void sendTelegramMessage(String message) {
        try {
            String body = objectMapper.writeValueAsString(Map.of("chat_id", chatId, "text", message));
            Request request = new Request.Builder()
                    .url(API_BASE + "/bot" + botToken + "/sendMessage")
                    .post(RequestBody.create(body, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Telegram alert rejected with HTTP {}", response.code());
                }
            }
        } catch (IOException e) {
            // best effort
            log.error("Failed to send Telegram alert", e);
        }
    }
}
