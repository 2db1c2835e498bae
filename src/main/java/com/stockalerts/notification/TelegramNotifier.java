package com.stockalerts.notification;

import com.stockalerts.exception.DeliveryFailureException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alert messages via the Telegram Bot API.
 *
 * <p>The owner key of an alert is its Telegram chat id; alerts without one go to the
 * configured default chat. Telegram allows about 60 messages per minute per bot, so sends are
 * gated by a semaphore whose permits are returned one interval after use. When no permit is
 * available the send fails with {@link DeliveryFailureException} and the alert is picked up
 * again on a later cycle.
 *
 * <p>With {@code notifications.telegram.enabled=false} messages are only logged.
 */
@Component
public class TelegramNotifier implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String SEND_MESSAGE_PATH = "/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;
    private final long permitHoldMillis;

    public TelegramNotifier(
            TelegramConfig telegramConfig, @Qualifier("telegramRestTemplate") RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        int perMinute = Math.max(1, telegramConfig.getMaxMessagesPerMinute());
        this.rateLimiter = new Semaphore(perMinute);
        this.permitHoldMillis = 60_000L / perMinute;
    }

    @Override
    public void send(String ownerKey, String message) {
        String chatId = resolveChatId(ownerKey);

        if (!telegramConfig.isEnabled()) {
            log.info("Telegram disabled, notification for chat {} not sent:\n{}", chatId, message);
            return;
        }
        if (chatId == null) {
            throw new DeliveryFailureException("No Telegram chat id for owner and no default chat configured");
        }
        if (!rateLimiter.tryAcquire()) {
            throw new DeliveryFailureException("Telegram rate limit reached, message to chat " + chatId + " dropped");
        }

        try {
            String url = telegramConfig.getApiBaseUrl() + String.format(SEND_MESSAGE_PATH, telegramConfig.getBotToken());

            Map<String, Object> payload = Map.of(
                    "chat_id", chatId,
                    "text", message,
                    "parse_mode", "HTML",
                    "disable_web_page_preview", true);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryFailureException("Telegram returned " + response.getStatusCode());
            }
            log.debug("Telegram message sent to chat {}", chatId);
        } catch (RestClientException e) {
            throw new DeliveryFailureException("Failed to send Telegram message to chat " + chatId, e);
        } finally {
            scheduleRateLimiterRelease();
        }
    }

    private String resolveChatId(String ownerKey) {
        if (ownerKey != null && !ownerKey.isBlank()) {
            return ownerKey.trim();
        }
        String fallback = telegramConfig.getChatId();
        return fallback == null || fallback.isBlank() ? null : fallback;
    }

    private void scheduleRateLimiterRelease() {
        CompletableFuture.delayedExecutor(permitHoldMillis, TimeUnit.MILLISECONDS).execute(rateLimiter::release);
    }

    /** Visible for testing. Returns available rate limiter permits. */
    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }
}
