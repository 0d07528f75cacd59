package com.copytraderadar.notification;

import com.copytraderadar.notification.config.NotificationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot API sendMessage transport. Sends each message to every configured chat.
 * Calls are throttled by a local rate limiter; a missing permit fails the send, it is not queued.
 */
@Component
@Slf4j
public class TelegramNotificationChannel implements NotificationChannel {

    private final NotificationProperties.Telegram properties;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;

    public TelegramNotificationChannel(NotificationProperties notificationProperties,
                                       WebClient.Builder webClientBuilder,
                                       @Qualifier("telegramRateLimiter") RateLimiter rateLimiter) {
        this.properties = notificationProperties.getTelegram();
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
        if (isAvailable()) {
            log.info("Telegram notifications enabled (bot {}), {} chat(s)", mask(properties.getBotToken()),
                    chatIds().size());
        } else {
            log.warn("Telegram notifications disabled: bot token or chat ids not configured");
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getBotToken() != null && !properties.getBotToken().isBlank() && !chatIds().isEmpty();
    }

    @Override
    public void send(String formattedMessage) {
        if (!isAvailable()) {
            throw new NotificationException("Telegram channel not configured");
        }
        List<String> failed = chatIds().stream()
                .filter(chatId -> !sendToChat(chatId, formattedMessage))
                .toList();
        if (!failed.isEmpty()) {
            throw new NotificationException("Telegram sendMessage failed for chat(s) " + failed);
        }
    }

    private boolean sendToChat(String chatId, String text) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("Telegram rate limit reached; message to chat {} dropped", chatId);
            return false;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);
        try {
            JsonNode response = webClient.post()
                    .uri(properties.getBaseUrl() + "/bot" + properties.getBotToken() + "/sendMessage")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofMillis(properties.getTimeoutMs()));
            if (response == null || !response.path("ok").asBoolean(false)) {
                log.warn("Telegram API rejected message to chat {}: {}", chatId,
                        response != null ? response.path("description").asText("") : "empty response");
                return false;
            }
            log.info("Telegram notification sent to chat {}", chatId);
            return true;
        } catch (WebClientResponseException e) {
            log.warn("Telegram API error for chat {}: {} {}", chatId, e.getStatusCode(), e.getResponseBodyAsString());
            return false;
        } catch (RuntimeException e) {
            log.warn("Telegram send to chat {} failed: {}", chatId, e.getMessage());
            return false;
        }
    }

    private List<String> chatIds() {
        if (properties.getChatIds() == null) {
            return List.of();
        }
        return properties.getChatIds().stream().filter(id -> id != null && !id.isBlank()).toList();
    }

    private static String mask(String token) {
        return token.length() <= 10 ? "***" : token.substring(0, 10) + "...";
    }
}
