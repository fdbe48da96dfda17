package com.mouse.surebet.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.model.OpportunityNotification;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes opportunities to a Telegram chat through the Bot API sendMessage method.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "surebet.notifications.telegram.enabled", havingValue = "true")
public class TelegramNotificationSink implements NotificationSink {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SurebetProperties.Telegram telegram;

    public TelegramNotificationSink(OkHttpClient httpClient, ObjectMapper objectMapper, SurebetProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.telegram = properties.getNotifications().getTelegram();
        log.info("Telegram notifications enabled for chat {}", telegram.getChatId());
    }

    @Override
    public void send(OpportunityNotification notification) {
        String text = notification.getTitle() + "\n\n" + notification.getBody() + "\n\n#" + notification.getDedupeKey();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", telegram.getChatId());
        payload.put("text", text);
        payload.put("disable_web_page_preview", true);

        Request request;
        try {
            request = new Request.Builder()
                    .url(telegram.getApiUrl() + "/bot" + telegram.getBotToken() + "/sendMessage")
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Failed to encode Telegram message for {}", notification.getDedupeKey(), e);
            return;
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("⚠️ Telegram sendMessage returned HTTP {} for {}", response.code(), notification.getDedupeKey());
                return;
            }
            log.debug("Telegram message sent for {}", notification.getDedupeKey());
        } catch (IOException e) {
            log.error("Failed to send Telegram alert for {}: {}", notification.getDedupeKey(), e.getMessage());
        }
    }
}
