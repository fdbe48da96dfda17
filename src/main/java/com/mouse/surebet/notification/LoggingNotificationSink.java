package com.mouse.surebet.notification;

import com.mouse.surebet.model.OpportunityNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(OpportunityNotification notification) {
        log.info("🔔 [{}] {} | {} | tag={}",
                notification.getEngine(),
                notification.getTitle(),
                notification.getBody().replace('\n', ' '),
                notification.getDedupeKey());
    }
}
