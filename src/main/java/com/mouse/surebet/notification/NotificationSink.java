package com.mouse.surebet.notification;

import com.mouse.surebet.model.OpportunityNotification;

/**
 * Receives one message per newly detected opportunity. Delivery and display are up to the sink.
 */
public interface NotificationSink {

    void send(OpportunityNotification notification);
}
