package com.cloudcostbuddy.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes notifications to the log instead of delivering them.
 * Used when no push gateway is configured.
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public DispatchResult send(NotificationMessage message) {
        log.info("NOTIFY {}: [{}] {} {}", message.userId(), message.title(), message.body(), message.data());
        return DispatchResult.delivered("logged");
    }
}
