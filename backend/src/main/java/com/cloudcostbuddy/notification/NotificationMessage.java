package com.cloudcostbuddy.notification;

import java.util.Map;

/**
 * Fully formed notification for one user.
 *
 * @param userId recipient
 * @param title  short headline
 * @param body   human-readable text
 * @param data   structured payload for the client (alert type, provider, values)
 */
public record NotificationMessage(
        String userId,
        String title,
        String body,
        Map<String, String> data
) {
    public NotificationMessage {
        data = Map.copyOf(data);
    }
}
