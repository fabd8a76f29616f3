package com.cloudcostbuddy.notification;

/**
 * The notification channel could not be reached.
 */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
