package com.cloudcostbuddy.notification;

/**
 * Port to the push/email delivery channel.
 *
 * Delivery is best-effort. Implementations may report a non-delivery through
 * {@link DispatchResult} or throw; the engine logs either and never rolls
 * back alert history because of it.
 */
public interface NotificationDispatcher {

    DispatchResult send(NotificationMessage message);
}
