package com.cloudcostbuddy.notification;

/**
 * Outcome of one delivery attempt.
 */
public record DispatchResult(boolean delivered, String detail) {

    public static DispatchResult delivered(String detail) {
        return new DispatchResult(true, detail);
    }

    public static DispatchResult notDelivered(String detail) {
        return new DispatchResult(false, detail);
    }
}
