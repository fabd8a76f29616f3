package com.cloudcostbuddy.alert;

/**
 * Rule or history storage could not be read or written.
 */
public class AlertPersistenceException extends RuntimeException {

    public AlertPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
