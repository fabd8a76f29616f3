package com.cloudcostbuddy.alert;

/**
 * Another evaluator advanced the rule's last trigger time first.
 * Thrown inside the trigger transaction so that it rolls back.
 */
public class ConcurrentTriggerException extends RuntimeException {

    public ConcurrentTriggerException(Long ruleId) {
        super("Rule " + ruleId + " was triggered concurrently");
    }
}
