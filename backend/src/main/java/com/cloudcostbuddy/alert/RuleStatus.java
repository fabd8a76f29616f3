package com.cloudcostbuddy.alert;

/**
 * Result of evaluating one rule in one pass.
 */
public enum RuleStatus {
    TRIGGERED,
    NOT_TRIGGERED,
    /** Skipped because the rule fired within its cooldown window. */
    COOLDOWN,
    /** Skipped because the rule is misconfigured. */
    INVALID,
    /** Trigger detected but not durably recorded; retried next pass. */
    PERSISTENCE_FAILED,
    /** Another evaluator recorded a trigger for the rule first. */
    CONCURRENT_TRIGGER,
    /** Not started before the pass deadline. */
    DEFERRED,
    /** Unexpected error while evaluating. */
    FAILED
}
