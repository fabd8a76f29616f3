package com.cloudcostbuddy.alert;

/**
 * A stored rule cannot be evaluated as configured.
 */
public class RuleConfigurationException extends RuntimeException {

    private final Long ruleId;

    public RuleConfigurationException(Long ruleId, String message) {
        super("Rule " + ruleId + ": " + message);
        this.ruleId = ruleId;
    }

    public Long getRuleId() {
        return ruleId;
    }
}
