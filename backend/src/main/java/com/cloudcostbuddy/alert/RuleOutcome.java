package com.cloudcostbuddy.alert;

/**
 * Per-rule line of an {@link EvaluationPassReport}.
 *
 * @param ruleId                 evaluated rule
 * @param status                 what happened
 * @param triggers               history entries written
 * @param notificationsDelivered dispatches reported as delivered
 * @param notificationsFailed    dispatches that failed or were not delivered
 * @param detail                 short explanation for logs and callers
 */
public record RuleOutcome(
        Long ruleId,
        RuleStatus status,
        int triggers,
        int notificationsDelivered,
        int notificationsFailed,
        String detail
) {
    public static RuleOutcome of(Long ruleId, RuleStatus status, String detail) {
        return new RuleOutcome(ruleId, status, 0, 0, 0, detail);
    }
}
