package com.cloudcostbuddy.alert;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one evaluation pass.
 */
public record EvaluationPassReport(
        PassStatus status,
        Instant startedAt,
        Instant finishedAt,
        List<RuleOutcome> outcomes,
        String detail
) {
    public EvaluationPassReport {
        outcomes = List.copyOf(outcomes);
    }

    public enum PassStatus {
        COMPLETED,
        /** Another pass was still running; nothing was evaluated. */
        SKIPPED_ALREADY_RUNNING,
        /** Rules could not be read; retried next tick. */
        ABORTED
    }

    public static EvaluationPassReport completed(Instant startedAt, Instant finishedAt, List<RuleOutcome> outcomes) {
        return new EvaluationPassReport(PassStatus.COMPLETED, startedAt, finishedAt, outcomes, null);
    }

    public static EvaluationPassReport skipped(Instant at) {
        return new EvaluationPassReport(PassStatus.SKIPPED_ALREADY_RUNNING, at, at, List.of(),
                "Previous evaluation pass still running");
    }

    public static EvaluationPassReport aborted(Instant startedAt, Instant finishedAt, String detail) {
        return new EvaluationPassReport(PassStatus.ABORTED, startedAt, finishedAt, List.of(), detail);
    }

    public long count(RuleStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public int totalTriggers() {
        return outcomes.stream().mapToInt(RuleOutcome::triggers).sum();
    }

    public int notificationsDelivered() {
        return outcomes.stream().mapToInt(RuleOutcome::notificationsDelivered).sum();
    }

    public int notificationsFailed() {
        return outcomes.stream().mapToInt(RuleOutcome::notificationsFailed).sum();
    }
}
