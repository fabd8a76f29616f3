package com.cloudcostbuddy.scheduler;

import com.cloudcostbuddy.alert.AlertEvaluator;
import com.cloudcostbuddy.alert.EvaluationPassReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scheduled job that reconciles alert rules against current spend.
 *
 * Runs every {@code costbuddy.engine.evaluation-interval}. A tick that finds
 * the previous pass still running is skipped by the evaluator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluationJob {

    private final AlertEvaluator alertEvaluator;

    @Scheduled(
            fixedRateString = "${costbuddy.engine.evaluation-interval:PT30M}",
            initialDelayString = "${costbuddy.engine.initial-delay:PT1M}"
    )
    public void evaluateAlerts() {
        EvaluationPassReport report = alertEvaluator.runEvaluationPass();

        switch (report.status()) {
            case COMPLETED -> log.info("Alert pass finished in {} ms: {} rules, {} triggers",
                    Duration.between(report.startedAt(), report.finishedAt()).toMillis(),
                    report.outcomes().size(), report.totalTriggers());
            case SKIPPED_ALREADY_RUNNING -> log.warn("Alert pass skipped: {}", report.detail());
            case ABORTED -> log.error("Alert pass aborted: {}", report.detail());
        }
    }
}
