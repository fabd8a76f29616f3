package com.cloudcostbuddy.scheduler;

import com.cloudcostbuddy.alert.AlertEvaluator;
import com.cloudcostbuddy.alert.EvaluationPassReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertEvaluationJobTest {

    private static final Instant NOW = Instant.parse("2024-05-15T00:00:00Z");

    @Mock
    private AlertEvaluator alertEvaluator;

    @InjectMocks
    private AlertEvaluationJob job;

    @Test
    void shouldRunOnePassPerTick() {
        when(alertEvaluator.runEvaluationPass())
                .thenReturn(EvaluationPassReport.completed(NOW, NOW.plusSeconds(3), List.of()));

        job.evaluateAlerts();

        verify(alertEvaluator).runEvaluationPass();
    }

    @Test
    void shouldTolerateSkippedAndAbortedPasses() {
        when(alertEvaluator.runEvaluationPass())
                .thenReturn(EvaluationPassReport.skipped(NOW))
                .thenReturn(EvaluationPassReport.aborted(NOW, NOW, "db down"));

        job.evaluateAlerts();
        job.evaluateAlerts();

        verify(alertEvaluator, times(2)).runEvaluationPass();
    }
}
