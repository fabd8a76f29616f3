package com.cloudcostbuddy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables of the aggregation and alert evaluation engine.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "costbuddy.engine")
public class EngineProperties {

    /**
     * Upper bound for a single provider read. Slower calls are abandoned.
     */
    @NotNull
    private Duration providerTimeout = Duration.ofSeconds(10);

    /**
     * Minimum time between two triggers of the same rule.
     */
    @NotNull
    private Duration cooldown = Duration.ofHours(6);

    /**
     * Scheduler cadence. A pass must finish within this interval minus the safety margin.
     */
    @NotNull
    private Duration evaluationInterval = Duration.ofMinutes(30);

    /**
     * Delay before the first pass after startup.
     */
    @NotNull
    private Duration initialDelay = Duration.ofMinutes(1);

    @NotNull
    private Duration passSafetyMargin = Duration.ofMinutes(2);

    /**
     * Rules evaluated at the same time within one pass.
     */
    @Min(1)
    private int evaluationParallelism = 4;

    @Min(1)
    private int providerReadThreads = 6;

    @NotNull
    private SpikeBaselineMode spikeBaseline = SpikeBaselineMode.FULL_PRIOR_MONTH;

    @Valid
    private Notification notification = new Notification();

    /**
     * Time budget of one evaluation pass.
     */
    public Duration passBudget() {
        Duration budget = evaluationInterval.minus(passSafetyMargin);
        return budget.isNegative() || budget.isZero() ? evaluationInterval : budget;
    }

    /**
     * Which prior-month window spike detection compares month-to-date spend against.
     */
    public enum SpikeBaselineMode {
        /**
         * Whole previous calendar month. Overstates spikes early in the month.
         */
        FULL_PRIOR_MONTH,

        /**
         * Same number of elapsed days at the start of the previous month.
         */
        PRIOR_MONTH_TO_DATE
    }

    @Data
    public static class Notification {

        /**
         * Endpoint of the push gateway. Empty disables webhook delivery.
         */
        private String webhookUrl = "";

        @NotNull
        private Duration webhookTimeout = Duration.ofSeconds(5);
    }
}
