package com.cloudcostbuddy.domain.model;

import java.time.Duration;

/**
 * Kinds of alert rules the evaluator understands.
 */
public enum AlertType {

    /**
     * Fires when current-period spend reaches a fixed amount.
     */
    BUDGET_THRESHOLD("Budget Threshold Exceeded", Duration.ZERO),

    /**
     * Fires when month-to-date spend grows past a percentage of the prior month.
     */
    SPIKE_DETECTION("Cost Spike Detected", Duration.ZERO),

    /**
     * Scheduled notification with yesterday's spend.
     */
    DAILY_SUMMARY("Daily Cost Summary", Duration.ofDays(1)),

    /**
     * Scheduled notification with the last seven days of spend.
     */
    WEEKLY_SUMMARY("Weekly Cost Summary", Duration.ofDays(7));

    private final String title;
    private final Duration minimumInterval;

    AlertType(String title, Duration minimumInterval) {
        this.title = title;
        this.minimumInterval = minimumInterval;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Shortest time between two triggers regardless of the configured cooldown.
     */
    public Duration getMinimumInterval() {
        return minimumInterval;
    }

    public boolean isSummary() {
        return this == DAILY_SUMMARY || this == WEEKLY_SUMMARY;
    }
}
