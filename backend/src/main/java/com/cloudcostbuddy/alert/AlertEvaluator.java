package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.adapters.Granularity;
import com.cloudcostbuddy.aggregation.AggregationResult;
import com.cloudcostbuddy.aggregation.MultiCloudAggregator;
import com.cloudcostbuddy.config.EngineProperties;
import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;
import com.cloudcostbuddy.domain.model.AlertType;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.cloudcostbuddy.notification.DispatchResult;
import com.cloudcostbuddy.notification.NotificationDispatcher;
import com.cloudcostbuddy.notification.NotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic reconciliation of alert rules against current spend.
 *
 * PASS LIFECYCLE:
 * 1. Refuse to start while another pass is running
 * 2. Load enabled rules; a storage outage here aborts the pass
 * 3. Evaluate rules concurrently, at most evaluationParallelism at a time;
 *    rules not started before the pass deadline are deferred to the next
 *    tick, started ones finish
 *
 * RULE LIFECYCLE (Idle -> Evaluating -> Triggered | NotTriggered -> Idle):
 * 1. Skip if the rule fired within its cooldown window
 * 2. Validate configuration; invalid rules are skipped with a warning
 * 3. Compare spend per provider in scope (or build a summary)
 * 4. Record history and the conditional lastTriggeredAt update in one transaction
 * 5. Only after the commit, dispatch one notification per history entry
 *
 * Failures stay local. A provider failure or an unusable (degraded) payload
 * drops that provider for the cycle. A rule failure never affects other
 * rules. A dispatch failure never touches history or cooldown state.
 */
@Service
@Slf4j
public class AlertEvaluator {

    private final AlertStore alertStore;
    private final MultiCloudAggregator aggregator;
    private final AlertTriggerRecorder triggerRecorder;
    private final NotificationDispatcher notificationDispatcher;
    private final AlertMessageFactory messageFactory;
    private final EngineProperties properties;
    private final Clock clock;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public AlertEvaluator(
            AlertStore alertStore,
            MultiCloudAggregator aggregator,
            AlertTriggerRecorder triggerRecorder,
            NotificationDispatcher notificationDispatcher,
            AlertMessageFactory messageFactory,
            EngineProperties properties,
            Clock clock,
            @Qualifier("alertEvaluationExecutor") Executor executor
    ) {
        this.alertStore = alertStore;
        this.aggregator = aggregator;
        this.triggerRecorder = triggerRecorder;
        this.notificationDispatcher = notificationDispatcher;
        this.messageFactory = messageFactory;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Run one evaluation pass over all enabled rules.
     * Returns immediately with a skipped report if a pass is already running.
     */
    public EvaluationPassReport runEvaluationPass() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Alert evaluation pass requested while another pass is running - skipping");
            return EvaluationPassReport.skipped(clock.instant());
        }
        try {
            return evaluateAll();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private EvaluationPassReport evaluateAll() {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(properties.passBudget());
        log.info("Starting alert evaluation pass (deadline {})", deadline);

        List<AlertRule> rules;
        try {
            rules = alertStore.listEnabledRules();
        } catch (AlertPersistenceException | DataAccessException e) {
            log.error("Cannot load alert rules, aborting pass until next tick", e);
            return EvaluationPassReport.aborted(startedAt, clock.instant(), e.getMessage());
        }

        log.info("Found {} enabled alert rules", rules.size());

        EvaluationPassContext context = new EvaluationPassContext(aggregator, LocalDate.now(clock));
        Semaphore slots = new Semaphore(properties.getEvaluationParallelism());
        List<CompletableFuture<RuleOutcome>> futures = new ArrayList<>(rules.size());
        for (AlertRule rule : rules) {
            futures.add(submit(rule, context, deadline, slots));
        }
        List<RuleOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        EvaluationPassReport report = EvaluationPassReport.completed(startedAt, clock.instant(), outcomes);
        log.info("Alert evaluation complete: {} triggered, {} not triggered, {} in cooldown, {} invalid, "
                        + "{} persistence failures, {} deferred, {} failed; {} notifications delivered, {} failed",
                report.count(RuleStatus.TRIGGERED),
                report.count(RuleStatus.NOT_TRIGGERED),
                report.count(RuleStatus.COOLDOWN),
                report.count(RuleStatus.INVALID),
                report.count(RuleStatus.PERSISTENCE_FAILED),
                report.count(RuleStatus.DEFERRED),
                report.count(RuleStatus.FAILED),
                report.notificationsDelivered(),
                report.notificationsFailed());
        return report;
    }

    /**
     * Hands a rule to the executor once a slot is free, so the executor queue
     * never has to hold the whole rule list.
     */
    private CompletableFuture<RuleOutcome> submit(AlertRule rule, EvaluationPassContext context, Instant deadline,
                                                  Semaphore slots) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while scheduling rule {}, deferring to next pass", rule.getId());
            return CompletableFuture.completedFuture(
                    RuleOutcome.of(rule.getId(), RuleStatus.DEFERRED, "Pass interrupted"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> evaluateGuarded(rule, context, deadline), executor)
                    .whenComplete((outcome, error) -> slots.release());
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Evaluation executor rejected rule {}, deferring to next pass", rule.getId());
            return CompletableFuture.completedFuture(
                    RuleOutcome.of(rule.getId(), RuleStatus.DEFERRED, "Rejected by evaluation executor"));
        }
    }

    private RuleOutcome evaluateGuarded(AlertRule rule, EvaluationPassContext context, Instant deadline) {
        try {
            return evaluateRule(rule, context, deadline);
        } catch (RuntimeException e) {
            log.error("Failed to evaluate alert rule {}", rule.getId(), e);
            return RuleOutcome.of(rule.getId(), RuleStatus.FAILED, e.toString());
        }
    }

    RuleOutcome evaluateRule(AlertRule rule, EvaluationPassContext context, Instant deadline) {
        if (clock.instant().isAfter(deadline)) {
            log.debug("Pass deadline passed before rule {} started, deferring", rule.getId());
            return RuleOutcome.of(rule.getId(), RuleStatus.DEFERRED, "Pass deadline reached");
        }

        // Millisecond precision so the stored value compares equal on the next conditional update
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant previous = rule.getLastTriggeredAt();

        if (inCooldown(rule, previous, now)) {
            log.debug("Alert rule {} is in cooldown period (last triggered {})", rule.getId(), previous);
            return RuleOutcome.of(rule.getId(), RuleStatus.COOLDOWN, "Last triggered at " + previous);
        }

        try {
            validate(rule);
        } catch (RuleConfigurationException e) {
            log.warn("Skipping misconfigured alert rule: {}", e.getMessage());
            return RuleOutcome.of(rule.getId(), RuleStatus.INVALID, e.getMessage());
        }

        List<AlertTrigger> triggers = switch (rule.getType()) {
            case BUDGET_THRESHOLD -> evaluateBudget(rule, context);
            case SPIKE_DETECTION -> evaluateSpike(rule, context);
            case DAILY_SUMMARY -> evaluateDailySummary(rule, context);
            case WEEKLY_SUMMARY -> evaluateWeeklySummary(rule, context);
        };

        if (triggers.isEmpty()) {
            return RuleOutcome.of(rule.getId(), RuleStatus.NOT_TRIGGERED, null);
        }

        return recordAndDispatch(rule, previous, now, triggers);
    }

    /**
     * Effective cooldown is the configured window, stretched to the rule type's
     * minimum interval for summaries.
     */
    boolean inCooldown(AlertRule rule, Instant previous, Instant now) {
        if (previous == null) {
            return false;
        }
        Duration cooldown = properties.getCooldown();
        if (rule.getType() != null && rule.getType().getMinimumInterval().compareTo(cooldown) > 0) {
            cooldown = rule.getType().getMinimumInterval();
        }
        return now.isBefore(previous.plus(cooldown));
    }

    private void validate(AlertRule rule) {
        if (rule.getType() == null) {
            throw new RuleConfigurationException(rule.getId(), "missing alert type");
        }
        if (rule.getProviderScope() == null) {
            throw new RuleConfigurationException(rule.getId(), "missing provider scope");
        }
        if (rule.getOwnerId() == null || rule.getOwnerId().isBlank()) {
            throw new RuleConfigurationException(rule.getId(), "missing owner");
        }
        if (rule.getType() == AlertType.BUDGET_THRESHOLD) {
            if (rule.getThresholdValue() == null) {
                throw new RuleConfigurationException(rule.getId(), "budget threshold rule without thresholdValue");
            }
            if (rule.getThresholdValue().signum() < 0) {
                throw new RuleConfigurationException(rule.getId(),
                        "negative thresholdValue " + rule.getThresholdValue());
            }
        }
        if (rule.getType() == AlertType.SPIKE_DETECTION && rule.effectiveSpikePercentage() < 1) {
            throw new RuleConfigurationException(rule.getId(),
                    "thresholdPercentage must be at least 1, got " + rule.getThresholdPercentage());
        }
    }

    private List<AlertTrigger> evaluateBudget(AlertRule rule, EvaluationPassContext context) {
        AggregationResult current = context.current(rule.getProviderScope());

        List<AlertTrigger> triggers = new ArrayList<>();
        for (CloudProvider provider : rule.getProviderScope().providers()) {
            if (!current.hasUsableData(provider)) {
                log.debug("Rule {}: {} unavailable this cycle", rule.getId(), provider);
                continue;
            }
            BigDecimal currentValue = current.costOf(provider).orElse(BigDecimal.ZERO);
            if (currentValue.compareTo(rule.getThresholdValue()) >= 0) {
                triggers.add(messageFactory.budgetThreshold(rule, provider, currentValue));
            }
        }
        return triggers;
    }

    private List<AlertTrigger> evaluateSpike(AlertRule rule, EvaluationPassContext context) {
        LocalDate today = context.today();
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate tomorrow = today.plusDays(1);
        LocalDate baselineStart = monthStart.minusMonths(1);
        LocalDate baselineEnd = baselineEnd(baselineStart, monthStart, tomorrow);

        AggregationResult current = context.range(rule.getProviderScope(), monthStart, tomorrow, Granularity.MONTHLY);
        AggregationResult baseline = context.range(rule.getProviderScope(), baselineStart, baselineEnd, Granularity.MONTHLY);

        List<AlertTrigger> triggers = new ArrayList<>();
        for (CloudProvider provider : rule.getProviderScope().providers()) {
            if (!current.hasUsableData(provider) || !baseline.hasUsableData(provider)) {
                log.debug("Rule {}: {} unavailable this cycle", rule.getId(), provider);
                continue;
            }
            BigDecimal currentValue = current.costOf(provider).orElse(BigDecimal.ZERO);
            BigDecimal baselineValue = baseline.costOf(provider).orElse(BigDecimal.ZERO);
            if (isSpike(currentValue, baselineValue, rule.effectiveSpikePercentage())) {
                triggers.add(messageFactory.spike(rule, provider, currentValue, baselineValue));
            }
        }
        return triggers;
    }

    /**
     * (current - baseline) / baseline * 100 >= percentage, compared without division.
     * A zero baseline never spikes.
     */
    static boolean isSpike(BigDecimal current, BigDecimal baseline, int thresholdPercentage) {
        if (baseline.signum() <= 0) {
            return false;
        }
        BigDecimal scaledIncrease = current.subtract(baseline).multiply(BigDecimal.valueOf(100));
        return scaledIncrease.compareTo(baseline.multiply(BigDecimal.valueOf(thresholdPercentage))) >= 0;
    }

    private LocalDate baselineEnd(LocalDate baselineStart, LocalDate monthStart, LocalDate tomorrow) {
        if (properties.getSpikeBaseline() == EngineProperties.SpikeBaselineMode.PRIOR_MONTH_TO_DATE) {
            long elapsedDays = ChronoUnit.DAYS.between(monthStart, tomorrow);
            LocalDate end = baselineStart.plusDays(elapsedDays);
            return end.isAfter(monthStart) ? monthStart : end;
        }
        return monthStart;
    }

    private List<AlertTrigger> evaluateDailySummary(AlertRule rule, EvaluationPassContext context) {
        LocalDate today = context.today();
        LocalDate yesterday = today.minusDays(1);

        AggregationResult day = context.range(rule.getProviderScope(), yesterday, today, Granularity.DAILY);
        AggregationResult previousDay = context.range(rule.getProviderScope(), yesterday.minusDays(1), yesterday,
                Granularity.DAILY);

        if (!day.hasAnyUsableData()) {
            log.warn("Rule {}: no provider data for daily summary, retrying next cycle", rule.getId());
            return List.of();
        }
        return List.of(messageFactory.dailySummary(rule, yesterday, day, previousDay));
    }

    private List<AlertTrigger> evaluateWeeklySummary(AlertRule rule, EvaluationPassContext context) {
        LocalDate today = context.today();
        LocalDate weekStart = today.minusDays(7);

        AggregationResult week = context.range(rule.getProviderScope(), weekStart, today, Granularity.DAILY);
        AggregationResult previousWeek = context.range(rule.getProviderScope(), weekStart.minusDays(7), weekStart,
                Granularity.DAILY);

        if (!week.hasAnyUsableData()) {
            log.warn("Rule {}: no provider data for weekly summary, retrying next cycle", rule.getId());
            return List.of();
        }
        return List.of(messageFactory.weeklySummary(rule, weekStart, today, week, previousWeek));
    }

    private RuleOutcome recordAndDispatch(AlertRule rule, Instant previous, Instant now, List<AlertTrigger> triggers) {
        List<AlertHistoryEntry> entries = triggers.stream()
                .map(trigger -> AlertHistoryEntry.builder()
                        .ruleId(rule.getId())
                        .ownerId(rule.getOwnerId())
                        .alertType(rule.getType())
                        .triggeredAt(now)
                        .currentValue(trigger.currentValue())
                        .comparisonValue(trigger.comparisonValue())
                        .provider(trigger.provider())
                        .message(trigger.message())
                        .build())
                .toList();

        List<AlertHistoryEntry> stored;
        try {
            stored = triggerRecorder.record(rule, previous, now, entries);
        } catch (ConcurrentTriggerException e) {
            log.info("Alert rule {} already triggered by another evaluator, skipping", rule.getId());
            return RuleOutcome.of(rule.getId(), RuleStatus.CONCURRENT_TRIGGER, e.getMessage());
        } catch (AlertPersistenceException | DataAccessException | TransactionException e) {
            log.error("Failed to record trigger of alert rule {}, will retry next pass", rule.getId(), e);
            return RuleOutcome.of(rule.getId(), RuleStatus.PERSISTENCE_FAILED, e.getMessage());
        }

        rule.setLastTriggeredAt(now);

        int delivered = 0;
        int failed = 0;
        for (int i = 0; i < stored.size(); i++) {
            if (dispatch(rule, stored.get(i), triggers.get(i))) {
                delivered++;
            } else {
                failed++;
            }
        }

        log.info("Alert rule {} ({}) triggered for user {}: {} entries, {} notifications delivered",
                rule.getId(), rule.getType(), rule.getOwnerId(), stored.size(), delivered);
        return new RuleOutcome(rule.getId(), RuleStatus.TRIGGERED, stored.size(), delivered, failed, null);
    }

    private boolean dispatch(AlertRule rule, AlertHistoryEntry entry, AlertTrigger trigger) {
        Map<String, String> data = new LinkedHashMap<>(trigger.data());
        if (entry.getId() != null) {
            data.put("historyId", String.valueOf(entry.getId()));
        }
        data.put("triggeredAt", entry.getTriggeredAt().toString());

        NotificationMessage message = new NotificationMessage(
                rule.getOwnerId(), messageFactory.title(rule.getType()), entry.getMessage(), data);
        try {
            DispatchResult result = notificationDispatcher.send(message);
            if (!result.delivered()) {
                log.warn("Notification for alert rule {} not delivered: {}", rule.getId(), result.detail());
            }
            return result.delivered();
        } catch (RuntimeException e) {
            log.error("Notification dispatch failed for alert rule {} (history {})", rule.getId(), entry.getId(), e);
            return false;
        }
    }
}
