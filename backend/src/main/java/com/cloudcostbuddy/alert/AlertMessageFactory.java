package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.aggregation.AggregationResult;
import com.cloudcostbuddy.domain.model.AlertRule;
import com.cloudcostbuddy.domain.model.AlertType;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.cloudcostbuddy.domain.model.ProviderScope;
import com.cloudcostbuddy.normalization.CostSnapshot;
import com.cloudcostbuddy.normalization.ServiceCost;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the user-facing text and structured payload of alert triggers.
 */
@Component
public class AlertMessageFactory {

    static final int SUMMARY_TOP_SERVICES = 3;

    AlertTrigger budgetThreshold(AlertRule rule, CloudProvider provider, BigDecimal currentValue) {
        String message = String.format(Locale.ROOT,
                "Budget threshold exceeded for %s. Current spend: $%.2f, Threshold: $%.2f",
                provider, currentValue, rule.getThresholdValue());

        Map<String, String> data = baseData(rule, ProviderScope.of(provider));
        data.put("currentValue", plain(currentValue));
        data.put("thresholdValue", plain(rule.getThresholdValue()));

        return new AlertTrigger(ProviderScope.of(provider), currentValue, rule.getThresholdValue(), message, data);
    }

    AlertTrigger spike(AlertRule rule, CloudProvider provider, BigDecimal currentValue, BigDecimal baselineValue) {
        BigDecimal increase = percentageIncrease(currentValue, baselineValue);
        String message = String.format(Locale.ROOT,
                "Cost spike detected for %s. Current: $%.2f, Previous: $%.2f (+%.1f%%)",
                provider, currentValue, baselineValue, increase);

        Map<String, String> data = baseData(rule, ProviderScope.of(provider));
        data.put("currentValue", plain(currentValue));
        data.put("baselineValue", plain(baselineValue));
        data.put("percentageIncrease", plain(increase));
        data.put("thresholdPercentage", String.valueOf(rule.effectiveSpikePercentage()));

        return new AlertTrigger(ProviderScope.of(provider), currentValue, baselineValue, message, data);
    }

    AlertTrigger dailySummary(AlertRule rule, LocalDate day, AggregationResult dayResult,
                              AggregationResult previousDayResult) {
        BigDecimal current = dayResult.view().totalCost();
        BigDecimal previous = previousDayResult.view().totalCost();

        StringBuilder message = new StringBuilder(String.format(Locale.ROOT,
                "Spend on %s: $%.2f (previous day $%.2f).", day, current, previous));
        dayResult.snapshots().forEach((provider, snapshot) -> {
            if (!snapshot.degraded()) {
                message.append(' ').append(providerLine(provider, snapshot));
            }
        });

        Map<String, String> data = baseData(rule, rule.getProviderScope());
        data.put("date", day.toString());
        data.put("currentValue", plain(current));
        data.put("previousValue", plain(previous));

        return new AlertTrigger(rule.getProviderScope(), current, previous, message.toString(), data);
    }

    AlertTrigger weeklySummary(AlertRule rule, LocalDate start, LocalDate endExclusive,
                               AggregationResult weekResult, AggregationResult previousWeekResult) {
        BigDecimal current = weekResult.view().totalCost();
        BigDecimal previous = previousWeekResult.view().totalCost();

        String change = previous.signum() > 0
                ? String.format(Locale.ROOT, "%+.1f%% vs previous week", percentageIncrease(current, previous))
                : "no spend the previous week";
        String message = String.format(Locale.ROOT,
                "Spend from %s to %s: $%.2f (%s, $%.2f).",
                start, endExclusive.minusDays(1), current, change, previous);

        Map<String, String> data = baseData(rule, rule.getProviderScope());
        data.put("startDate", start.toString());
        data.put("endDate", endExclusive.minusDays(1).toString());
        data.put("currentValue", plain(current));
        data.put("previousValue", plain(previous));

        return new AlertTrigger(rule.getProviderScope(), current, previous, message, data);
    }

    /**
     * (current - baseline) / baseline * 100, one decimal. Baseline must be positive.
     */
    static BigDecimal percentageIncrease(BigDecimal current, BigDecimal baseline) {
        return current.subtract(baseline)
                .multiply(BigDecimal.valueOf(100))
                .divide(baseline, 1, RoundingMode.HALF_UP);
    }

    String title(AlertType type) {
        return type.getTitle();
    }

    private String providerLine(CloudProvider provider, CostSnapshot snapshot) {
        String topServices = snapshot.services().stream()
                .sorted(Comparator.comparing(ServiceCost::cost).reversed())
                .limit(SUMMARY_TOP_SERVICES)
                .map(s -> String.format(Locale.ROOT, "%s $%.2f", s.canonicalName(), s.cost()))
                .collect(Collectors.joining(", "));
        return topServices.isEmpty()
                ? String.format(Locale.ROOT, "%s: $%.2f.", provider, snapshot.totalCost())
                : String.format(Locale.ROOT, "%s: $%.2f (%s).", provider, snapshot.totalCost(), topServices);
    }

    private Map<String, String> baseData(AlertRule rule, ProviderScope provider) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", rule.getType().name().toLowerCase(Locale.ROOT));
        data.put("ruleId", String.valueOf(rule.getId()));
        data.put("provider", provider.name());
        return data;
    }

    private static String plain(BigDecimal value) {
        return value.toPlainString();
    }
}
