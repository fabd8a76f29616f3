package com.cloudcostbuddy.normalization;

import com.cloudcostbuddy.adapters.RawCostData;
import com.cloudcostbuddy.analytics.TrendPoint;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Central service for normalizing cost data across cloud providers.
 *
 * NORMALIZATION PRINCIPLES:
 * 1. Never throw on provider input; always return a structurally valid snapshot
 * 2. Missing amounts are zero, missing currency is USD, missing services is empty
 * 3. Service labels are mapped to the canonical taxonomy
 * 4. Unusable payloads produce an empty snapshot flagged as degraded
 *
 * This service is the boundary between provider-specific readers and the
 * provider-agnostic aggregation and alerting layers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostNormalizationService {

    public static final String DEFAULT_CURRENCY = "USD";

    static final BigDecimal SUM_TOLERANCE = new BigDecimal("0.01");

    private final ServiceNameCanonicalizer canonicalizer;
    private final Clock clock;

    /**
     * Normalize one provider response into a {@link CostSnapshot}.
     */
    public CostSnapshot normalize(RawCostData raw) {
        CloudProvider provider = raw.provider();
        DatePeriod fallbackPeriod = requestedPeriod(raw);

        JsonNode payload = raw.payload();
        if (payload == null || !payload.isObject()) {
            log.warn("Malformed {} cost payload ({}), returning degraded snapshot",
                    provider, payload == null ? "null" : payload.getNodeType());
            return degradedSnapshot(provider, fallbackPeriod);
        }

        try {
            String currency = text(payload.get("currency")).orElse(DEFAULT_CURRENCY);
            DatePeriod period = parsePeriod(payload.get("period")).orElse(fallbackPeriod);
            List<ServiceCost> services = normalizeServices(payload.get("services"), currency);

            BigDecimal servicesTotal = services.stream()
                    .map(ServiceCost::cost)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            Optional<BigDecimal> reportedTotal = amount(payload.get("totalCost"));
            BigDecimal totalCost = reportedTotal.orElse(servicesTotal);

            if (!services.isEmpty()
                    && totalCost.subtract(servicesTotal).abs().compareTo(SUM_TOLERANCE) > 0) {
                log.warn("{} services sum {} does not match total {}; keeping total only",
                        provider, servicesTotal, totalCost);
                services = List.of();
            }

            return new CostSnapshot(provider, totalCost, currency, period, services,
                    false, clock.instant());

        } catch (RuntimeException e) {
            log.error("Failed to normalize {} cost payload", provider, e);
            return degradedSnapshot(provider, fallbackPeriod);
        }
    }

    /**
     * Normalize the {@code trends} array of a range response into a daily
     * series, sorted by date, duplicate dates summed. Entries without a
     * parseable date are dropped.
     */
    public List<TrendPoint> normalizeTrend(RawCostData raw) {
        JsonNode payload = raw.payload();
        if (payload == null || !payload.isObject() || !payload.path("trends").isArray()) {
            log.debug("No trend data in {} payload", raw.provider());
            return List.of();
        }

        SortedMap<LocalDate, BigDecimal> byDate = new TreeMap<>();
        for (JsonNode point : payload.get("trends")) {
            Optional<LocalDate> date = date(point.get("date"));
            if (date.isEmpty()) {
                log.debug("Skipping {} trend point without a valid date: {}", raw.provider(), point);
                continue;
            }
            BigDecimal cost = amount(point.get("cost")).orElse(BigDecimal.ZERO);
            byDate.merge(date.get(), cost, BigDecimal::add);
        }

        return byDate.entrySet().stream()
                .map(e -> new TrendPoint(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Merge snapshots from several providers into one view.
     *
     * Services are keyed by canonical name. Every provider service line is kept
     * as a contributor, so a provider reporting two lines with the same
     * canonical name adds both. The result is sorted by descending cost, ties
     * by canonical name.
     */
    public CombinedView combineMultiCloudData(List<CostSnapshot> snapshots) {
        BigDecimal totalCost = BigDecimal.ZERO;
        String currency = null;
        Map<CloudProvider, ProviderSummary> perProvider = new EnumMap<>(CloudProvider.class);
        Map<String, ServiceAccumulator> services = new LinkedHashMap<>();

        for (CostSnapshot snapshot : snapshots) {
            if (snapshot == null) {
                continue;
            }
            if (currency == null) {
                currency = snapshot.currency();
            } else if (!currency.equals(snapshot.currency())) {
                log.warn("Combining {} amounts in {} with {}; amounts are not converted",
                        snapshot.provider(), snapshot.currency(), currency);
            }

            totalCost = totalCost.add(snapshot.totalCost());
            perProvider.merge(
                    snapshot.provider(),
                    new ProviderSummary(snapshot.totalCost(), snapshot.currency(),
                            snapshot.services().size(), snapshot.degraded()),
                    (a, b) -> new ProviderSummary(a.totalCost().add(b.totalCost()), a.currency(),
                            a.serviceCount() + b.serviceCount(), a.degraded() || b.degraded()));

            for (ServiceCost service : snapshot.services()) {
                services.computeIfAbsent(service.canonicalName(),
                                name -> new ServiceAccumulator(name, service.currency()))
                        .add(new ServiceContribution(snapshot.provider(), service.cost(),
                                service.originalName()));
            }
        }

        List<CombinedService> combined = services.values().stream()
                .map(ServiceAccumulator::toCombinedService)
                .sorted(Comparator.comparing(CombinedService::totalCost).reversed()
                        .thenComparing(CombinedService::canonicalName))
                .toList();

        return new CombinedView(
                totalCost,
                currency != null ? currency : DEFAULT_CURRENCY,
                perProvider,
                combined,
                clock.instant()
        );
    }

    private List<ServiceCost> normalizeServices(JsonNode servicesNode, String defaultCurrency) {
        if (servicesNode == null || !servicesNode.isArray()) {
            return List.of();
        }

        List<ServiceCost> services = new ArrayList<>();
        for (JsonNode service : servicesNode) {
            if (!service.isObject()) {
                log.debug("Skipping non-object service entry: {}", service);
                continue;
            }
            String originalName = text(service.get("name"))
                    .or(() -> text(service.get("serviceName")))
                    .orElse(null);

            services.add(new ServiceCost(
                    canonicalizer.canonicalize(originalName),
                    amount(service.get("cost")).orElse(BigDecimal.ZERO),
                    text(service.get("currency")).orElse(defaultCurrency),
                    originalName
            ));
        }
        return services;
    }

    private CostSnapshot degradedSnapshot(CloudProvider provider, DatePeriod period) {
        return new CostSnapshot(provider, BigDecimal.ZERO, DEFAULT_CURRENCY, period,
                List.of(), true, clock.instant());
    }

    private DatePeriod requestedPeriod(RawCostData raw) {
        if (DatePeriod.isValid(raw.requestedStart(), raw.requestedEnd())) {
            return new DatePeriod(raw.requestedStart(), raw.requestedEnd());
        }
        LocalDate today = LocalDate.now(clock);
        return new DatePeriod(today.withDayOfMonth(1), today.plusDays(1));
    }

    private Optional<DatePeriod> parsePeriod(JsonNode periodNode) {
        if (periodNode == null || !periodNode.isObject()) {
            return Optional.empty();
        }
        Optional<LocalDate> start = date(periodNode.get("start"));
        Optional<LocalDate> end = date(periodNode.get("end"));
        if (start.isPresent() && end.isPresent() && DatePeriod.isValid(start.get(), end.get())) {
            return Optional.of(new DatePeriod(start.get(), end.get()));
        }
        return Optional.empty();
    }

    /**
     * Non-negative amount from a number or numeric string. Credits are clamped to zero.
     */
    private static Optional<BigDecimal> amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                value = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Unparseable amount '{}', using zero", node.asText());
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(value.signum() < 0 ? BigDecimal.ZERO : value);
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText().trim());
    }

    private static Optional<LocalDate> date(JsonNode node) {
        return text(node).flatMap(value -> {
            try {
                // Accept full timestamps by keeping the date part
                return Optional.of(LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        });
    }

    private static final class ServiceAccumulator {
        private final String canonicalName;
        private final String currency;
        private final List<ServiceContribution> contributors = new ArrayList<>();
        private BigDecimal totalCost = BigDecimal.ZERO;

        private ServiceAccumulator(String canonicalName, String currency) {
            this.canonicalName = canonicalName;
            this.currency = currency;
        }

        private void add(ServiceContribution contribution) {
            contributors.add(contribution);
            totalCost = totalCost.add(contribution.cost());
        }

        private CombinedService toCombinedService() {
            return new CombinedService(canonicalName, totalCost, currency, contributors);
        }
    }
}
