package com.cloudcostbuddy.config;

import com.cloudcostbuddy.adapters.Granularity;
import com.cloudcostbuddy.adapters.ProviderCostReader;
import com.cloudcostbuddy.adapters.RawCostData;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.LongStream;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * Provides mock cost readers that answer in each provider's own payload
 * shape, so the normalization layer is exercised end to end without cloud
 * credentials. Amounts are derived from the date, so repeated queries for
 * the same window agree.
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    public ProviderCostReader mockAwsReader(ObjectMapper objectMapper, Clock clock) {
        log.info("LOCAL MODE: Using mock AWS cost reader");
        return new MockCostReader(CloudProvider.AWS, objectMapper, clock, Map.of(
                "Amazon Elastic Compute Cloud - Compute", 18.0,
                "Amazon Simple Storage Service", 4.2,
                "Amazon Relational Database Service", 9.5,
                "AWS Lambda", 0.8
        ));
    }

    @Bean
    public ProviderCostReader mockAzureReader(ObjectMapper objectMapper, Clock clock) {
        log.info("LOCAL MODE: Using mock Azure cost reader");
        return new MockCostReader(CloudProvider.AZURE, objectMapper, clock, Map.of(
                "Virtual Machines", 15.5,
                "Storage", 3.1,
                "SQL Database", 7.4,
                "Azure Functions", 0.6
        ));
    }

    @Bean
    public ProviderCostReader mockGcpReader(ObjectMapper objectMapper, Clock clock) {
        log.info("LOCAL MODE: Using mock GCP cost reader");
        return new MockCostReader(CloudProvider.GCP, objectMapper, clock, Map.of(
                "Compute Engine", 11.0,
                "Cloud Storage", 2.4,
                "BigQuery", 5.3,
                "Cloud Run", 1.2
        ));
    }

    /**
     * Mock reader producing provider-flavoured payloads:
     * AWS sends amounts as strings under {@code serviceName}, Azure and GCP
     * send numbers under {@code name}.
     */
    static class MockCostReader implements ProviderCostReader {
        private final CloudProvider provider;
        private final ObjectMapper objectMapper;
        private final Clock clock;
        private final Map<String, Double> dailyBaseCosts;

        MockCostReader(CloudProvider provider, ObjectMapper objectMapper, Clock clock,
                       Map<String, Double> dailyBaseCosts) {
            this.provider = provider;
            this.objectMapper = objectMapper;
            this.clock = clock;
            this.dailyBaseCosts = dailyBaseCosts;
        }

        @Override
        public CloudProvider getProvider() {
            return provider;
        }

        @Override
        public RawCostData getCurrentPeriodCost() {
            LocalDate today = LocalDate.now(clock);
            return getRange(today.withDayOfMonth(1), today.plusDays(1), Granularity.DAILY);
        }

        @Override
        public RawCostData getRange(LocalDate start, LocalDate end, Granularity granularity) {
            log.debug("MOCK: Fetching {} {} costs from {} to {}", provider, granularity, start, end);

            ObjectNode payload = objectMapper.createObjectNode();
            ArrayNode services = payload.putArray("services");
            BigDecimal total = BigDecimal.ZERO;

            for (String service : dailyBaseCosts.keySet().stream().sorted().toList()) {
                BigDecimal cost = BigDecimal.ZERO;
                for (LocalDate day = start; day.isBefore(end); day = day.plusDays(1)) {
                    cost = cost.add(dailyCost(service, day));
                }
                total = total.add(cost);
                ObjectNode node = services.addObject();
                if (provider == CloudProvider.AWS) {
                    node.put("serviceName", service);
                    node.put("cost", cost.toPlainString());
                } else {
                    node.put("name", service);
                    node.put("cost", cost);
                }
            }

            if (provider == CloudProvider.AWS) {
                payload.put("totalCost", total.toPlainString());
            } else {
                payload.put("totalCost", total);
            }
            payload.put("currency", "USD");
            ObjectNode period = payload.putObject("period");
            period.put("start", start.toString());
            period.put("end", end.toString());

            ArrayNode trends = payload.putArray("trends");
            for (LocalDate bucket : buckets(start, end, granularity)) {
                LocalDate bucketEnd = granularity == Granularity.MONTHLY
                        ? min(YearMonth.from(bucket).plusMonths(1).atDay(1), end)
                        : bucket.plusDays(1);
                BigDecimal cost = BigDecimal.ZERO;
                for (LocalDate day = bucket; day.isBefore(bucketEnd); day = day.plusDays(1)) {
                    for (String service : dailyBaseCosts.keySet()) {
                        cost = cost.add(dailyCost(service, day));
                    }
                }
                ObjectNode point = trends.addObject();
                point.put("date", bucket.toString());
                point.put("cost", cost);
            }

            return new RawCostData(provider, start, end, payload);
        }

        private BigDecimal dailyCost(String service, LocalDate day) {
            // Fixed seed per provider, service and day for consistent results
            Random random = new Random(42L + provider.ordinal() * 31L + service.hashCode() * 17L + day.toEpochDay());
            double base = dailyBaseCosts.get(service);
            double jitter = base * 0.2 * (random.nextDouble() * 2 - 1);
            return BigDecimal.valueOf(base + jitter).setScale(2, RoundingMode.HALF_UP);
        }

        private static List<LocalDate> buckets(LocalDate start, LocalDate end, Granularity granularity) {
            if (granularity == Granularity.DAILY) {
                return start.datesUntil(end).toList();
            }
            long months = ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(end.minusDays(1)));
            return LongStream.rangeClosed(0, months)
                    .mapToObj(i -> i == 0 ? start : YearMonth.from(start).plusMonths(i).atDay(1))
                    .toList();
        }

        private static LocalDate min(LocalDate a, LocalDate b) {
            return a.isBefore(b) ? a : b;
        }
    }
}
