package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;
import com.cloudcostbuddy.domain.model.AlertType;
import com.cloudcostbuddy.domain.model.ProviderScope;
import com.cloudcostbuddy.domain.repository.AlertHistoryRepository;
import com.cloudcostbuddy.domain.repository.AlertRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the store against H2 to check the conditional update SQL.
 */
@DataJpaTest
@Import(JpaAlertStore.class)
class JpaAlertStoreTest {

    private static final Instant T1 = Instant.parse("2024-05-15T08:00:00.250Z");
    private static final Instant T2 = Instant.parse("2024-05-15T16:00:00.500Z");

    @Autowired
    private JpaAlertStore store;

    @Autowired
    private AlertRuleRepository ruleRepository;

    @Autowired
    private AlertHistoryRepository historyRepository;

    private AlertRule rule;

    @BeforeEach
    void setUp() {
        rule = ruleRepository.saveAndFlush(AlertRule.builder()
                .ownerId("user-1")
                .type(AlertType.BUDGET_THRESHOLD)
                .providerScope(ProviderScope.AWS)
                .thresholdValue(new BigDecimal("100.00"))
                .enabled(true)
                .build());
    }

    @Nested
    @DisplayName("Conditional lastTriggeredAt update")
    class ConditionalUpdateTests {

        @Test
        @DisplayName("First trigger should only succeed once")
        void shouldSetFirstTriggerOnce() {
            assertThat(store.updateLastTriggered(rule.getId(), null, T1)).isTrue();
            assertThat(store.updateLastTriggered(rule.getId(), null, T2)).isFalse();

            assertThat(ruleRepository.findById(rule.getId()))
                    .hasValueSatisfying(r -> assertThat(r.getLastTriggeredAt()).isEqualTo(T1));
        }

        @Test
        @DisplayName("Should advance only from the expected previous value")
        void shouldAdvanceFromExpectedValue() {
            store.updateLastTriggered(rule.getId(), null, T1);

            assertThat(store.updateLastTriggered(rule.getId(), T2, T2)).isFalse();
            assertThat(store.updateLastTriggered(rule.getId(), T1, T2)).isTrue();
            assertThat(store.updateLastTriggered(rule.getId(), T1, T2)).isFalse();
        }

        @Test
        @DisplayName("Unknown rules should not be updated")
        void shouldIgnoreUnknownRule() {
            assertThat(store.updateLastTriggered(-1L, null, T1)).isFalse();
        }
    }

    @Nested
    @DisplayName("Rules and history")
    class ReadWriteTests {

        @Test
        @DisplayName("Should list only enabled rules")
        void shouldListEnabledRules() {
            ruleRepository.saveAndFlush(AlertRule.builder()
                    .ownerId("user-2")
                    .type(AlertType.DAILY_SUMMARY)
                    .enabled(false)
                    .build());

            List<AlertRule> rules = store.listEnabledRules();

            assertThat(rules).extracting(AlertRule::getId).containsExactly(rule.getId());
        }

        @Test
        @DisplayName("Should default the scope of a rule to ALL")
        void shouldDefaultScope() {
            AlertRule saved = ruleRepository.saveAndFlush(AlertRule.builder()
                    .ownerId("user-2")
                    .type(AlertType.WEEKLY_SUMMARY)
                    .enabled(true)
                    .build());

            assertThat(saved.getProviderScope()).isEqualTo(ProviderScope.ALL);
            assertThat(saved.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should return a user's history newest first, limited")
        void shouldFindHistoryNewestFirst() {
            store.appendHistory(entry(T1, "first"));
            AlertHistoryEntry latest = store.appendHistory(entry(T2, "second"));
            store.appendHistory(entry(T1.minusSeconds(60), "oldest"));

            List<AlertHistoryEntry> history = store.findHistory("user-1", 2);

            assertThat(latest.getId()).isNotNull();
            assertThat(history).extracting(AlertHistoryEntry::getMessage).containsExactly("second", "first");
            assertThat(historyRepository.countByRuleId(rule.getId())).isEqualTo(3);
            assertThat(store.findHistory("someone-else", 10)).isEmpty();
        }
    }

    private AlertHistoryEntry entry(Instant triggeredAt, String message) {
        return AlertHistoryEntry.builder()
                .ruleId(rule.getId())
                .ownerId("user-1")
                .alertType(AlertType.BUDGET_THRESHOLD)
                .triggeredAt(triggeredAt)
                .currentValue(new BigDecimal("120.00"))
                .comparisonValue(new BigDecimal("100.00"))
                .provider(ProviderScope.AWS)
                .message(message)
                .build();
    }
}
