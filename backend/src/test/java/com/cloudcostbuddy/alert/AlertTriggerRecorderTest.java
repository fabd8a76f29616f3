package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;
import com.cloudcostbuddy.domain.model.AlertType;
import com.cloudcostbuddy.domain.model.ProviderScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertTriggerRecorderTest {

    private static final Instant PREVIOUS = Instant.parse("2024-05-14T08:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-15T08:00:00Z");

    @Mock
    private AlertStore alertStore;

    @InjectMocks
    private AlertTriggerRecorder recorder;

    private final AlertRule rule = AlertRule.builder()
            .id(9L)
            .ownerId("user-9")
            .type(AlertType.BUDGET_THRESHOLD)
            .providerScope(ProviderScope.ALL)
            .thresholdValue(BigDecimal.TEN)
            .enabled(true)
            .lastTriggeredAt(PREVIOUS)
            .build();

    @Test
    @DisplayName("Should advance lastTriggeredAt before appending every entry")
    void shouldRecordTrigger() {
        // Given
        AlertHistoryEntry aws = entry(ProviderScope.AWS);
        AlertHistoryEntry gcp = entry(ProviderScope.GCP);
        when(alertStore.updateLastTriggered(9L, PREVIOUS, NOW)).thenReturn(true);
        when(alertStore.appendHistory(any())).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        List<AlertHistoryEntry> stored = recorder.record(rule, PREVIOUS, NOW, List.of(aws, gcp));

        // Then
        assertThat(stored).containsExactly(aws, gcp);
        InOrder order = inOrder(alertStore);
        order.verify(alertStore).updateLastTriggered(9L, PREVIOUS, NOW);
        order.verify(alertStore).appendHistory(aws);
        order.verify(alertStore).appendHistory(gcp);
    }

    @Test
    @DisplayName("Should refuse to write history when another evaluator won the update")
    void shouldRejectConcurrentTrigger() {
        when(alertStore.updateLastTriggered(9L, PREVIOUS, NOW)).thenReturn(false);

        assertThatThrownBy(() -> recorder.record(rule, PREVIOUS, NOW, List.of(entry(ProviderScope.AWS))))
                .isInstanceOf(ConcurrentTriggerException.class)
                .hasMessageContaining("9");
        verify(alertStore, never()).appendHistory(any());
    }

    @Test
    @DisplayName("Should propagate storage failures")
    void shouldPropagatePersistenceFailure() {
        when(alertStore.updateLastTriggered(9L, PREVIOUS, NOW)).thenReturn(true);
        when(alertStore.appendHistory(any())).thenThrow(new AlertPersistenceException("disk full", null));

        assertThatThrownBy(() -> recorder.record(rule, PREVIOUS, NOW, List.of(entry(ProviderScope.AWS))))
                .isInstanceOf(AlertPersistenceException.class);
    }

    @Test
    @DisplayName("Should reject a trigger without entries")
    void shouldRejectEmptyTrigger() {
        assertThatThrownBy(() -> recorder.record(rule, PREVIOUS, NOW, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(alertStore);
    }

    private AlertHistoryEntry entry(ProviderScope provider) {
        return AlertHistoryEntry.builder()
                .ruleId(9L)
                .ownerId("user-9")
                .alertType(AlertType.BUDGET_THRESHOLD)
                .triggeredAt(NOW)
                .currentValue(new BigDecimal("12.00"))
                .comparisonValue(BigDecimal.TEN)
                .provider(provider)
                .message("Budget threshold exceeded for " + provider)
                .build();
    }
}
