package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the durable part of a trigger as one unit: the conditional
 * lastTriggeredAt update and every history entry of the rule's pass.
 *
 * If the rule was triggered by someone else since it was read, or any write
 * fails, the transaction rolls back and nothing of this trigger is durable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertTriggerRecorder {

    private final AlertStore alertStore;

    /**
     * @param rule             rule as read at evaluation time
     * @param expectedPrevious lastTriggeredAt read at evaluation time
     * @param triggeredAt      trigger timestamp, also the new lastTriggeredAt
     * @param entries          history entries to append, at least one
     * @return stored entries
     * @throws ConcurrentTriggerException if the rule's lastTriggeredAt changed meanwhile
     * @throws AlertPersistenceException  if a write failed
     */
    @Transactional
    public List<AlertHistoryEntry> record(AlertRule rule, Instant expectedPrevious, Instant triggeredAt,
                                          List<AlertHistoryEntry> entries) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("A trigger needs at least one history entry");
        }

        if (!alertStore.updateLastTriggered(rule.getId(), expectedPrevious, triggeredAt)) {
            throw new ConcurrentTriggerException(rule.getId());
        }

        List<AlertHistoryEntry> stored = new ArrayList<>(entries.size());
        for (AlertHistoryEntry entry : entries) {
            stored.add(alertStore.appendHistory(entry));
        }

        log.debug("Recorded {} history entries for rule {}", stored.size(), rule.getId());
        return stored;
    }
}
