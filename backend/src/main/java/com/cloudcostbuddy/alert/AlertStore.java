package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;

import java.time.Instant;
import java.util.List;

/**
 * Read/write contract the evaluator needs from rule and history storage.
 *
 * Implementations signal storage outages with {@link AlertPersistenceException}.
 */
public interface AlertStore {

    /**
     * All enabled rules. Failure here aborts the evaluation pass.
     */
    List<AlertRule> listEnabledRules();

    /**
     * Conditionally advance a rule's last trigger time.
     *
     * @param ruleId           rule to update
     * @param expectedPrevious value read at evaluation time, null if never triggered
     * @param triggeredAt      new value
     * @return true if the stored value still matched {@code expectedPrevious} and was replaced
     */
    boolean updateLastTriggered(Long ruleId, Instant expectedPrevious, Instant triggeredAt);

    /**
     * Append an immutable history entry.
     *
     * @return the stored entry, with its identifier
     */
    AlertHistoryEntry appendHistory(AlertHistoryEntry entry);

    /**
     * Most recent history entries of a user, newest first.
     */
    List<AlertHistoryEntry> findHistory(String ownerId, int limit);
}
