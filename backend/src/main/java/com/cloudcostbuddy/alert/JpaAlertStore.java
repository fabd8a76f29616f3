package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.AlertRule;
import com.cloudcostbuddy.domain.repository.AlertHistoryRepository;
import com.cloudcostbuddy.domain.repository.AlertRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * {@link AlertStore} backed by the Spring Data repositories.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAlertStore implements AlertStore {

    private final AlertRuleRepository ruleRepository;
    private final AlertHistoryRepository historyRepository;

    @Override
    @Transactional(readOnly = true)
    public List<AlertRule> listEnabledRules() {
        try {
            return ruleRepository.findByEnabledTrueOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new AlertPersistenceException("Failed to load enabled alert rules", e);
        }
    }

    @Override
    @Transactional
    public boolean updateLastTriggered(Long ruleId, Instant expectedPrevious, Instant triggeredAt) {
        try {
            int updated = expectedPrevious == null
                    ? ruleRepository.setFirstTriggered(ruleId, triggeredAt)
                    : ruleRepository.advanceLastTriggered(ruleId, expectedPrevious, triggeredAt);
            log.debug("Conditional lastTriggeredAt update for rule {} affected {} row(s)", ruleId, updated);
            return updated == 1;
        } catch (DataAccessException e) {
            throw new AlertPersistenceException("Failed to update lastTriggeredAt of rule " + ruleId, e);
        }
    }

    @Override
    @Transactional
    public AlertHistoryEntry appendHistory(AlertHistoryEntry entry) {
        try {
            return historyRepository.save(entry);
        } catch (DataAccessException e) {
            throw new AlertPersistenceException("Failed to append history for rule " + entry.getRuleId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertHistoryEntry> findHistory(String ownerId, int limit) {
        try {
            return historyRepository.findByOwnerIdOrderByTriggeredAtDesc(ownerId, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new AlertPersistenceException("Failed to read alert history of " + ownerId, e);
        }
    }
}
