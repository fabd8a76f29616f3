package com.cloudcostbuddy.domain.repository;

import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertHistoryRepository extends JpaRepository<AlertHistoryEntry, Long> {

    /**
     * Most recent triggers for a user, newest first.
     */
    List<AlertHistoryEntry> findByOwnerIdOrderByTriggeredAtDesc(String ownerId, Pageable pageable);

    long countByRuleId(Long ruleId);
}
