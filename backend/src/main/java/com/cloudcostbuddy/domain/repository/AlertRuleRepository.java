package com.cloudcostbuddy.domain.repository;

import com.cloudcostbuddy.domain.model.AlertRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, Long> {

    /**
     * All rules the evaluator should consider on a pass.
     */
    List<AlertRule> findByEnabledTrueOrderByIdAsc();

    /**
     * Advance lastTriggeredAt only if it still holds the value read at
     * evaluation time. Returns the number of rows updated (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertRule r SET r.lastTriggeredAt = :triggeredAt " +
           "WHERE r.id = :ruleId AND r.lastTriggeredAt = :expected")
    int advanceLastTriggered(@Param("ruleId") Long ruleId,
                             @Param("expected") Instant expected,
                             @Param("triggeredAt") Instant triggeredAt);

    /**
     * First trigger of a rule: only succeeds while lastTriggeredAt is still null.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AlertRule r SET r.lastTriggeredAt = :triggeredAt " +
           "WHERE r.id = :ruleId AND r.lastTriggeredAt IS NULL")
    int setFirstTriggered(@Param("ruleId") Long ruleId,
                          @Param("triggeredAt") Instant triggeredAt);
}
