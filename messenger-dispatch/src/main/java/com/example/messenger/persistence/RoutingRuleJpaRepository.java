package com.example.messenger.persistence;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoutingRuleJpaRepository extends JpaRepository<RoutingRuleEntity, Long> {

    List<RoutingRuleEntity> findByInboxIdAndActiveTrueOrderByPriorityAscIdAsc(Long inboxId);
}
