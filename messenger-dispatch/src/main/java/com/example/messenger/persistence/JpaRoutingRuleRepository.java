package com.example.messenger.persistence;

import com.example.messenger.domain.RoutingRule;
import com.example.messenger.service.RoutingRuleRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaRoutingRuleRepository implements RoutingRuleRepository {

    private final RoutingRuleJpaRepository routingRuleJpaRepository;
    private final MessengerEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<RoutingRule> findActiveByInbox(long inboxId) {
        return routingRuleJpaRepository.findByInboxIdAndActiveTrueOrderByPriorityAscIdAsc(inboxId).stream()
                .map(mapper::toRoutingRule)
                .toList();
    }
}
