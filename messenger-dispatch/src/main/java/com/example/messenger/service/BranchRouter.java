package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.Inbox;
import com.example.messenger.domain.RoutingRule;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides which branch handles a new conversation. Branch inboxes keep their own branch; branch-less
 * inboxes go through their routing rules, then the configured default branch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BranchRouter {

    private static final Comparator<RoutingRule> RULE_ORDER =
            Comparator.comparingInt(RoutingRule::getPriority).thenComparingLong(RoutingRule::getId);

    private final RoutingRuleRepository routingRuleRepository;
    private final MessengerProperties messengerProperties;

    public Optional<Long> resolveBranch(Inbox inbox, Long regionId) {
        if (!inbox.isGlobal()) {
            return Optional.of(inbox.getBranchId());
        }
        Optional<RoutingRule> rule = selectRule(inbox.getId(), regionId);
        if (rule.isPresent()) {
            log.debug("Routing rule {} sends region {} of inbox {} to branch {}",
                    rule.get().getId(), regionId, inbox.getId(), rule.get().getBranchId());
            return Optional.of(rule.get().getBranchId());
        }
        return Optional.ofNullable(messengerProperties.getRouting().getDefaultBranchId());
    }

    public Optional<RoutingRule> selectRule(long inboxId, Long regionId) {
        List<RoutingRule> rules = routingRuleRepository.findActiveByInbox(inboxId);
        if (regionId != null) {
            Optional<RoutingRule> matching = rules.stream()
                    .filter(rule -> rule.covers(regionId))
                    .min(RULE_ORDER);
            if (matching.isPresent()) {
                return matching;
            }
        }
        return rules.stream().filter(RoutingRule::isFallback).min(RULE_ORDER);
    }
}
