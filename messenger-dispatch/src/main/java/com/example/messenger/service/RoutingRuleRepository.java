package com.example.messenger.service;

import com.example.messenger.domain.RoutingRule;
import java.util.List;

public interface RoutingRuleRepository {

    List<RoutingRule> findActiveByInbox(long inboxId);
}
