package com.example.messenger.service;

import com.example.messenger.domain.AgentProfile;
import com.example.messenger.domain.AgentStatus;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface AgentDirectory {

    Optional<AgentProfile> findProfile(long agentId);

    /**
     * Active agents of the branch the inbox belongs to. A branch-less inbox routes to any branch, so
     * every active agent is eligible there. Empty for unknown inboxes.
     */
    Set<Long> eligibleAgentIds(long inboxId);

    List<AgentProfile> findActiveProfiles(Long branchId);

    void updateStatus(long agentId, AgentStatus status);
}
