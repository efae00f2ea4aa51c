package com.example.messenger.persistence;

import com.example.messenger.domain.AgentProfile;
import com.example.messenger.domain.AgentStatus;
import com.example.messenger.service.AgentDirectory;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaAgentDirectory implements AgentDirectory {

    private final AgentProfileJpaRepository agentProfileJpaRepository;
    private final InboxJpaRepository inboxJpaRepository;
    private final MessengerEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<AgentProfile> findProfile(long agentId) {
        return agentProfileJpaRepository.findById(agentId).map(mapper::toAgentProfile);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<Long> eligibleAgentIds(long inboxId) {
        Optional<InboxEntity> inbox = inboxJpaRepository.findById(inboxId);
        if (inbox.isEmpty()) {
            return Collections.emptySet();
        }
        Long branchId = inbox.get().getBranchId();
        List<AgentProfileEntity> profiles = branchId == null
                ? agentProfileJpaRepository.findByActiveTrue()
                : agentProfileJpaRepository.findByActiveTrueAndBranchId(branchId);
        return profiles.stream()
                .map(AgentProfileEntity::getAgentId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgentProfile> findActiveProfiles(Long branchId) {
        List<AgentProfileEntity> entities = branchId == null
                ? agentProfileJpaRepository.findByActiveTrue()
                : agentProfileJpaRepository.findByActiveTrueAndBranchId(branchId);
        return entities.stream().map(mapper::toAgentProfile).toList();
    }

    @Override
    @Transactional
    public void updateStatus(long agentId, AgentStatus status) {
        agentProfileJpaRepository.updateStatus(agentId, status, clock.instant());
    }
}
