package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.AgentProfile;
import com.example.messenger.domain.AgentStatus;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.service.exception.ServiceException;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import com.example.messenger.store.SharedStoreException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceTracker {

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final AgentDirectory agentDirectory;
    private final EventBus eventBus;
    private final MessengerProperties messengerProperties;
    private final Clock clock;

    public Optional<AgentStatus> getStatus(long agentId) {
        String key = keyFactory.agentStatusKey(agentId);
        try {
            Optional<String> cached = sharedStore.get(key);
            if (cached.isPresent()) {
                return Optional.of(AgentStatus.fromWire(cached.get()));
            }
        } catch (SharedStoreException ex) {
            log.warn("Presence cache unavailable for {}, reading the profile record", key, ex);
            return agentDirectory.findProfile(agentId).map(AgentProfile::getStatus);
        }

        Optional<AgentStatus> status = agentDirectory.findProfile(agentId).map(AgentProfile::getStatus);
        status.ifPresent(value -> cache(agentId, value));
        return status;
    }

    public void setStatus(long agentId, AgentStatus status) {
        if (agentDirectory.findProfile(agentId).isEmpty()) {
            throw new ServiceException(HttpStatus.NOT_FOUND, "Agent not found", "agent_not_found");
        }
        agentDirectory.updateStatus(agentId, status);
        cache(agentId, status);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", agentId);
        payload.put("status", status.wireValue());
        eventBus.dispatch(ChatEventType.AGENT_STATUS_CHANGED, clock.instant(), payload, true);
        log.info("Agent {} is now {}", agentId, status.wireValue());
    }

    public boolean isOnline(long agentId) {
        return getStatus(agentId).filter(status -> status == AgentStatus.ONLINE).isPresent();
    }

    public Set<Long> onlineAgentIds(Long branchId) {
        return availableAgents(branchId).entrySet().stream()
                .filter(entry -> entry.getValue() == AgentStatus.ONLINE)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean hasOnlineAgents(Long branchId) {
        return !onlineAgentIds(branchId).isEmpty();
    }

    public Map<Long, AgentStatus> availableAgents(Long branchId) {
        Map<Long, AgentStatus> result = new LinkedHashMap<>();
        for (AgentProfile profile : agentDirectory.findActiveProfiles(branchId)) {
            result.put(profile.getAgentId(), getStatus(profile.getAgentId()).orElse(AgentStatus.OFFLINE));
        }
        return result;
    }

    private void cache(long agentId, AgentStatus status) {
        if (status == null) {
            return;
        }
        String key = keyFactory.agentStatusKey(agentId);
        try {
            sharedStore.set(key, status.wireValue(), messengerProperties.getRedis().getPresenceTtl());
        } catch (SharedStoreException ex) {
            log.warn("Could not cache presence under {}", key, ex);
        }
    }
}
