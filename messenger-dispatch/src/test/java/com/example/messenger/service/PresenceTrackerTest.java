package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.messenger.domain.AgentStatus;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.service.exception.ServiceException;
import com.example.messenger.support.MessengerFixture;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class PresenceTrackerTest {

    private MessengerFixture fixture;
    private PresenceTracker presence;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture();
        fixture.directory.inbox(1L, 10L)
                .agent(1L, 10L, AgentStatus.ONLINE)
                .agent(2L, 10L, AgentStatus.AWAY)
                .agent(3L, 20L, AgentStatus.ONLINE);
        presence = fixture.presence;
    }

    @Test
    void readsThroughToProfileAndCachesTheStatus() {
        assertThat(presence.getStatus(2L)).contains(AgentStatus.AWAY);

        assertThat(fixture.store.get(fixture.keyFactory.agentStatusKey(2L))).contains("away");
    }

    @Test
    void setStatusUpdatesProfileCacheAndAnnouncesChange() {
        presence.setStatus(2L, AgentStatus.ONLINE);

        assertThat(presence.isOnline(2L)).isTrue();
        assertThat(fixture.directory.findProfile(2L).orElseThrow().getStatus()).isEqualTo(AgentStatus.ONLINE);
        List<ChatEvent> changes = fixture.events.ofType(ChatEventType.AGENT_STATUS_CHANGED);
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getPayload()).containsEntry("agent_id", 2L).containsEntry("status", "online");
    }

    @Test
    void unknownAgentCannotChangeStatus() {
        assertThatThrownBy(() -> presence.setStatus(99L, AgentStatus.ONLINE))
                .isInstanceOf(ServiceException.class)
                .satisfies(ex -> assertThat(((ServiceException) ex).getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void expiredCacheFallsBackToProfile() {
        presence.getStatus(1L);
        fixture.directory.updateStatus(1L, AgentStatus.BUSY);
        assertThat(presence.getStatus(1L)).contains(AgentStatus.ONLINE);

        fixture.clock.advance(fixture.properties.getRedis().getPresenceTtl().plus(Duration.ofSeconds(1)));

        assertThat(presence.getStatus(1L)).contains(AgentStatus.BUSY);
    }

    @Test
    void storeOutageReadsProfileDirectly() {
        fixture.store.setUnavailable(true);

        assertThat(presence.isOnline(1L)).isTrue();
        assertThat(presence.isOnline(2L)).isFalse();
    }

    @Test
    void onlineAgentsCanBeFilteredByBranch() {
        assertThat(presence.onlineAgentIds(10L)).containsExactly(1L);
        assertThat(presence.onlineAgentIds(null)).containsExactly(1L, 3L);
        assertThat(presence.availableAgents(10L))
                .containsEntry(1L, AgentStatus.ONLINE)
                .containsEntry(2L, AgentStatus.AWAY);
    }

    @Test
    void branchHasOnlineAgentsOnlyWhileSomeoneIsOnline() {
        assertThat(presence.hasOnlineAgents(10L)).isTrue();
        assertThat(presence.hasOnlineAgents(30L)).isFalse();

        presence.setStatus(1L, AgentStatus.AWAY);

        assertThat(presence.hasOnlineAgents(10L)).isFalse();
        assertThat(presence.hasOnlineAgents(null)).isTrue();
    }
}
