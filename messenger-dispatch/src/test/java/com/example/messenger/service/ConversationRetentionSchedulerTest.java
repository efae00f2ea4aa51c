package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.support.MessengerFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConversationRetentionSchedulerTest {

    private MessengerFixture fixture;
    private ConversationRetentionScheduler scheduler;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        scheduler = new ConversationRetentionScheduler(
                fixture.properties, fixture.conversations, fixture.agentConversations, fixture.clock);
    }

    @Test
    void closesOnlyResolvedConversationsPastTheCutoff() {
        fixture.assignedConversation(1L, 1L, fixture.clock.instant());
        fixture.assignedConversation(2L, 2L, fixture.clock.instant());
        fixture.agentConversations.resolve(1L);
        fixture.clock.advance(Duration.ofDays(10));
        fixture.assignedConversation(3L, 3L, fixture.clock.instant());
        fixture.agentConversations.resolve(3L);

        fixture.clock.advance(Duration.ofDays(5));
        int closed = scheduler.closeResolvedOlderThan(Duration.ofDays(7), 100);

        assertThat(closed).isEqualTo(1);
        assertThat(fixture.conversation(1L).getStatus()).isEqualTo(ConversationStatus.CLOSED);
        assertThat(fixture.conversation(2L).getStatus()).isEqualTo(ConversationStatus.OPEN);
        assertThat(fixture.conversation(3L).getStatus()).isEqualTo(ConversationStatus.RESOLVED);
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_CLOSED)).hasSize(1);
    }

    @Test
    void respectsBatchSize() {
        for (long id = 1; id <= 3; id++) {
            fixture.assignedConversation(id, 1L, fixture.clock.instant());
            fixture.agentConversations.resolve(id);
        }
        fixture.clock.advance(Duration.ofDays(100));

        assertThat(scheduler.closeResolvedOlderThan(Duration.ofDays(90), 2)).isEqualTo(2);
        assertThat(scheduler.closeResolvedOlderThan(Duration.ofDays(90), 2)).isEqualTo(1);
        assertThat(scheduler.closeResolvedOlderThan(Duration.ofDays(90), 2)).isZero();
    }

    @Test
    void ignoresNonPositiveArguments() {
        fixture.assignedConversation(1L, 1L, fixture.clock.instant());
        fixture.agentConversations.resolve(1L);
        fixture.clock.advance(Duration.ofDays(100));

        assertThat(scheduler.closeResolvedOlderThan(Duration.ZERO, 10)).isZero();
        assertThat(scheduler.closeResolvedOlderThan(Duration.ofDays(1), 0)).isZero();
        assertThat(fixture.conversation(1L).getStatus()).isEqualTo(ConversationStatus.RESOLVED);
    }

    @Test
    void scheduledRunHonoursDisabledFlag() {
        fixture.assignedConversation(1L, 1L, fixture.clock.instant());
        fixture.agentConversations.resolve(1L);
        fixture.clock.advance(Duration.ofDays(100));

        fixture.properties.getRetention().setEnabled(false);
        scheduler.closeOldConversations();
        assertThat(fixture.conversation(1L).getStatus()).isEqualTo(ConversationStatus.RESOLVED);

        fixture.properties.getRetention().setEnabled(true);
        scheduler.closeOldConversations();
        assertThat(fixture.conversation(1L).getStatus()).isEqualTo(ConversationStatus.CLOSED);
    }
}
