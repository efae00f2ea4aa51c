package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messenger.domain.AgentStatus;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.support.MessengerFixture;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AutoAssignmentServiceTest {

    private MessengerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        fixture.autoAssignment.register();
    }

    @AfterEach
    void tearDown() {
        fixture.autoAssignment.unregister();
    }

    @Test
    void newConversationsAreSpreadAcrossAgents() {
        fixture.unassignedConversation(11L);
        fixture.unassignedConversation(12L);

        created(11L);
        created(12L);

        assertThat(fixture.conversation(11L).getAssigneeId()).isEqualTo(1L);
        assertThat(fixture.conversation(12L).getAssigneeId()).isEqualTo(2L);
        assertThat(fixture.store.getCounter(fixture.keyFactory.assignmentRateKey(1L))).isEqualTo(1L);
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED))
                .extracting(event -> event.getPayload().get("reason"))
                .containsOnly(ConversationAssigner.REASON_AUTO);
    }

    @Test
    void visitorMessageAssignsWaitingConversation() {
        fixture.presence.setStatus(1L, AgentStatus.OFFLINE);
        fixture.presence.setStatus(2L, AgentStatus.OFFLINE);
        fixture.presence.setStatus(3L, AgentStatus.OFFLINE);
        fixture.unassignedConversation(11L);
        created(11L);
        assertThat(fixture.conversation(11L).isUnassigned()).isTrue();

        fixture.presence.setStatus(3L, AgentStatus.ONLINE);
        message(11L, "in");

        assertThat(fixture.conversation(11L).getAssigneeId()).isEqualTo(3L);
    }

    @Test
    void agentMessagesDoNotTriggerAssignment() {
        fixture.unassignedConversation(11L);

        message(11L, "out");
        message(11L, "internal");

        assertThat(fixture.conversation(11L).isUnassigned()).isTrue();
    }

    @Test
    void assignedAndInactiveConversationsAreLeftAlone() {
        fixture.assignedConversation(11L, 3L, fixture.clock.instant());
        fixture.conversations.put(fixture.unassignedConversation(12L).toBuilder()
                .status(ConversationStatus.RESOLVED)
                .build());

        assertThat(fixture.autoAssignment.autoAssign(11L)).isEmpty();
        assertThat(fixture.autoAssignment.autoAssign(12L)).isEmpty();
        assertThat(fixture.autoAssignment.autoAssign(404L)).isEmpty();
        assertThat(fixture.conversation(11L).getAssigneeId()).isEqualTo(3L);
        assertThat(fixture.conversation(12L).isUnassigned()).isTrue();
    }

    @Test
    void agentKeepsItsTurnWhenTheAssignmentIsLost() {
        fixture.unassignedConversation(11L);
        fixture.unassignedConversation(12L);
        fixture.conversations.beforeNextAssigneeChange(
                () -> fixture.conversations.compareAndSetAssignee(11L, null, 3L, fixture.clock.instant()));

        assertThat(fixture.autoAssignment.autoAssign(11L)).isEmpty();
        assertThat(fixture.queue.snapshot(1L)).containsExactly(1L, 2L, 3L);

        assertThat(fixture.autoAssignment.autoAssign(12L)).contains(1L);
        assertThat(fixture.store.getCounter(fixture.keyFactory.assignmentRateKey(1L))).isEqualTo(1L);
    }

    @Test
    void finishedConversationIsNeverAssigned() {
        Conversation conversation = fixture.unassignedConversation(11L);
        fixture.conversations.updateStatus(11L, ConversationStatus.CLOSED, fixture.clock.instant());

        assertThat(fixture.assigner.assign(conversation, 2L, ConversationAssigner.REASON_AUTO, true)).isFalse();
        assertThat(fixture.conversation(11L).isUnassigned()).isTrue();
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).isEmpty();
    }

    @Test
    void branchLessInboxAssignsOnlyAgentsOfTheConversationBranch() {
        fixture.directory.globalInbox(5L).agent(7L, 20L, AgentStatus.ONLINE);
        fixture.conversations.put(Conversation.builder()
                .id(40L)
                .inboxId(5L)
                .contactId("contact-40")
                .branchId(20L)
                .status(ConversationStatus.OPEN)
                .createdAt(fixture.clock.instant())
                .build());

        assertThat(fixture.autoAssignment.autoAssign(40L)).contains(7L);
    }

    @Test
    void disabledAutoAssignmentIgnoresEvents() {
        fixture.properties.getAssignment().setAutoAssignEnabled(false);
        fixture.unassignedConversation(11L);

        created(11L);

        assertThat(fixture.conversation(11L).isUnassigned()).isTrue();
    }

    private void created(long conversationId) {
        fixture.eventBus.dispatch(
                ChatEventType.CONVERSATION_CREATED, fixture.clock.instant(), Map.of("conversation_id", conversationId), true);
    }

    private void message(long conversationId, String direction) {
        fixture.eventBus.dispatch(
                ChatEventType.MESSAGE_CREATED,
                fixture.clock.instant(),
                Map.of("conversation_id", conversationId, "direction", direction),
                true);
    }
}
