package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.service.exception.ServiceException;
import com.example.messenger.support.MessengerFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentConversationServiceTest {

    private MessengerFixture fixture;
    private AgentConversationService service;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        service = fixture.agentConversations;
        fixture.assignedConversation(20L, 1L, fixture.clock.instant());
    }

    @Test
    void onlyAssigneeCanOpen() {
        assertThatThrownBy(() -> service.open(20L, 2L))
                .isInstanceOf(ServiceException.class)
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("not_assignee");

        fixture.clock.advance(Duration.ofSeconds(30));
        assertThat(service.open(20L, 1L).getAssigneeOpenedAt()).isEqualTo(fixture.clock.instant());
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_OPENED)).hasSize(1);

        service.open(20L, 1L);
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_OPENED)).hasSize(1);
    }

    @Test
    void firstOutboundReplyIsAnnouncedOnce() {
        Message first = service.reply(20L, 1L, "Hi there", MessageDirection.OUT);
        service.reply(20L, 1L, "Anything else?", MessageDirection.OUT);

        assertThat(first.getSenderAgentId()).isEqualTo(1L);
        assertThat(fixture.events.ofType(ChatEventType.FIRST_REPLY_CREATED)).hasSize(1);
        assertThat(fixture.events.ofType(ChatEventType.MESSAGE_CREATED)).hasSize(2);
        assertThat(fixture.conversation(20L).getFirstReplyAt()).isNotNull();
    }

    @Test
    void assigneeReplyCountsAsOpening() {
        service.reply(20L, 1L, "On it", MessageDirection.OUT);

        assertThat(fixture.conversation(20L).getAssigneeOpenedAt()).isNotNull();
    }

    @Test
    void internalNoteIsNotAFirstReply() {
        service.reply(20L, 2L, "customer is a VIP", MessageDirection.INTERNAL);

        assertThat(fixture.conversation(20L).getFirstReplyAt()).isNull();
        assertThat(fixture.conversation(20L).getAssigneeOpenedAt()).isNull();
        assertThat(fixture.events.ofType(ChatEventType.FIRST_REPLY_CREATED)).isEmpty();
    }

    @Test
    void rejectsInvalidReplies() {
        assertThatThrownBy(() -> service.reply(20L, 1L, "x", MessageDirection.IN))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("invalid_direction");
        assertThatThrownBy(() -> service.reply(20L, 1L, "  ", MessageDirection.OUT))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("empty_body");
        assertThatThrownBy(() -> service.reply(20L, 1L, "x".repeat(Message.MAX_BODY_LENGTH + 1), MessageDirection.OUT))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("body_too_long");
        assertThatThrownBy(() -> service.reply(404L, 1L, "x", MessageDirection.OUT))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("conversation_not_found");
    }

    @Test
    void closedConversationAcceptsNoReplies() {
        assertThat(service.close(20L)).isTrue();

        assertThatThrownBy(() -> service.reply(20L, 1L, "hello?", MessageDirection.OUT))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("conversation_closed");
    }

    @Test
    void statusTransitionsAreAnnouncedOnlyWhenTheyChangeSomething() {
        assertThat(service.resolve(20L)).isTrue();
        assertThat(service.resolve(20L)).isFalse();

        assertThat(fixture.conversation(20L).getStatus()).isEqualTo(ConversationStatus.RESOLVED);
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_RESOLVED)).hasSize(1);
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_STATUS_CHANGED))
                .singleElement()
                .satisfies(event -> assertThat(event.getPayload()).containsEntry("status", "resolved"));
    }

    @Test
    void manualAssignmentOnlyTakesUnassignedConversations() {
        fixture.unassignedConversation(21L);

        assertThat(service.assign(21L, 3L).getAssigneeId()).isEqualTo(3L);
        assertThat(service.assign(21L, 3L).getAssigneeId()).isEqualTo(3L);
        assertThatThrownBy(() -> service.assign(21L, 2L))
                .extracting(ex -> ((ServiceException) ex).getErrorCode())
                .isEqualTo("already_assigned");
        assertThat(fixture.store.getCounter(fixture.keyFactory.assignmentRateKey(3L))).isZero();
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).hasSize(1);
    }
}
