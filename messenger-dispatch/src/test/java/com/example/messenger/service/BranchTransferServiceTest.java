package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.messenger.domain.AgentStatus;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Inbox;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.service.exception.ServiceException;
import com.example.messenger.support.MessengerFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class BranchTransferServiceTest {

    private MessengerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        fixture.inboxes.put(Inbox.builder().id(5L).name("Global").widgetToken("wt_global").active(true).build());
        fixture.directory.globalInbox(5L)
                .agent(7L, 20L, AgentStatus.ONLINE)
                .agent(8L, 20L, AgentStatus.AWAY);
        fixture.conversations.put(Conversation.builder()
                .id(30L)
                .inboxId(5L)
                .contactId("contact-30")
                .branchId(10L)
                .status(ConversationStatus.OPEN)
                .assigneeId(2L)
                .assignedAt(fixture.clock.instant())
                .assigneeOpenedAt(fixture.clock.instant())
                .createdAt(fixture.clock.instant())
                .build());
    }

    @Test
    void transferReassignsWithinTheNewBranch() {
        fixture.clock.advance(Duration.ofMinutes(3));

        Conversation moved = fixture.transfers.transfer(30L, 20L, 2L);

        assertThat(moved.getBranchId()).isEqualTo(20L);
        assertThat(moved.getAssigneeId()).isEqualTo(7L);
        assertThat(moved.getAssigneeOpenedAt()).isNull();
        assertThat(moved.getAssignedAt()).isEqualTo(fixture.clock.instant());
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_TRANSFERRED))
                .singleElement()
                .satisfies(event -> assertThat(event.getPayload())
                        .containsEntry("from_branch_id", 10L)
                        .containsEntry("to_branch_id", 20L)
                        .containsEntry("previous_assignee_id", 2L)
                        .containsEntry("transferred_by", 2L));
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED))
                .singleElement()
                .satisfies(event -> assertThat(event.getPayload())
                        .containsEntry("previous_assignee_id", null)
                        .containsEntry("assignee_id", 7L));
    }

    @Test
    void transferWithoutOnlineAgentLeavesConversationWaiting() {
        fixture.presence.setStatus(7L, AgentStatus.OFFLINE);

        Conversation moved = fixture.transfers.transfer(30L, 20L, 2L);

        assertThat(moved.getBranchId()).isEqualTo(20L);
        assertThat(moved.isUnassigned()).isTrue();
        assertThat(moved.getWaitingSince()).isEqualTo(fixture.clock.instant());
    }

    @Test
    void transferToCurrentBranchChangesNothing() {
        Conversation unchanged = fixture.transfers.transfer(30L, 10L, 2L);

        assertThat(unchanged.getAssigneeId()).isEqualTo(2L);
        assertThat(fixture.events.ofType(ChatEventType.CONVERSATION_TRANSFERRED)).isEmpty();
    }

    @Test
    void branchInboxConversationsCannotBeTransferred() {
        fixture.assignedConversation(20L, 1L, fixture.clock.instant());

        assertError(() -> fixture.transfers.transfer(20L, 20L, 1L), HttpStatus.CONFLICT, "inbox_has_branch");
        assertThat(fixture.conversation(20L).getBranchId()).isEqualTo(10L);
    }

    @Test
    void finishedOrMissingConversationIsRejected() {
        fixture.conversations.updateStatus(30L, ConversationStatus.RESOLVED, fixture.clock.instant());

        assertError(() -> fixture.transfers.transfer(30L, 20L, 2L), HttpStatus.CONFLICT, "conversation_not_active");
        assertError(() -> fixture.transfers.transfer(404L, 20L, 2L), HttpStatus.NOT_FOUND, "conversation_not_found");
        assertThat(fixture.conversation(30L).getBranchId()).isEqualTo(10L);
    }

    private static void assertError(Runnable call, HttpStatus status, String code) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ServiceException.class)
                .satisfies(ex -> {
                    ServiceException serviceException = (ServiceException) ex;
                    assertThat(serviceException.getStatus()).isEqualTo(status);
                    assertThat(serviceException.getErrorCode()).isEqualTo(code);
                });
    }
}
