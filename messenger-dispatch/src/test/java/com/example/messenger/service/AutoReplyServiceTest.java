package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Inbox;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.support.MessengerFixture;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AutoReplyServiceTest {

    private static final String GREETING = "Thanks for reaching out, an agent will be with you shortly.";

    private MessengerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        fixture.inboxes.put(Inbox.builder()
                .id(1L)
                .name("Support")
                .widgetToken("wt_support")
                .branchId(10L)
                .active(true)
                .autoReplyEnabled(true)
                .autoReplyBody("  " + GREETING + "  ")
                .build());
        fixture.autoReply.register();
    }

    @AfterEach
    void tearDown() {
        fixture.autoReply.unregister();
    }

    @Test
    void firstVisitorMessageGetsReplyFromAssignee() {
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());

        visitorMessage(11L);

        assertThat(fixture.messages.all())
                .singleElement()
                .satisfies(message -> {
                    assertThat(message.getDirection()).isEqualTo(MessageDirection.OUT);
                    assertThat(message.getBody()).isEqualTo(GREETING);
                    assertThat(message.getSenderAgentId()).isEqualTo(2L);
                });
        assertThat(fixture.conversation(11L).getAssigneeOpenedAt()).isNull();
        assertThat(fixture.conversation(11L).getFirstReplyAt()).isNull();
        assertThat(fixture.events.ofType(ChatEventType.MESSAGE_CREATED))
                .extracting(event -> event.stringValue("direction"))
                .containsExactly("in", "out");
    }

    @Test
    void laterVisitorMessagesAreNotAnswered() {
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());

        visitorMessage(11L);
        visitorMessage(11L);

        assertThat(fixture.messages.all()).hasSize(1);
    }

    @Test
    void conversationWithAgentReplyIsLeftAlone() {
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());
        fixture.messages.save(Message.builder()
                .conversationId(11L)
                .direction(MessageDirection.OUT)
                .body("Hello!")
                .senderAgentId(2L)
                .createdAt(fixture.clock.instant())
                .build());

        assertThat(fixture.autoReply.replyIfFirst(11L)).isEmpty();
        assertThat(fixture.messages.all()).hasSize(1);
    }

    @Test
    void unassignedOrPendingConversationGetsNoReply() {
        fixture.unassignedConversation(11L);
        fixture.conversations.put(fixture.assignedConversation(12L, 2L, fixture.clock.instant()).toBuilder()
                .status(ConversationStatus.PENDING)
                .build());

        assertThat(fixture.autoReply.replyIfFirst(11L)).isEmpty();
        assertThat(fixture.autoReply.replyIfFirst(12L)).isEmpty();
        assertThat(fixture.autoReply.replyIfFirst(404L)).isEmpty();
    }

    @Test
    void disabledInboxSendsNothing() {
        fixture.inboxes.findById(1L).orElseThrow().setAutoReplyEnabled(false);
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());

        assertThat(fixture.autoReply.replyIfFirst(11L)).isEmpty();
    }

    @Test
    void replyIsClaimedOnceAcrossNodes() {
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());
        fixture.store.set(fixture.keyFactory.autoReplyKey(11L), "1", fixture.properties.getWidget().getSessionTtl());

        assertThat(fixture.autoReply.replyIfFirst(11L)).isEmpty();
        assertThat(fixture.messages.all()).isEmpty();
    }

    @Test
    void storeOutageSkipsTheReply() {
        fixture.assignedConversation(11L, 2L, fixture.clock.instant());
        fixture.store.setUnavailable(true);

        assertThat(fixture.autoReply.replyIfFirst(11L)).isEmpty();
        assertThat(fixture.messages.all()).isEmpty();
    }

    private void visitorMessage(long conversationId) {
        fixture.eventBus.dispatch(ChatEventType.MESSAGE_CREATED, fixture.clock.instant(),
                Map.of("conversation_id", conversationId, "direction", "in"), true);
    }
}
