package com.example.messenger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.messenger.domain.AgentStatus;
import com.example.messenger.domain.Conversation;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.service.EscalationReport.Outcome;
import com.example.messenger.support.MessengerFixture;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EscalationScannerTest {

    private static final EscalationRequest DEFAULT_RUN = EscalationRequest.builder().build();

    private MessengerFixture fixture;
    private Instant t0;

    @BeforeEach
    void setUp() {
        fixture = new MessengerFixture();
        fixture.directory.inbox(1L, 10L)
                .agent(7L, 10L, AgentStatus.ONLINE)
                .agent(8L, 10L, AgentStatus.ONLINE)
                .agent(9L, 10L, AgentStatus.ONLINE);
        t0 = fixture.clock.instant();
        fixture.assignedConversation(500L, 7L, t0);
    }

    @Test
    void leavesConversationAloneBeforeTimeout() {
        fixture.clock.set(t0.plusSeconds(100));

        EscalationReport report = fixture.escalation.scan(DEFAULT_RUN);

        assertThat(report.getEntries()).isEmpty();
        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(7L);
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).isEmpty();
    }

    @Test
    void reassignsUnopenedConversationAfterTimeout() {
        fixture.clock.set(t0.plusSeconds(241));

        EscalationReport report = fixture.escalation.scan(DEFAULT_RUN);

        assertThat(report.getTimeoutSeconds()).isEqualTo(240L);
        assertThat(report.getEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.getConversationId()).isEqualTo(500L);
            assertThat(entry.getPreviousAssigneeId()).isEqualTo(7L);
            assertThat(entry.getNewAssigneeId()).isEqualTo(8L);
            assertThat(entry.getOutcome()).isEqualTo(Outcome.REASSIGNED);
        });
        Conversation conversation = fixture.conversation(500L);
        assertThat(conversation.getAssigneeId()).isEqualTo(8L);
        assertThat(conversation.getAssignedAt()).isEqualTo(t0.plusSeconds(241));
        assertThat(fixture.store.getCounter(fixture.keyFactory.assignmentRateKey(8L))).isEqualTo(1L);

        List<ChatEvent> changes = fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED);
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getPayload())
                .containsEntry("previous_assignee_id", 7L)
                .containsEntry("assignee_id", 8L)
                .containsEntry("reason", ConversationAssigner.REASON_ESCALATION);
    }

    @Test
    void repeatedScanDoesNotReassignAgain() {
        fixture.clock.set(t0.plusSeconds(241));
        fixture.escalation.scan(DEFAULT_RUN);

        fixture.clock.advance(Duration.ofSeconds(30));
        EscalationReport second = fixture.escalation.scan(DEFAULT_RUN);

        assertThat(second.getEntries()).isEmpty();
        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(8L);
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).hasSize(1);
    }

    @Test
    void openedConversationIsNeverEscalated() {
        fixture.agentConversations.open(500L, 7L);
        fixture.clock.set(t0.plusSeconds(1_000));

        assertThat(fixture.escalation.scan(DEFAULT_RUN).getEntries()).isEmpty();
        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(7L);
    }

    @Test
    void keepsAssigneeWhenNoOtherAgentIsAvailable() {
        fixture.presence.setStatus(8L, AgentStatus.OFFLINE);
        fixture.presence.setStatus(9L, AgentStatus.AWAY);
        fixture.clock.set(t0.plusSeconds(241));

        EscalationReport report = fixture.escalation.scan(DEFAULT_RUN);

        assertThat(report.count(Outcome.NO_CANDIDATE)).isEqualTo(1L);
        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(7L);
    }

    @Test
    void skipsAgentsAtTheirAssignmentRate() {
        for (int i = 0; i < fixture.properties.getAssignment().getRateLimit(); i++) {
            fixture.rateLimiter.increment(8L);
        }
        fixture.clock.set(t0.plusSeconds(241));

        fixture.escalation.scan(DEFAULT_RUN);

        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(9L);
    }

    @Test
    void honoursTimeoutOverride() {
        fixture.clock.set(t0.plusSeconds(61));

        EscalationReport report = fixture.escalation.scan(
                EscalationRequest.builder().timeoutSeconds(60L).build());

        assertThat(report.count(Outcome.REASSIGNED)).isEqualTo(1L);
    }

    @Test
    void dryRunReportsWithoutChangingAnything() {
        fixture.clock.set(t0.plusSeconds(241));

        EscalationReport report = fixture.escalation.scan(EscalationRequest.builder().dryRun(true).build());

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.getOutcome()).isEqualTo(Outcome.DRY_RUN);
            assertThat(entry.getNewAssigneeId()).isEqualTo(8L);
        });
        assertThat(fixture.conversation(500L).getAssigneeId()).isEqualTo(7L);
        assertThat(fixture.queue.snapshot(1L)).isEmpty();
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).isEmpty();
    }

    @Test
    void lostOptimisticUpdateIsReportedAsContention() {
        ConversationRepository racing = mock(ConversationRepository.class);
        Conversation stale = fixture.conversation(500L);
        when(racing.findEscalationCandidates(any(Instant.class), anyInt())).thenReturn(List.of(stale));
        when(racing.compareAndSetAssignee(anyLong(), any(), anyLong(), any(Instant.class))).thenReturn(false);
        ConversationAssigner assigner = new ConversationAssigner(racing, fixture.rateLimiter, fixture.eventBus, fixture.clock);
        EscalationScanner scanner =
                new EscalationScanner(racing, fixture.selector, assigner, fixture.properties, fixture.clock);
        fixture.clock.set(t0.plusSeconds(241));

        EscalationReport report = scanner.scan(DEFAULT_RUN);

        assertThat(report.count(Outcome.CONTENTION)).isEqualTo(1L);
        assertThat(fixture.store.getCounter(fixture.keyFactory.assignmentRateKey(8L))).isZero();
        assertThat(fixture.events.ofType(ChatEventType.ASSIGNEE_CHANGED)).isEmpty();
    }
}
