package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.Conversation;
import com.example.messenger.service.EscalationReport.Entry;
import com.example.messenger.service.EscalationReport.Outcome;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reassigns conversations whose assignee did not open them within the timeout. Safe to run from
 * several processes at once: a reassignment only commits if the assignee read at selection time
 * is still in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationScanner {

    private final ConversationRepository conversationRepository;
    private final AssigneeSelector assigneeSelector;
    private final ConversationAssigner conversationAssigner;
    private final MessengerProperties messengerProperties;
    private final Clock clock;

    public EscalationReport scan(EscalationRequest request) {
        MessengerProperties.Escalation config = messengerProperties.getEscalation();
        long timeoutSeconds = request.getTimeoutSeconds() != null
                ? Math.max(request.getTimeoutSeconds(), 0)
                : config.getTimeoutSeconds();
        int limit = request.getLimit() > 0 ? request.getLimit() : config.getBatchSize();
        Instant now = clock.instant();

        List<Conversation> stale = conversationRepository.findEscalationCandidates(now.minusSeconds(timeoutSeconds), limit);
        List<Entry> entries = new ArrayList<>(stale.size());
        for (Conversation conversation : stale) {
            entries.add(escalate(conversation, request.isDryRun()));
        }

        EscalationReport report = EscalationReport.builder()
                .startedAt(now)
                .timeoutSeconds(timeoutSeconds)
                .dryRun(request.isDryRun())
                .entries(List.copyOf(entries))
                .build();
        if (!entries.isEmpty()) {
            log.info(
                    "Escalation scan examined {} conversations: {} reassigned, {} without candidate, {} contended, {} failed{}",
                    entries.size(),
                    report.count(Outcome.REASSIGNED),
                    report.count(Outcome.NO_CANDIDATE),
                    report.count(Outcome.CONTENTION),
                    report.count(Outcome.FAILED),
                    request.isDryRun() ? " (dry run)" : "");
        }
        return report;
    }

    private Entry escalate(Conversation conversation, boolean dryRun) {
        Long previous = conversation.getAssigneeId();
        try {
            if (dryRun) {
                Optional<Long> preview = assigneeSelector.preview(conversation, previous);
                return entry(conversation, preview.orElse(null), preview.isPresent() ? Outcome.DRY_RUN : Outcome.NO_CANDIDATE);
            }
            Optional<Long> selected = assigneeSelector.select(conversation, previous);
            if (selected.isEmpty()) {
                log.debug("Conversation {} keeps agent {}: no other agent available", conversation.getId(), previous);
                return entry(conversation, null, Outcome.NO_CANDIDATE);
            }
            boolean reassigned = conversationAssigner.assign(
                    conversation, selected.get(), ConversationAssigner.REASON_ESCALATION, true);
            if (!reassigned) {
                assigneeSelector.giveTurnBack(conversation, selected.get());
            }
            return entry(conversation, selected.get(), reassigned ? Outcome.REASSIGNED : Outcome.CONTENTION);
        } catch (QueueContentionException ex) {
            log.debug("Skipping escalation of conversation {}: {}", conversation.getId(), ex.getMessage());
            return entry(conversation, null, Outcome.CONTENTION);
        } catch (Exception ex) {
            log.warn("Failed to escalate conversation {}", conversation.getId(), ex);
            return entry(conversation, null, Outcome.FAILED);
        }
    }

    private Entry entry(Conversation conversation, Long newAssigneeId, Outcome outcome) {
        return Entry.builder()
                .conversationId(conversation.getId())
                .previousAssigneeId(conversation.getAssigneeId())
                .newAssigneeId(newAssigneeId)
                .outcome(outcome)
                .build();
    }
}
