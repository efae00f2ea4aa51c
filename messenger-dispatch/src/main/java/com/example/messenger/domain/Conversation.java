package com.example.messenger.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private long id;
    private long inboxId;
    private String contactId;
    private Long branchId;
    private ConversationStatus status;
    private Long assigneeId;
    private Instant assignedAt;
    private Instant assigneeOpenedAt;
    private Instant waitingSince;
    private Instant firstReplyAt;
    private Instant lastActivityAt;
    private Instant createdAt;

    public boolean isUnassigned() {
        return assigneeId == null;
    }

    /**
     * Reference point of the escalation timeout: the assignment time, or creation for legacy rows.
     */
    public Instant assignmentReference() {
        return assignedAt != null ? assignedAt : createdAt;
    }
}
