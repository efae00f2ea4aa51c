package com.example.messenger.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EscalationReport {

    Instant startedAt;
    long timeoutSeconds;
    boolean dryRun;
    List<Entry> entries;

    public long count(Outcome outcome) {
        return entries.stream().filter(entry -> entry.getOutcome() == outcome).count();
    }

    public enum Outcome {
        REASSIGNED,
        NO_CANDIDATE,
        CONTENTION,
        FAILED,
        DRY_RUN
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Entry {

        long conversationId;
        Long previousAssigneeId;
        Long newAssigneeId;
        Outcome outcome;
    }
}
