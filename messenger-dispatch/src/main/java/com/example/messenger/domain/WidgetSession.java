package com.example.messenger.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WidgetSession {

    private String token;
    private long inboxId;
    private long conversationId;
    private String contactId;
    private Instant createdAt;
}
