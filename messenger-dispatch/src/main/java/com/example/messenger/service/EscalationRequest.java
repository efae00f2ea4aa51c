package com.example.messenger.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EscalationRequest {

    Long timeoutSeconds;

    boolean dryRun;

    int limit;
}
