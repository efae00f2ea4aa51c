package com.example.messenger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentProfile {

    private long agentId;
    private Long branchId;
    private boolean active;
    private AgentStatus status;
}
