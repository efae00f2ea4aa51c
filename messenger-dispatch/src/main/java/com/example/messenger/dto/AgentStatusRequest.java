package com.example.messenger.dto;

import com.example.messenger.domain.AgentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AgentStatusRequest {

    @NotNull
    private AgentStatus status;
}
