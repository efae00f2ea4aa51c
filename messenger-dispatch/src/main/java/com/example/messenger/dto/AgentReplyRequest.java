package com.example.messenger.dto;

import com.example.messenger.domain.MessageDirection;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AgentReplyRequest {

    @NotBlank
    private String body;

    private MessageDirection direction = MessageDirection.OUT;
}
