package com.example.messenger.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WidgetPollResponse {
    List<WidgetMessagePayload> messages;
}
