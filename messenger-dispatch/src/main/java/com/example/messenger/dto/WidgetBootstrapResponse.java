package com.example.messenger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WidgetBootstrapResponse {
    String widgetSessionToken;
    long conversationId;
    boolean operatorsOnline;
    boolean captchaRequired;
    String captchaToken;
    String captchaQuestion;
    List<WidgetMessagePayload> initialMessages;
}
