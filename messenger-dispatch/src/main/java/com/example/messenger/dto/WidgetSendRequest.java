package com.example.messenger.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WidgetSendRequest {

    @NotBlank
    private String widgetToken;

    @NotBlank
    private String widgetSessionToken;

    // Emptiness is reported as empty_body by the gateway.
    private String body;

    private String captchaToken;

    private String captchaAnswer;
}
