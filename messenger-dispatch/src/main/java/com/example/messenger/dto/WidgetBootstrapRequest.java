package com.example.messenger.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WidgetBootstrapRequest {

    @NotBlank
    private String widgetToken;

    @NotBlank
    @Size(max = 255)
    private String contactExternalId;

    @Size(max = 255)
    private String name;

    private Long regionId;
}
