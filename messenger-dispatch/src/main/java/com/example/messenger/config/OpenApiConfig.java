package com.example.messenger.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Messenger Dispatch API",
                        version = "1.0",
                        description = "Conversation routing, escalation, presence and the public chat widget."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi adminApi() {
        return GroupedOpenApi.builder()
                .group("admin")
                .pathsToMatch("/api/**")
                .build();
    }

    @Bean
    public GroupedOpenApi widgetApi() {
        return GroupedOpenApi.builder()
                .group("widget")
                .pathsToMatch("/widget/**")
                .build();
    }
}
