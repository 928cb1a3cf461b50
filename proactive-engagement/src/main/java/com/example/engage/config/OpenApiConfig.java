package com.example.engage.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Proactive Engagement API",
                        version = "1.0",
                        description = "Scheduling, cancellation and history of proactive messages, and the commitment lifecycle."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi proactiveApi() {
        return GroupedOpenApi.builder()
                .group("proactive")
                .pathsToMatch("/api/proactive/**")
                .build();
    }

    @Bean
    public GroupedOpenApi commitmentApi() {
        return GroupedOpenApi.builder()
                .group("commitments")
                .pathsToMatch("/api/commitments/**")
                .build();
    }
}
