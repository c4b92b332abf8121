package com.example.realtime.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Realtime Delivery API",
                        version = "1.0",
                        description = "Push token registration and delivery health.",
                        contact = @Contact(name = "Realtime Delivery Team", email = "support@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi realtimeApi() {
        return GroupedOpenApi.builder()
                .group("realtime")
                .pathsToMatch("/api/**")
                .build();
    }
}
