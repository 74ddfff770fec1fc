package com.chess.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Chess Analytics API")
                        .version("1.0.0")
                        .description("Read-only statistics over imported games: opening success rates, rating trends, repertoires, volatility and time-control comparison.")
                        .contact(new Contact().name("Chess Analytics").email("analytics@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8081").description("Local Development"),
                        new Server().url("http://analytics-api:8080").description("Docker")
                ));
    }
}
