package com.chess.ingest.config;

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
    public OpenAPI pgnIngestOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PGN Ingest Adapter")
                        .description("REST API for importing PGN game collections into MongoDB. " +
                                "Games are validated, deduplicated and committed in transactional batches.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Chess Analytics")
                                .email("admin@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}
