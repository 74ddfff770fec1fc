package com.chess.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.chess.ingest.config.IngestProperties;

@SpringBootApplication
@EnableConfigurationProperties(IngestProperties.class)
public class PgnIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgnIngestApplication.class, args);
    }
}
