package com.kg.core.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI configuration for the knowledge graph HTTP surface.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI knowledgeGraphServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Knowledge Graph Service API")
                        .description("Reads and edits the persisted knowledge graph, manages its backups " +
                                "and publishes updates into the real-time ingestion pipeline.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
