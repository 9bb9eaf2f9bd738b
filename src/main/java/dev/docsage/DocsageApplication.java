package dev.docsage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Docsage hybrid retrieval service.
 *
 * <p>Serves {@code POST /api/retrieve} and the MCP tools over SSE on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DocsageApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocsageApplication.class, args);
    }
}
