package dev.docsage.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} methods as MCP tools via Spring AI auto-configuration.
 *
 * @see McpToolService
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider docsageTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
