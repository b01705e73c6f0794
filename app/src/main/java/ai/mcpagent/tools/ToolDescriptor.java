package ai.mcpagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import org.jetbrains.annotations.Nullable;

/**
 * A tool as the catalog sees it. Remote descriptors are created at discovery and replaced wholesale when their server
 * re-lists its tools; they are never mutated.
 *
 * @param serverName owning MCP server, or null for tools implemented in-process
 * @param outputSchema declared output contract, kept verbatim; null if the server declares none
 * @param sideEffecting true if the tool may modify state outside the agent, which hides it in restricted mode
 */
public record ToolDescriptor(
        String name,
        String description,
        JsonObjectSchema inputSchema,
        @Nullable JsonNode outputSchema,
        @Nullable String serverName,
        boolean sideEffecting) {

    public ToolSpecification toToolSpecification() {
        return ToolSpecification.builder()
                .name(name)
                .description(description)
                .parameters(inputSchema)
                .build();
    }
}
