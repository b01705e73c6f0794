package ai.mcpagent.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a {@code tools/call}, with the content blocks flattened to text.
 *
 * @param isError true when the server ran the tool and the tool reported failure
 * @param raw the unmodified {@code result} object
 */
public record McpToolResult(String text, boolean isError, JsonNode raw) {

    static McpToolResult fromCallResult(McpSchema.CallToolResult result, JsonNode raw) {
        var parts = new ArrayList<String>();
        var content = result.content() == null ? List.<McpSchema.Content>of() : result.content();
        for (int i = 0; i < content.size(); i++) {
            var block = content.get(i);
            if (block instanceof McpSchema.TextContent text) {
                parts.add(text.text() == null ? "" : text.text());
            } else if (block instanceof McpSchema.ImageContent image) {
                parts.add("[image: %s]".formatted(image.mimeType()));
            } else if (block instanceof McpSchema.EmbeddedResource embedded
                    && embedded.resource() instanceof McpSchema.TextResourceContents resourceText) {
                parts.add(resourceText.text());
            } else {
                var node = raw.path("content").path(i);
                parts.add(node.has("mimeType")
                        ? "[%s: %s]".formatted(node.path("type").asText("content"), node.get("mimeType").asText())
                        : node.toString());
            }
        }
        if (parts.isEmpty() && raw.has("structuredContent")) {
            parts.add(raw.get("structuredContent").toString());
        }
        return new McpToolResult(String.join("\n", parts), Boolean.TRUE.equals(result.isError()), raw);
    }
}
