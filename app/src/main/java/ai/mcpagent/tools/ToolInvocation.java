package ai.mcpagent.tools;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import java.time.Instant;

/**
 * One requested call, from the model's tool request to its result.
 *
 * @param correlationId id the model assigned to the request; echoed on the result message
 * @param arguments raw JSON object text, validated against the tool's schema at dispatch
 */
public record ToolInvocation(String correlationId, String toolName, String arguments, Instant deadline) {

    public static ToolInvocation from(ToolExecutionRequest request, Instant deadline) {
        var id = request.id() == null ? "" : request.id();
        var args = request.arguments() == null ? "" : request.arguments();
        return new ToolInvocation(id, request.name(), args, deadline);
    }
}
