package ai.mcpagent.tools;

import ai.mcpagent.exception.ErrorKind;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import org.jetbrains.annotations.Nullable;

/**
 * Tagged outcome of one dispatch. Every dispatch produces exactly one of these, failures included, so the transcript
 * always has an entry per requested call.
 */
public record ToolExecutionResult(
        ToolInvocation invocation,
        boolean success,
        String payload, // tool output on success, error message otherwise
        @Nullable ErrorKind errorKind,
        long timingMs) {

    public static final String EMPTY_OUTPUT = "Tool executed successfully (no output)";

    // --- Factory Methods ---

    public static ToolExecutionResult success(ToolInvocation invocation, @Nullable String output, long timingMs) {
        String finalText = (output == null || output.isBlank()) ? EMPTY_OUTPUT : output;
        return new ToolExecutionResult(invocation, true, finalText, null, timingMs);
    }

    public static ToolExecutionResult failure(
            ToolInvocation invocation, ErrorKind kind, String errorMessage, long timingMs) {
        return new ToolExecutionResult(invocation, false, errorMessage, kind, timingMs);
    }

    public static ToolExecutionResult cancelled(ToolInvocation invocation, long timingMs) {
        return failure(invocation, ErrorKind.CANCELLED, "Tool call cancelled", timingMs);
    }

    // --- Convenience Accessors ---

    public String toolName() {
        return invocation.toolName();
    }

    public String toolId() {
        return invocation.correlationId();
    }

    // --- Conversion ---

    /** The message fed back to the model. Failures are reported in-band so the model can react to them. */
    public ToolExecutionResultMessage toExecutionResultMessage() {
        String text = success ? payload : "Tool execution error (%s): %s".formatted(errorKind, payload);
        return new ToolExecutionResultMessage(toolId(), toolName(), text);
    }

    /** {@code {success, payload | errorKind, timingMs}}. */
    public ObjectNode toJson() {
        var node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);
        if (success) {
            node.put("payload", payload);
        } else {
            node.put("errorKind", String.valueOf(errorKind));
            node.put("message", payload);
        }
        node.put("timingMs", timingMs);
        return node;
    }
}
