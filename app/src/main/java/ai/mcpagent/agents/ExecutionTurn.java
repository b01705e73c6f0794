package ai.mcpagent.agents;

import ai.mcpagent.tools.ToolExecutionResult;
import dev.langchain4j.data.message.AiMessage;
import java.util.List;

/** One model message and the results of the tools it requested, in request order. Turn indexes start at 1. */
public record ExecutionTurn(int index, AiMessage message, List<ToolExecutionResult> results) {
    public ExecutionTurn {
        results = List.copyOf(results);
    }
}
