package ai.mcpagent.llm;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.ChatMessage;
import java.util.List;

/**
 * One model call: the transcript so far and the tools the model may request.
 *
 * @param maxThinkingTokens extra output budget reserved for reasoning; 0 leaves the model's default limit
 */
public record ModelRequest(List<ChatMessage> messages, List<ToolSpecification> tools, int maxThinkingTokens) {
    public ModelRequest {
        messages = List.copyOf(messages);
        tools = List.copyOf(tools);
        if (maxThinkingTokens < 0) {
            throw new IllegalArgumentException("maxThinkingTokens must be >= 0");
        }
    }
}
