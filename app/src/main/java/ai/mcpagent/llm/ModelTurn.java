package ai.mcpagent.llm;

import dev.langchain4j.data.message.AiMessage;

/** The model's reply to one {@link ModelRequest}, with what it cost. */
public record ModelTurn(AiMessage message, RichTokenUsage usage, long durationMs, String modelName) {}
