package ai.mcpagent.llm;

import dev.langchain4j.model.openai.OpenAiTokenUsage;
import dev.langchain4j.model.output.TokenUsage;
import org.jetbrains.annotations.Nullable;

/**
 * Token counts for one model call. {@code cachedInputTokens} and {@code cacheCreationInputTokens} are subsets of
 * {@code inputTokens}; {@code thinkingTokens} are a subset of {@code outputTokens}.
 */
public record RichTokenUsage(
        int inputTokens, int cachedInputTokens, int cacheCreationInputTokens, int thinkingTokens, int outputTokens) {
    public static final RichTokenUsage ZERO = new RichTokenUsage(0, 0, 0, 0, 0);

    public RichTokenUsage(int inputTokens, int cachedInputTokens, int thinkingTokens, int outputTokens) {
        this(inputTokens, cachedInputTokens, 0, thinkingTokens, outputTokens);
    }

    /** OpenAI-compatible endpoints report cache reads but not cache writes, so cache creation stays zero here. */
    public static RichTokenUsage from(@Nullable TokenUsage usage) {
        if (usage == null) {
            return ZERO;
        }
        int inputTokens = usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
        int outputTokens = usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
        int cachedInputTokens = 0;
        int thinkingTokens = 0;
        if (usage instanceof OpenAiTokenUsage openAi) {
            var inputDetails = openAi.inputTokensDetails();
            var outputDetails = openAi.outputTokensDetails();
            if (inputDetails != null && inputDetails.cachedTokens() != null) {
                cachedInputTokens = inputDetails.cachedTokens();
            }
            if (outputDetails != null && outputDetails.reasoningTokens() != null) {
                thinkingTokens = outputDetails.reasoningTokens();
            }
        }
        return new RichTokenUsage(inputTokens, cachedInputTokens, thinkingTokens, outputTokens);
    }
}
