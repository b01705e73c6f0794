package ai.mcpagent.llm;

import ai.mcpagent.exception.LlmException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Adapts a LangChain4j {@link ChatModel} to {@link ModelClient}. */
public class LangChain4jModelClient implements ModelClient {
    private static final Logger logger = LogManager.getLogger(LangChain4jModelClient.class);

    private final ChatModel model;
    private final String modelName;
    private final @Nullable Integer baseMaxOutputTokens;

    public LangChain4jModelClient(ChatModel model, String modelName) {
        this(model, modelName, null);
    }

    /**
     * @param baseMaxOutputTokens output limit before any thinking budget is added; null to use the provider default
     *     when no thinking budget is requested
     */
    public LangChain4jModelClient(ChatModel model, String modelName, @Nullable Integer baseMaxOutputTokens) {
        this.model = model;
        this.modelName = modelName;
        this.baseMaxOutputTokens = baseMaxOutputTokens;
    }

    static final int DEFAULT_OUTPUT_TOKENS = 8192;

    @Override
    public ModelTurn call(ModelRequest request) throws InterruptedException {
        var builder = ChatRequest.builder().messages(request.messages());
        if (!request.tools().isEmpty()) {
            builder.toolSpecifications(request.tools());
        }
        var maxOutput = maxOutputTokens(request.maxThinkingTokens());
        if (maxOutput != null) {
            builder.maxOutputTokens(maxOutput);
        }
        var chatRequest = builder.build();

        long start = System.currentTimeMillis();
        try {
            var response = model.chat(chatRequest);
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            long duration = System.currentTimeMillis() - start;
            var usage = RichTokenUsage.from(response.tokenUsage());
            logger.debug(
                    "{} answered in {} ms ({} in / {} out tokens)",
                    modelName,
                    duration,
                    usage.inputTokens(),
                    usage.outputTokens());
            return new ModelTurn(response.aiMessage(), usage, duration, modelName);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted during call to " + modelName);
            }
            logger.debug("Call to {} failed: {}", modelName, e.getMessage());
            throw new LlmException("calling " + modelName, e, isRetryable(e));
        }
    }

    /** Reasoning tokens are billed as output, so a thinking budget widens the output limit by that amount. */
    @Nullable
    Integer maxOutputTokens(int maxThinkingTokens) {
        if (maxThinkingTokens <= 0) {
            return baseMaxOutputTokens;
        }
        int base = baseMaxOutputTokens == null ? DEFAULT_OUTPUT_TOKENS : baseMaxOutputTokens;
        return base + maxThinkingTokens;
    }

    /** Requests the provider rejected as malformed will be rejected again. */
    static boolean isRetryable(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return false;
        }
        for (var t = error; t != null; t = t.getCause()) {
            var msg = t.getMessage();
            if (msg == null) continue;
            var lower = msg.toLowerCase(Locale.ROOT);
            if (msg.contains("BadRequestError")
                    || msg.contains("UnsupportedParamsError")
                    || lower.contains("invalid_request_error")
                    || lower.contains("invalid api key")
                    || lower.contains("incorrect api key")) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
