package ai.mcpagent.llm;

import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Factories for the model clients the CLI can run against. */
public final class ModelClients {
    private static final Logger logger = LogManager.getLogger(ModelClients.class);

    public static final String API_KEY_ENV = "OPENAI_API_KEY";
    public static final String BASE_URL_ENV = "OPENAI_BASE_URL";
    public static final String DEFAULT_MODEL = "gpt-4.1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(3);

    private ModelClients() {}

    /** An OpenAI-compatible client configured from the environment, wrapped in the default retry policy. */
    public static ModelClient openAi(@Nullable String modelName) {
        var apiKey = System.getenv(API_KEY_ENV);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(API_KEY_ENV + " is not set");
        }
        return openAi(apiKey, System.getenv(BASE_URL_ENV), modelName == null ? DEFAULT_MODEL : modelName);
    }

    public static ModelClient openAi(String apiKey, @Nullable String baseUrl, String modelName) {
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .timeout(DEFAULT_TIMEOUT)
                // retries belong to RetryingModelClient
                .maxRetries(0)
                .logRequests(logger.isTraceEnabled())
                .logResponses(logger.isTraceEnabled());
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        logger.debug("Using model {} at {}", modelName, baseUrl == null ? "the default endpoint" : baseUrl);
        return new RetryingModelClient(new LangChain4jModelClient(builder.build(), modelName));
    }
}
