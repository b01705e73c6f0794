package ai.mcpagent.llm;

import ai.mcpagent.exception.LlmException;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Retries a delegate client on retryable failures, using exponential backoff: the first retry waits the base delay,
 * each later one twice as long, capped at 16 times the base delay.
 */
public class RetryingModelClient implements ModelClient {
    private static final Logger logger = LogManager.getLogger(RetryingModelClient.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 8;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    static final int MAX_BACKOFF_MULTIPLIER = 16;

    private final ModelClient delegate;
    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryingModelClient(ModelClient delegate) {
        this(delegate, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    public RetryingModelClient(ModelClient delegate, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    @Override
    public ModelTurn call(ModelRequest request) throws InterruptedException {
        @Nullable LlmException lastError = null;
        int attempt = 0;
        while (attempt++ < maxAttempts) {
            logger.debug("Sending request to {} attempt {}", delegate.modelName(), attempt);
            try {
                return delegate.call(request);
            } catch (LlmException e) {
                lastError = e;
                if (!e.isRetryable()) {
                    logger.debug("Non-retryable error from {}: {}", delegate.modelName(), rootMessage(e));
                    throw e;
                }
            }

            logger.debug("LLM error == {}. Attempt={}", rootMessage(lastError), attempt);
            if (attempt == maxAttempts) {
                break;
            }
            var backoff = backoff(attempt);
            logger.warn(
                    "LLM issue on attempt {}/{} (retrying in {} ms).", attempt, maxAttempts, backoff.toMillis());
            Thread.sleep(backoff.toMillis());
        }

        throw new LlmException("calling %s (%d attempts)".formatted(delegate.modelName(), maxAttempts), lastError, false);
    }

    /** Delay after failed attempt number {@code attempt} (1-based). */
    Duration backoff(int attempt) {
        long multiplier = Math.min(1L << Math.min(attempt - 1, 30), MAX_BACKOFF_MULTIPLIER);
        return baseDelay.multipliedBy(multiplier);
    }

    private static String rootMessage(Throwable t) {
        var root = t;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }
}
