package ai.mcpagent.exception;

public class LlmException extends RuntimeException {
    private final boolean retryable;

    public LlmException(String activity, Throwable error) {
        this(activity, error, true);
    }

    public LlmException(String activity, Throwable error, boolean retryable) {
        super("LLM error while " + activity, error);
        this.retryable = retryable;
    }

    /** False for failures that will not improve on retry, e.g. a rejected request. */
    public boolean isRetryable() {
        return retryable;
    }
}
