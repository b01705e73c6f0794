package ai.mcpagent.llm;

import ai.mcpagent.exception.LlmException;
import org.jetbrains.annotations.Blocking;

/** Anything that can turn a transcript plus tool specifications into the model's next message. */
public interface ModelClient {

    /**
     * @throws LlmException if the provider fails; {@link LlmException#isRetryable()} tells retry decorators whether
     *     another attempt can help
     */
    @Blocking
    ModelTurn call(ModelRequest request) throws InterruptedException;

    String modelName();
}
