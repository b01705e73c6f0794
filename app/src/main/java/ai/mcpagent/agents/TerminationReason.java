package ai.mcpagent.agents;

/** Why a task stopped. */
public enum TerminationReason {
    /** The model answered without requesting tools. */
    COMPLETED,
    /** The turn limit was reached while the model was still requesting tools. */
    MAX_TURNS,
    /** The wall-clock budget ran out. */
    WALL_CLOCK,
    /** The model call failed after retries, or with a non-retryable error. */
    MODEL_FAILURE,
    /** The task was cancelled by its caller. */
    CANCELLED
}
