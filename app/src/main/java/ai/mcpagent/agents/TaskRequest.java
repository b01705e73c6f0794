package ai.mcpagent.agents;

import ai.mcpagent.tools.PermissionMode;
import java.time.Duration;
import org.jetbrains.annotations.Nullable;

/**
 * Inputs of one agent task.
 *
 * @param maxThinkingTokens reasoning budget passed to the model on every turn; 0 for none
 */
public record TaskRequest(
        String prompt,
        @Nullable String systemPrompt,
        PermissionMode mode,
        int maxTurns,
        Duration maxWallClock,
        int maxThinkingTokens) {

    public static final int DEFAULT_MAX_TURNS = 25;
    public static final Duration DEFAULT_MAX_WALL_CLOCK = Duration.ofMinutes(10);

    public TaskRequest {
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be empty");
        }
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1");
        }
        if (maxWallClock.isNegative() || maxWallClock.isZero()) {
            throw new IllegalArgumentException("maxWallClock must be positive");
        }
        if (maxThinkingTokens < 0) {
            throw new IllegalArgumentException("maxThinkingTokens must be >= 0");
        }
    }

    /** A restricted-mode request with default limits. */
    public static TaskRequest of(String prompt) {
        return new TaskRequest(prompt, null, PermissionMode.RESTRICTED, DEFAULT_MAX_TURNS, DEFAULT_MAX_WALL_CLOCK, 0);
    }

    public TaskRequest withSystemPrompt(@Nullable String systemPrompt) {
        return new TaskRequest(prompt, systemPrompt, mode, maxTurns, maxWallClock, maxThinkingTokens);
    }

    public TaskRequest withMode(PermissionMode mode) {
        return new TaskRequest(prompt, systemPrompt, mode, maxTurns, maxWallClock, maxThinkingTokens);
    }

    public TaskRequest withLimits(int maxTurns, Duration maxWallClock) {
        return new TaskRequest(prompt, systemPrompt, mode, maxTurns, maxWallClock, maxThinkingTokens);
    }

    public TaskRequest withMaxThinkingTokens(int maxThinkingTokens) {
        return new TaskRequest(prompt, systemPrompt, mode, maxTurns, maxWallClock, maxThinkingTokens);
    }
}
