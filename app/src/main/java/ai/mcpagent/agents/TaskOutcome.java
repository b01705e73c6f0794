package ai.mcpagent.agents;

import ai.mcpagent.llm.CostLedger.CostSummary;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * How a task ended.
 *
 * @param finalAnswer the model's closing text when {@code reason} is COMPLETED, otherwise the last text it produced
 *     (if any)
 * @param explanation human-readable reason for stopping
 */
public record TaskOutcome(
        TerminationReason reason,
        @Nullable String finalAnswer,
        List<ExecutionTurn> transcript,
        CostSummary cost,
        String explanation) {

    public TaskOutcome {
        transcript = List.copyOf(transcript);
    }

    public boolean completed() {
        return reason == TerminationReason.COMPLETED;
    }
}
