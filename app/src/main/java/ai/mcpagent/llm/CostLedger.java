package ai.mcpagent.llm;

import java.util.Locale;

/**
 * Running token and cost totals for one task. Thread-safe; the wall clock starts when the ledger is created.
 */
public class CostLedger {
    private final long startNanos = System.nanoTime();

    private long inputTokens;
    private long cachedInputTokens;
    private long cacheCreationInputTokens;
    private long thinkingTokens;
    private long outputTokens;
    private int modelCalls;
    private double estimatedCostUsd;

    public synchronized void record(ModelTurn turn) {
        var usage = turn.usage();
        inputTokens += usage.inputTokens();
        cachedInputTokens += usage.cachedInputTokens();
        cacheCreationInputTokens += usage.cacheCreationInputTokens();
        thinkingTokens += usage.thinkingTokens();
        outputTokens += usage.outputTokens();
        modelCalls++;
        estimatedCostUsd += ModelPricing.forModel(turn.modelName())
                .cost(
                        usage.inputTokens(),
                        usage.cachedInputTokens(),
                        usage.cacheCreationInputTokens(),
                        usage.outputTokens());
    }

    public synchronized CostSummary snapshot() {
        return new CostSummary(
                inputTokens,
                cachedInputTokens,
                cacheCreationInputTokens,
                thinkingTokens,
                outputTokens,
                modelCalls,
                (System.nanoTime() - startNanos) / 1_000_000,
                estimatedCostUsd);
    }

    public record CostSummary(
            long inputTokens,
            long cachedInputTokens,
            long cacheCreationInputTokens,
            long thinkingTokens,
            long outputTokens,
            int modelCalls,
            long wallClockMs,
            double estimatedCostUsd) {

        public String format() {
            return String.format(
                    Locale.ROOT,
                    "$%.4f (%d model calls, %d input tokens [%d cached], %d output tokens [%d thinking], %.1fs)",
                    estimatedCostUsd,
                    modelCalls,
                    inputTokens,
                    cachedInputTokens,
                    outputTokens,
                    thinkingTokens,
                    wallClockMs / 1000.0);
        }
    }
}
