package ai.mcpagent.llm;

import java.util.Locale;

/**
 * Per-million-token prices in USD. Cached input is billed at a tenth of the input price; input written to the prompt
 * cache costs a quarter more than plain input.
 */
public record ModelPricing(double inputPerMillion, double outputPerMillion) {
    public static final ModelPricing DEFAULT = new ModelPricing(3.0, 15.0);
    public static final ModelPricing HAIKU = new ModelPricing(0.8, 4.0);
    public static final ModelPricing GPT = new ModelPricing(1.0, 3.0);

    static final double CACHED_INPUT_FACTOR = 0.1;
    static final double CACHE_CREATION_FACTOR = 1.25;

    public static ModelPricing forModel(String modelName) {
        var lower = modelName.toLowerCase(Locale.ROOT);
        if (lower.contains("haiku")) {
            return HAIKU;
        }
        if (lower.contains("gpt")) {
            return GPT;
        }
        return DEFAULT;
    }

    public double cachedInputPerMillion() {
        return inputPerMillion * CACHED_INPUT_FACTOR;
    }

    public double cacheCreationPerMillion() {
        return inputPerMillion * CACHE_CREATION_FACTOR;
    }

    public double cost(long inputTokens, long cachedInputTokens, long outputTokens) {
        return cost(inputTokens, cachedInputTokens, 0, outputTokens);
    }

    /**
     * {@code inputTokens} includes the cached and cache-creation ones; those are charged at their own rates instead of
     * the input price.
     */
    public double cost(long inputTokens, long cachedInputTokens, long cacheCreationInputTokens, long outputTokens) {
        long uncached = Math.max(0, inputTokens - cachedInputTokens - cacheCreationInputTokens);
        return (uncached * inputPerMillion
                        + cachedInputTokens * cachedInputPerMillion()
                        + cacheCreationInputTokens * cacheCreationPerMillion()
                        + outputTokens * outputPerMillion)
                / 1_000_000.0;
    }
}
