package world.willfrog.agentrun.model;

/**
 * 模型家族。每个家族带有一组默认的上下文预算参数，可被配置覆盖。
 */
public enum ModelFamily {
    CLAUDE_SONNET(108_000, 4, 8_192, true),
    GPT(100_000, 4, 4_096, true),
    GEMINI(700_000, 4, 64_000, true),
    DEEPSEEK(100_000, 4, 8_192, false),
    DEFAULT(31_000, 4, 4_096, false);

    private final int defaultContextBudget;
    private final int defaultCharsPerToken;
    private final int defaultMaxOutputTokens;
    private final boolean defaultSupportsImages;

    ModelFamily(int defaultContextBudget, int defaultCharsPerToken, int defaultMaxOutputTokens, boolean defaultSupportsImages) {
        this.defaultContextBudget = defaultContextBudget;
        this.defaultCharsPerToken = defaultCharsPerToken;
        this.defaultMaxOutputTokens = defaultMaxOutputTokens;
        this.defaultSupportsImages = defaultSupportsImages;
    }

    public int defaultContextBudget() {
        return defaultContextBudget;
    }

    public int defaultCharsPerToken() {
        return defaultCharsPerToken;
    }

    public int defaultMaxOutputTokens() {
        return defaultMaxOutputTokens;
    }

    public boolean defaultSupportsImages() {
        return defaultSupportsImages;
    }
}
