package world.willfrog.agentrun.model;

/**
 * 压缩预算：允许的最大 token 数与该模型家族的字符/token 估算比例。
 *
 * @param family        模型家族
 * @param maxTokens     上下文 token 上限
 * @param charsPerToken 每个 token 估算的字符数
 */
public record ContextBudget(ModelFamily family, int maxTokens, int charsPerToken) {

    public ContextBudget {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        family = family == null ? ModelFamily.DEFAULT : family;
    }

    public static ContextBudget of(int maxTokens) {
        return new ContextBudget(ModelFamily.DEFAULT, maxTokens, ModelFamily.DEFAULT.defaultCharsPerToken());
    }
}
