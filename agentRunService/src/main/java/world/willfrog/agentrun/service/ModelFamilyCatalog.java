package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentLlmProperties;
import world.willfrog.agentrun.model.ContextBudget;
import world.willfrog.agentrun.model.ModelFamily;

import java.util.Locale;
import java.util.Map;

/**
 * 模型名到模型家族的显式查找表。
 * <p>
 * 表项来自 {@code agent.llm.model-families}；未登记的模型归入 {@link ModelFamily#DEFAULT}，
 * 使用最保守的预算。家族参数以枚举默认值为底，可被 {@code agent.llm.family-profiles} 覆盖。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelFamilyCatalog {

    private static final String ROUTING_PREFIX = "openrouter/";

    private final AgentLlmProperties llmProperties;

    /**
     * 家族参数的最终取值。
     */
    public record FamilyProfile(ModelFamily family,
                                int contextBudget,
                                int charsPerToken,
                                int maxOutputTokens,
                                boolean supportsImages) {
    }

    public ModelFamily resolveFamily(String modelName) {
        String key = normalizeModelName(modelName);
        if (key.isEmpty()) {
            return ModelFamily.DEFAULT;
        }
        for (Map.Entry<String, ModelFamily> entry : llmProperties.getModelFamilies().entrySet()) {
            if (key.equals(normalizeModelName(entry.getKey())) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        log.debug("Model not registered in family table, use DEFAULT: {}", modelName);
        return ModelFamily.DEFAULT;
    }

    public FamilyProfile profile(ModelFamily family) {
        ModelFamily target = family == null ? ModelFamily.DEFAULT : family;
        AgentLlmProperties.FamilyProfile override = llmProperties.getFamilyProfiles().get(target);
        if (override == null) {
            return new FamilyProfile(target,
                    target.defaultContextBudget(),
                    target.defaultCharsPerToken(),
                    target.defaultMaxOutputTokens(),
                    target.defaultSupportsImages());
        }
        return new FamilyProfile(target,
                positiveOr(override.getContextBudget(), target.defaultContextBudget()),
                positiveOr(override.getCharsPerToken(), target.defaultCharsPerToken()),
                positiveOr(override.getMaxOutputTokens(), target.defaultMaxOutputTokens()),
                override.getSupportsImages() == null ? target.defaultSupportsImages() : override.getSupportsImages());
    }

    public FamilyProfile profileForModel(String modelName) {
        return profile(resolveFamily(modelName));
    }

    public ContextBudget budgetForModel(String modelName) {
        FamilyProfile profile = profileForModel(modelName);
        return new ContextBudget(profile.family(), profile.contextBudget(), profile.charsPerToken());
    }

    private String normalizeModelName(String modelName) {
        if (modelName == null) {
            return "";
        }
        String value = modelName.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith(ROUTING_PREFIX)) {
            value = value.substring(ROUTING_PREFIX.length());
        }
        return value;
    }

    private int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
