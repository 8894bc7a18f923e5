package world.willfrog.agentrun.llm;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentLlmProperties;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AgentLlmResolver {

    private static final String ROUTING_PREFIX = "openrouter/";

    private final AgentLlmProperties properties;

    /**
     * 根据请求中的 endpoint/model 名称解析出实际的 baseUrl 与模型名。
     *
     * @param endpointName 路由目标（允许为空，使用默认值）
     * @param modelName    模型名（允许为空，使用默认值）
     * @return 解析后的 LLM 配置
     */
    public ResolvedLlm resolve(String endpointName, String modelName) {
        Map<String, AgentLlmProperties.Endpoint> endpoints = properties.getEndpoints();

        String endpointKey = normalize(endpointName);
        if (endpointKey == null) {
            endpointKey = normalize(properties.getDefaultEndpoint());
        }
        if (endpointKey == null && !endpoints.isEmpty()) {
            endpointKey = endpoints.keySet().iterator().next();
        }

        AgentLlmProperties.Endpoint endpoint = endpointKey == null ? null : endpoints.get(endpointKey);
        if (endpoint == null || isBlank(endpoint.getBaseUrl())) {
            throw new IllegalArgumentException("endpoint_name not configured: " + endpointKey);
        }

        String model = normalize(modelName);
        if (model == null) {
            model = normalize(properties.getDefaultModel());
        }
        List<String> models = properties.getModels();
        if (model == null && !models.isEmpty()) {
            model = models.get(0);
        }
        if (model == null) {
            throw new IllegalArgumentException("model_name not configured");
        }
        // 路由前缀只用于选 endpoint，发给供应商的模型名不带前缀
        if (model.startsWith(ROUTING_PREFIX)) {
            model = model.substring(ROUTING_PREFIX.length());
        }
        if (!models.isEmpty() && !models.contains(model)) {
            throw new IllegalArgumentException("model_name not in allow list: " + model);
        }
        String alias = normalize(endpoint.getModelAliases().get(model));
        if (alias != null) {
            model = alias;
        }

        return new ResolvedLlm(endpointKey, endpoint.getBaseUrl(), model, normalize(endpoint.getApiKey()));
    }

    private String normalize(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public record ResolvedLlm(String endpointName, String baseUrl, String modelName, String apiKey) {
    }
}
