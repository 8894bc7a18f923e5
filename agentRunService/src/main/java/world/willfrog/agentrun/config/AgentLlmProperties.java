package world.willfrog.agentrun.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import world.willfrog.agentrun.model.ModelFamily;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "agent.llm")
public class AgentLlmProperties {

    private String defaultEndpoint;
    private String defaultModel;
    private Map<String, Endpoint> endpoints = new HashMap<>();
    private List<String> models = new ArrayList<>();
    /**
     * 模型名 -> 模型家族，查找时忽略路由前缀（如 openrouter/）和大小写。
     */
    private Map<String, ModelFamily> modelFamilies = new HashMap<>();
    private Map<ModelFamily, FamilyProfile> familyProfiles = new EnumMap<>(ModelFamily.class);

    public String getDefaultEndpoint() {
        return defaultEndpoint;
    }

    public void setDefaultEndpoint(String defaultEndpoint) {
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public Map<String, Endpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Map<String, Endpoint> endpoints) {
        this.endpoints = endpoints == null ? new HashMap<>() : endpoints;
    }

    public List<String> getModels() {
        return models;
    }

    public void setModels(List<String> models) {
        this.models = models == null ? new ArrayList<>() : models;
    }

    public Map<String, ModelFamily> getModelFamilies() {
        return modelFamilies;
    }

    public void setModelFamilies(Map<String, ModelFamily> modelFamilies) {
        this.modelFamilies = modelFamilies == null ? new HashMap<>() : modelFamilies;
    }

    public Map<ModelFamily, FamilyProfile> getFamilyProfiles() {
        return familyProfiles;
    }

    public void setFamilyProfiles(Map<ModelFamily, FamilyProfile> familyProfiles) {
        this.familyProfiles = familyProfiles == null ? new EnumMap<>(ModelFamily.class) : familyProfiles;
    }

    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        /**
         * 允许列表中的模型名 -> 该供应商直连时使用的模型 id；未列出的模型原样发送。
         */
        private Map<String, String> modelAliases = new HashMap<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Map<String, String> getModelAliases() {
            return modelAliases;
        }

        public void setModelAliases(Map<String, String> modelAliases) {
            this.modelAliases = modelAliases == null ? new HashMap<>() : modelAliases;
        }
    }

    /**
     * 家族级覆盖项；未设置（null）的字段回退到 {@link ModelFamily} 中的默认值。
     */
    public static class FamilyProfile {
        private Integer contextBudget;
        private Integer charsPerToken;
        private Integer maxOutputTokens;
        private Boolean supportsImages;

        public Integer getContextBudget() {
            return contextBudget;
        }

        public void setContextBudget(Integer contextBudget) {
            this.contextBudget = contextBudget;
        }

        public Integer getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(Integer charsPerToken) {
            this.charsPerToken = charsPerToken;
        }

        public Integer getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public Boolean getSupportsImages() {
            return supportsImages;
        }

        public void setSupportsImages(Boolean supportsImages) {
            this.supportsImages = supportsImages;
        }
    }
}
