package world.willfrog.agentrun.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.config.AgentLlmProperties;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentLlmResolverTest {

    private AgentLlmProperties properties;
    private AgentLlmResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new AgentLlmProperties();
        properties.setDefaultEndpoint("openrouter");
        properties.setDefaultModel("openai/gpt-4o");
        properties.setModels(List.of("openai/gpt-4o", "deepseek/deepseek-chat"));
        properties.getEndpoints().put("openrouter", endpoint("https://openrouter.ai/api/v1", "k1"));
        properties.getEndpoints().put("openai", endpoint("https://api.openai.com/v1", " "));
        resolver = new AgentLlmResolver(properties);
    }

    @Test
    void resolve_whenNothingRequested_shouldUseDefaults() {
        AgentLlmResolver.ResolvedLlm resolved = resolver.resolve(null, null);

        assertEquals("openrouter", resolved.endpointName());
        assertEquals("https://openrouter.ai/api/v1", resolved.baseUrl());
        assertEquals("openai/gpt-4o", resolved.modelName());
        assertEquals("k1", resolved.apiKey());
    }

    @Test
    void resolve_shouldStripRoutingPrefixAndBlankKey() {
        AgentLlmResolver.ResolvedLlm resolved = resolver.resolve("openai", "openrouter/deepseek/deepseek-chat");

        assertEquals("deepseek/deepseek-chat", resolved.modelName());
        assertNull(resolved.apiKey());
    }

    @Test
    void resolve_whenEndpointHasModelAlias_shouldSendProviderModelId() {
        properties.getEndpoints().get("openai").setModelAliases(Map.of("openai/gpt-4o", "gpt-4o"));

        assertEquals("gpt-4o", resolver.resolve("openai", "openai/gpt-4o").modelName());
        assertEquals("openai/gpt-4o", resolver.resolve("openrouter", "openai/gpt-4o").modelName());
    }

    @Test
    void resolve_whenEndpointUnknown_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve("azure", null));
    }

    @Test
    void resolve_whenModelNotAllowed_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(null, "mistral/large"));
    }

    private AgentLlmProperties.Endpoint endpoint(String baseUrl, String apiKey) {
        AgentLlmProperties.Endpoint endpoint = new AgentLlmProperties.Endpoint();
        endpoint.setBaseUrl(baseUrl);
        endpoint.setApiKey(apiKey);
        return endpoint;
    }
}
