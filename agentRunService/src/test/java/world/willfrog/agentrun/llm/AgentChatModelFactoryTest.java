package world.willfrog.agentrun.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import world.willfrog.agentrun.config.AgentLlmProperties;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentChatModelFactoryTest {

    private AgentChatModelFactory factory;

    @BeforeEach
    void setUp() {
        factory = new AgentChatModelFactory(new AgentLlmResolver(new AgentLlmProperties()));
        ReflectionTestUtils.setField(factory, "timeoutSeconds", 30L);
        ReflectionTestUtils.setField(factory, "openRouterHttpReferer", "https://example.com");
        ReflectionTestUtils.setField(factory, "openRouterTitle", "Agent Run Service");
    }

    @Test
    void buildChatModel_whenEndpointKeyPresent_shouldBuild() {
        AgentLlmResolver.ResolvedLlm resolved =
                new AgentLlmResolver.ResolvedLlm("openrouter", "https://openrouter.ai/api/v1", "openai/gpt-4o", "k1");

        assertNotNull(factory.buildChatModel(resolved, 0.0D, 1024));
        assertNotNull(factory.buildStreamingChatModel(resolved, 0.0D, 1024));
    }

    @Test
    void buildChatModel_whenEndpointKeyMissing_shouldFallBackToGlobalKey() {
        ReflectionTestUtils.setField(factory, "openAiApiKey", "global");
        AgentLlmResolver.ResolvedLlm resolved =
                new AgentLlmResolver.ResolvedLlm("openai", "https://api.openai.com/v1", "gpt-4o", null);

        assertNotNull(factory.buildChatModel(resolved, null, null));
    }

    @Test
    void buildChatModel_whenNoKeyAtAll_shouldThrow() {
        ReflectionTestUtils.setField(factory, "openAiApiKey", "");
        AgentLlmResolver.ResolvedLlm resolved =
                new AgentLlmResolver.ResolvedLlm("openai", "https://api.openai.com/v1", "gpt-4o", null);

        assertThrows(IllegalArgumentException.class, () -> factory.buildChatModel(resolved, null, null));
    }
}
