package world.willfrog.agentrun.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import world.willfrog.agentrun.llm.AgentLlmResolver;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ApplicationConfigTest {

    private Binder binder;

    @BeforeEach
    void setUp() throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        sources.forEach(source -> environment.getPropertySources().addLast(source));
        binder = new Binder(ConfigurationPropertySources.get(environment));
    }

    @Test
    void overloadFallbackEndpoint_shouldDifferFromDefaultAndBeConfigured() {
        AgentLlmProperties llm = binder.bind("agent.llm", AgentLlmProperties.class).get();
        AgentRuntimeProperties.Turn turn = binder.bind("agent.runtime.turn", AgentRuntimeProperties.Turn.class).get();

        assertNotEquals(llm.getDefaultEndpoint(), turn.getOverloadFallbackEndpoint());
        assertNotNull(llm.getEndpoints().get(llm.getDefaultEndpoint()));
        assertNotNull(llm.getEndpoints().get(turn.getOverloadFallbackEndpoint()));
    }

    @Test
    void defaultModel_shouldResolveOnDefaultAndFallbackEndpoints() {
        AgentLlmProperties llm = binder.bind("agent.llm", AgentLlmProperties.class).get();
        AgentRuntimeProperties.Turn turn = binder.bind("agent.runtime.turn", AgentRuntimeProperties.Turn.class).get();
        AgentLlmResolver resolver = new AgentLlmResolver(llm);

        AgentLlmResolver.ResolvedLlm direct = resolver.resolve(null, null);
        AgentLlmResolver.ResolvedLlm fallback = resolver.resolve(turn.getOverloadFallbackEndpoint(), null);

        assertEquals("anthropic", direct.endpointName());
        assertEquals("claude-sonnet-4-20250514", direct.modelName());
        assertEquals("openrouter", fallback.endpointName());
        assertEquals("anthropic/claude-sonnet-4", fallback.modelName());
    }
}
