package world.willfrog.agentrun.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.JsonSchemaProperty;
import dev.langchain4j.agent.tool.ToolSpecification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void invoke_shouldPassParsedArgumentsToTool() {
        ToolRegistry registry = new ToolRegistry(List.of(new UpperTool(false)), objectMapper);

        ToolRegistry.ToolInvocationResult result = registry.invoke("upper", "{\"text\":\"abc\"}");

        assertTrue(result.isSuccess());
        assertEquals("ABC", result.getOutput());
        assertFalse(result.isTerminating());
    }

    @Test
    void invoke_whenToolUnknown_shouldReturnFailure() {
        ToolRegistry registry = new ToolRegistry(List.of(), objectMapper);

        ToolRegistry.ToolInvocationResult result = registry.invoke("missing", "{}");

        assertFalse(result.isSuccess());
        assertEquals("Unsupported tool: missing", result.getOutput());
    }

    @Test
    void invoke_whenArgumentsInvalid_shouldReturnFailureInsteadOfThrowing() {
        ToolRegistry registry = new ToolRegistry(List.of(new UpperTool(true)), objectMapper);

        ToolRegistry.ToolInvocationResult result = registry.invoke("upper", "not json");

        assertFalse(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Tool invocation error: "));
        assertTrue(result.isTerminating());
    }

    @Test
    void constructor_whenNamesCollide_shouldThrow() {
        assertThrows(IllegalStateException.class,
                () -> new ToolRegistry(List.of(new UpperTool(false), new UpperTool(true)), objectMapper));
    }

    @Test
    void specifications_shouldListRegisteredTools() {
        ToolRegistry registry = new ToolRegistry(List.of(new UpperTool(true)), objectMapper);

        assertEquals(1, registry.specifications().size());
        assertTrue(registry.contains("upper"));
        assertTrue(registry.isTerminating("upper"));
        assertFalse(registry.isTerminating("other"));
    }

    private static final class UpperTool implements AgentTool {

        private final boolean terminating;

        private UpperTool(boolean terminating) {
            this.terminating = terminating;
        }

        @Override
        public ToolSpecification specification() {
            return ToolSpecification.builder()
                    .name("upper")
                    .description("Upper-case the given text")
                    .addParameter("text", JsonSchemaProperty.STRING)
                    .build();
        }

        @Override
        public String execute(Map<String, Object> params) {
            return String.valueOf(params.get("text")).toUpperCase();
        }

        @Override
        public boolean terminating() {
            return terminating;
        }
    }
}
