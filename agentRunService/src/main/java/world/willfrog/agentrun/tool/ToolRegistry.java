package world.willfrog.agentrun.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具注册表：工具名 -> schema + 处理器。
 * <p>
 * Spring 容器中的 {@link AgentTool} 会自动注册；调用方也可以自行构造注册表传给编排器。
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<AgentTool> tools, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        if (tools != null) {
            for (AgentTool tool : tools) {
                String name = tool.name();
                if (this.tools.containsKey(name)) {
                    throw new IllegalStateException("Duplicate tool name: " + name);
                }
                this.tools.put(name, tool);
            }
        }
    }

    @Data
    @Builder
    public static class ToolInvocationResult {
        private String output;
        private boolean success;
        private boolean terminating;
        private long durationMs;
    }

    public List<ToolSpecification> specifications() {
        List<ToolSpecification> specifications = new ArrayList<>(tools.size());
        for (AgentTool tool : tools.values()) {
            specifications.add(tool.specification());
        }
        return Collections.unmodifiableList(specifications);
    }

    public boolean contains(String toolName) {
        return toolName != null && tools.containsKey(toolName);
    }

    public boolean isTerminating(String toolName) {
        AgentTool tool = toolName == null ? null : tools.get(toolName);
        return tool != null && tool.terminating();
    }

    public ToolInvocationResult invoke(String toolName, String argumentsJson) {
        long startedAt = System.currentTimeMillis();
        AgentTool tool = toolName == null ? null : tools.get(toolName);
        if (tool == null) {
            return ToolInvocationResult.builder()
                    .output("Unsupported tool: " + toolName)
                    .success(false)
                    .durationMs(0L)
                    .build();
        }
        String output;
        boolean success;
        try {
            output = tool.execute(parseArguments(argumentsJson));
            success = true;
        } catch (Exception e) {
            log.warn("Tool invocation failed: tool={}", toolName, e);
            output = "Tool invocation error: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            success = false;
        }
        return ToolInvocationResult.builder()
                .output(output == null ? "" : output)
                .success(success)
                .terminating(tool.terminating())
                .durationMs(Math.max(0L, System.currentTimeMillis() - startedAt))
                .build();
    }

    private Map<String, Object> parseArguments(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(argumentsJson, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not a JSON object: " + argumentsJson, e);
        }
    }
}
