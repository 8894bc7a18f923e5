package world.willfrog.agentrun.llm;

import dev.langchain4j.agent.tool.ToolSpecification;
import lombok.Builder;
import lombok.Value;
import world.willfrog.agentrun.model.AgentMessage;

import java.util.Collections;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class LlmRequest {
    @Builder.Default
    List<AgentMessage> messages = Collections.emptyList();
    @Builder.Default
    List<ToolSpecification> tools = Collections.emptyList();
    /** 路由目标（endpoint 名），过载时会被替换为备用路由。 */
    String endpointName;
    String modelName;
    Double temperature;
    Integer maxTokens;
    boolean stream;
}
