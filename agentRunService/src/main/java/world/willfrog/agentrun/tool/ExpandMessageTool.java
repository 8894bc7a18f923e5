package world.willfrog.agentrun.tool;

import dev.langchain4j.agent.tool.JsonSchemaProperty;
import dev.langchain4j.agent.tool.ToolSpecification;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.llm.LlmMessageConverter;
import world.willfrog.agentrun.service.AgentThreadMessageService;

import java.util.Map;

/**
 * 取回被上下文压缩截断的消息全文。压缩摘要中带有 message_id 与本工具的提示。
 */
@Component
@RequiredArgsConstructor
public class ExpandMessageTool implements AgentTool {

    public static final String NAME = "expand_message";

    private final AgentThreadMessageService messageService;
    private final LlmMessageConverter messageConverter;

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(NAME)
                .description("Expand a message that was truncated in the conversation history and return its full content.")
                .addParameter("message_id", JsonSchemaProperty.STRING,
                        JsonSchemaProperty.description("The message_id shown in the truncated message"))
                .build();
    }

    @Override
    public String execute(Map<String, Object> params) {
        Object raw = params == null ? null : params.get("message_id");
        String messageId = raw == null ? "" : String.valueOf(raw).trim();
        if (messageId.isEmpty()) {
            throw new IllegalArgumentException("message_id is required");
        }
        return messageService.findMessage(messageId)
                .map(messageConverter::renderText)
                .orElseThrow(() -> new IllegalArgumentException("Message not found: " + messageId));
    }
}
