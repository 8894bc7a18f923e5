package world.willfrog.agentrun.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.MessageRole;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link AgentMessage} 到 langchain4j {@link ChatMessage} 的转换。
 * <p>
 * 压缩/省略之后 tool_calls 与 tool 结果可能不再成对：没有对应结果的调用会从 assistant 消息中去掉，
 * 没有对应调用的结果降级为普通 user 消息。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmMessageConverter {

    public static final String META_TOOL_CALLS = "tool_calls";
    public static final String META_TOOL_CALL_ID = "tool_call_id";
    public static final String META_TOOL_NAME = "tool_name";

    private final ObjectMapper objectMapper;

    public List<ChatMessage> toChatMessages(List<AgentMessage> messages) {
        Set<String> resultIds = new HashSet<>();
        for (AgentMessage message : messages) {
            if (message.getRole() == MessageRole.TOOL && message.metadataString(META_TOOL_CALL_ID) != null) {
                resultIds.add(message.metadataString(META_TOOL_CALL_ID));
            }
        }

        Set<String> requestedIds = new HashSet<>();
        List<ChatMessage> result = new ArrayList<>(messages.size());
        for (AgentMessage message : messages) {
            switch (message.getRole()) {
                case SYSTEM -> result.add(SystemMessage.from(renderText(message)));
                case USER -> result.add(toUserMessage(message));
                case ASSISTANT -> result.add(toAiMessage(message, resultIds, requestedIds));
                case TOOL -> result.add(toToolMessage(message, requestedIds));
                default -> throw new IllegalStateException("unsupported role: " + message.getRole());
            }
        }
        return result;
    }

    /**
     * 从 assistant 消息元数据中恢复工具调用请求。
     */
    public List<ToolExecutionRequest> toolRequests(AgentMessage message) {
        Object raw = message.metadataValue(META_TOOL_CALLS);
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<ToolExecutionRequest> requests = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> call) {
                requests.add(ToolExecutionRequest.builder()
                        .id(stringOf(call.get("id")))
                        .name(stringOf(call.get("name")))
                        .arguments(stringOf(call.get("arguments")))
                        .build());
            }
        }
        return requests;
    }

    private ChatMessage toUserMessage(AgentMessage message) {
        if (!message.hasBlockOfType(ContentBlock.TYPE_IMAGE_URL)) {
            return UserMessage.from(renderText(message));
        }
        List<Content> contents = new ArrayList<>();
        for (ContentBlock block : message.getBlocks()) {
            if (block.isType(ContentBlock.TYPE_IMAGE_URL)) {
                contents.add(ImageContent.from(stringOf(block.field("url"))));
            } else if (block.isType(ContentBlock.TYPE_TEXT)) {
                contents.add(TextContent.from(stringOf(block.field("text"))));
            } else {
                contents.add(TextContent.from(toJson(block.asMap())));
            }
        }
        return UserMessage.from(contents);
    }

    private ChatMessage toAiMessage(AgentMessage message, Set<String> resultIds, Set<String> requestedIds) {
        String text = renderText(message);
        List<ToolExecutionRequest> kept = new ArrayList<>();
        for (ToolExecutionRequest request : toolRequests(message)) {
            if (request.id() != null && resultIds.contains(request.id())) {
                kept.add(request);
                requestedIds.add(request.id());
            }
        }
        if (kept.isEmpty()) {
            return AiMessage.from(text == null || text.isBlank() ? "(no content)" : text);
        }
        if (text == null || text.isBlank()) {
            return AiMessage.from(kept);
        }
        return AiMessage.from(text, kept);
    }

    private ChatMessage toToolMessage(AgentMessage message, Set<String> requestedIds) {
        String toolCallId = message.metadataString(META_TOOL_CALL_ID);
        String toolName = message.metadataString(META_TOOL_NAME);
        String text = renderText(message);
        if (toolCallId == null || !requestedIds.contains(toolCallId)) {
            log.debug("Tool result without matching call, send as user message: messageId={}", message.getId());
            return UserMessage.from("Tool result" + (toolName == null ? "" : " (" + toolName + ")") + ":\n" + text);
        }
        return ToolExecutionResultMessage.from(toolCallId, toolName, text);
    }

    /**
     * 纯文本原样返回；结构化内容中 text 块直接拼接，其余块（如 tool_execution）以 JSON 输出。
     */
    public String renderText(AgentMessage message) {
        if (!message.isStructured()) {
            return message.getText() == null ? "" : message.getText();
        }
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : message.getBlocks()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            if (block.isType(ContentBlock.TYPE_TEXT)) {
                sb.append(stringOf(block.field("text")));
            } else {
                sb.append(toJson(block.asMap()));
            }
        }
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize content block", e);
        }
    }

    private String stringOf(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
