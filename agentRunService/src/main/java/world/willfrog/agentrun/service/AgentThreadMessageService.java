package world.willfrog.agentrun.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.entity.AgentThreadMessage;
import world.willfrog.agentrun.mapper.AgentThreadMessageMapper;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.MessageKind;
import world.willfrog.agentrun.model.MessageRole;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 线程消息服务。
 * <p>
 * 职责：
 * 1. 分批读取线程中需要发送给模型的历史消息
 * 2. 在实体（jsonb 字符串）与不可变的 {@link AgentMessage} 之间转换
 * 3. 落库模型回复与工具结果
 * 4. 读取非上下文消息（如 browser_state 快照）
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentThreadMessageService {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final AgentThreadMessageMapper messageMapper;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeProperties runtimeProperties;

    /**
     * 读取线程全部 LLM 可见消息，按创建时间升序。
     *
     * @param threadId 线程 ID
     * @return 消息列表
     */
    public List<AgentMessage> listLlmMessages(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            return List.of();
        }
        int batchSize = Math.max(1, runtimeProperties.getTurn().getHistoryBatchSize());
        List<AgentMessage> messages = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<AgentThreadMessage> batch = messageMapper.listLlmMessages(threadId, batchSize, offset);
            if (batch == null || batch.isEmpty()) {
                break;
            }
            for (AgentThreadMessage entity : batch) {
                messages.add(toMessage(entity));
            }
            if (batch.size() < batchSize) {
                break;
            }
            offset += batchSize;
        }
        return messages;
    }

    public Optional<AgentMessage> findMessage(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return Optional.empty();
        }
        AgentThreadMessage entity = messageMapper.findById(messageId.trim());
        return entity == null ? Optional.empty() : Optional.of(toMessage(entity));
    }

    /**
     * 读取某类型最新一条消息的 JSON 内容（对象形式）。
     */
    public Optional<Map<String, Object>> findLatestPayload(String threadId, String type) {
        if (threadId == null || threadId.isBlank()) {
            return Optional.empty();
        }
        AgentThreadMessage entity = messageMapper.findLatestByType(threadId, type);
        if (entity == null || entity.getContent() == null || entity.getContent().isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(entity.getContent());
            if (node.isTextual()) {
                // 兼容内容被二次编码为 JSON 字符串的情况
                node = objectMapper.readTree(node.asText());
            }
            if (!node.isObject()) {
                log.warn("Latest {} message is not a JSON object: messageId={}", type, entity.getMessageId());
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse latest {} message: messageId={}", type, entity.getMessageId(), e);
            return Optional.empty();
        }
    }

    /**
     * 追加一条消息并返回带 ID 与创建时间的副本。
     *
     * @param threadId   线程 ID
     * @param type       业务类型
     * @param message    待写入消息
     * @param llmMessage 是否进入模型上下文
     * @return 已持久化的消息
     */
    public AgentMessage addMessage(String threadId, String type, AgentMessage message, boolean llmMessage) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is blank");
        }
        String messageId = message.getId() == null || message.getId().isBlank()
                ? UUID.randomUUID().toString()
                : message.getId();
        OffsetDateTime createdAt = message.getCreatedAt() == null ? OffsetDateTime.now() : message.getCreatedAt();

        AgentThreadMessage entity = new AgentThreadMessage();
        entity.setMessageId(messageId);
        entity.setThreadId(threadId);
        entity.setType(type);
        entity.setRole(message.getRole().code());
        entity.setContent(writeContent(message));
        entity.setLlmMessage(llmMessage);
        entity.setFromModel(message.isOriginatedFromModel());
        entity.setMetadata(writeJson(message.getMetadata() == null ? Map.of() : message.getMetadata()));
        entity.setCreatedAt(createdAt);
        messageMapper.insert(entity);

        return message.toBuilder().id(messageId).createdAt(createdAt).build();
    }

    AgentMessage toMessage(AgentThreadMessage entity) {
        AgentMessage.AgentMessageBuilder builder = AgentMessage.builder()
                .id(entity.getMessageId())
                .role(MessageRole.fromCode(entity.getRole()))
                .originatedFromModel(Boolean.TRUE.equals(entity.getFromModel()))
                .metadata(readMetadata(entity))
                .createdAt(entity.getCreatedAt());
        JsonNode content = readTree(entity.getContent(), entity.getMessageId());
        if (content == null || content.isNull()) {
            return builder.kind(MessageKind.TEXT).text("").build();
        }
        if (content.isTextual()) {
            return builder.kind(MessageKind.TEXT).text(content.asText()).build();
        }
        if (content.isArray()) {
            List<ContentBlock> blocks = new ArrayList<>();
            for (JsonNode node : content) {
                blocks.add(toBlock(node));
            }
            return builder.kind(MessageKind.STRUCTURED).blocks(Collections.unmodifiableList(blocks)).build();
        }
        return builder.kind(MessageKind.TEXT).text(content.toString()).build();
    }

    private ContentBlock toBlock(JsonNode node) {
        if (!node.isObject()) {
            return ContentBlock.text(node.isTextual() ? node.asText() : node.toString());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!"type".equals(entry.getKey())) {
                fields.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
            }
        }
        String type = node.path("type").asText(ContentBlock.TYPE_TEXT);
        return new ContentBlock(type, fields);
    }

    private Map<String, Object> readMetadata(AgentThreadMessage entity) {
        JsonNode node = readTree(entity.getMetadata(), entity.getMessageId());
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(objectMapper.convertValue(node, MAP_TYPE));
    }

    private JsonNode readTree(String json, String messageId) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Message content is not valid JSON, treat as text: messageId={}", messageId);
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    private String writeContent(AgentMessage message) {
        if (!message.isStructured()) {
            return writeJson(message.getText() == null ? "" : message.getText());
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (ContentBlock block : message.getBlocks()) {
            blocks.add(block.asMap());
        }
        return writeJson(blocks);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message payload", e);
        }
    }
}
