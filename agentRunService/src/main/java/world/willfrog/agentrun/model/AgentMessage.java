package world.willfrog.agentrun.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 线程中的一条对话消息（不可变）。
 * <p>
 * 持久化后不再修改；上下文压缩只产生展示用副本（通过 {@code toBuilder()}）。
 * 内容二选一：{@link MessageKind#TEXT} 时读 {@link #text}，{@link MessageKind#STRUCTURED} 时读 {@link #blocks}。
 */
@Value
@Builder(toBuilder = true)
public class AgentMessage {

    String id;
    MessageRole role;
    @Builder.Default
    MessageKind kind = MessageKind.TEXT;
    String text;
    @Builder.Default
    List<ContentBlock> blocks = Collections.emptyList();
    boolean originatedFromModel;
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();
    OffsetDateTime createdAt;

    public static AgentMessage system(String text) {
        return AgentMessage.builder().role(MessageRole.SYSTEM).text(text).build();
    }

    public static AgentMessage user(String id, String text) {
        return AgentMessage.builder().id(id).role(MessageRole.USER).text(text).build();
    }

    public boolean isStructured() {
        return kind == MessageKind.STRUCTURED;
    }

    public boolean hasBlockOfType(String type) {
        if (!isStructured() || blocks == null) {
            return false;
        }
        for (ContentBlock block : blocks) {
            if (block.isType(type)) {
                return true;
            }
        }
        return false;
    }

    public Object metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }

    public String metadataString(String key) {
        Object value = metadataValue(key);
        return value == null ? null : String.valueOf(value);
    }
}
