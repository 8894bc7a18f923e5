package world.willfrog.agentrun.model;

/**
 * 消息内容形态：纯文本，或由有序 {@link ContentBlock} 组成的结构化内容。
 */
public enum MessageKind {
    TEXT,
    STRUCTURED
}
