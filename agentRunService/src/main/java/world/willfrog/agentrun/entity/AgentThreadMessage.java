package world.willfrog.agentrun.entity;

import lombok.Data;

import java.time.OffsetDateTime;

/**
 * 线程消息实体。
 * <p>
 * 对应表：agent_thread_message
 * <p>
 * 说明：
 * 1. content 为 jsonb，可以是 JSON 字符串（纯文本）或内容块数组（结构化）
 * 2. is_llm_message = false 的消息（如 browser_state 快照）不进入模型上下文
 */
@Data
public class AgentThreadMessage {

    /** 消息 ID */
    private String messageId;

    /** 所属线程 */
    private String threadId;

    /** 业务类型：user/assistant/tool/browser_state 等 */
    private String type;

    /** 角色：system/user/assistant/tool */
    private String role;

    /** 内容 JSON */
    private String content;

    /** 是否发送给模型 */
    private Boolean llmMessage;

    /** 是否由模型产出 */
    private Boolean fromModel;

    /** 元数据 JSON（tool_call_id、tool_name 等） */
    private String metadata;

    private OffsetDateTime createdAt;

    // ----- 业务常量 -----

    public static final String TYPE_USER = "user";

    public static final String TYPE_ASSISTANT = "assistant";

    public static final String TYPE_TOOL = "tool";

    /** 环境快照，不直接进入上下文，由临时消息引用 */
    public static final String TYPE_BROWSER_STATE = "browser_state";
}
