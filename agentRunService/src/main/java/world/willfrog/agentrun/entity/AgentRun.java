package world.willfrog.agentrun.entity;

import lombok.Data;
import world.willfrog.agentrun.model.AgentRunStatus;

import java.time.OffsetDateTime;

/**
 * Agent run 主记录，对应表 agent_run。
 * <p>
 * status 为单调状态机，终态（COMPLETED/FAILED/STOPPED）写入后不再变化。
 */
@Data
public class AgentRun {
    private String id;
    private String threadId;
    private String projectId;
    private AgentRunStatus status;
    private String error;

    // JSON array of ResponseEvent
    private String responses;

    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime updatedAt;
}
