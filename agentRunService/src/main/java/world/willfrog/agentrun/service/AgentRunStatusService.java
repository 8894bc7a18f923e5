package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.mapper.AgentRunMapper;
import world.willfrog.agentrun.model.AgentRunStatus;

import java.util.List;

/**
 * agent_run 状态持久化。
 * <p>
 * 终态写入带有限次退避重试；run 已是终态时视为成功（重复投递的幂等重放）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunStatusService {

    private final AgentRunMapper agentRunMapper;
    private final AgentRuntimeProperties runtimeProperties;

    @Value("${agent.runtime.coordinator.status-retry-backoff-ms:500}")
    private long retryBackoffMs;

    /**
     * @return run 处于可执行状态并已标记为 RUNNING
     */
    public boolean markRunning(String runId) {
        int updated = agentRunMapper.markRunning(runId);
        if (updated > 0) {
            return true;
        }
        AgentRun run = agentRunMapper.findById(runId);
        if (run == null) {
            log.warn("Run not found when marking running: {}", runId);
        } else {
            log.info("Run already in status {}, skip execution: {}", run.getStatus(), runId);
        }
        return false;
    }

    /**
     * 写入终态、错误信息与 transcript。
     *
     * @param transcript 事件 JSON 列表，为 null 时保留库中原值
     * @return 写入成功或 run 早已是终态
     */
    public boolean persistTerminal(String runId, AgentRunStatus status, String error, List<String> transcript) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        String responses = transcript == null ? null : toJsonArray(transcript);
        int attempts = Math.max(1, runtimeProperties.getCoordinator().getStatusRetryAttempts());
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                int updated = agentRunMapper.updateTerminal(runId, status, error, responses);
                if (updated > 0) {
                    log.info("Run {} persisted as {}", runId, status);
                    return true;
                }
                AgentRun current = agentRunMapper.findById(runId);
                if (current != null && current.getStatus() != null && current.getStatus().isTerminal()) {
                    log.info("Run {} already terminal ({}), skip persisting {}", runId, current.getStatus(), status);
                    return true;
                }
                log.warn("Run {} not updated to {} (attempt {}/{}), row missing", runId, status, attempt + 1, attempts);
            } catch (DataAccessException e) {
                log.warn("Failed to persist run {} as {} (attempt {}/{})", runId, status, attempt + 1, attempts, e);
            }
            if (attempt + 1 < attempts && !backoff(attempt)) {
                break;
            }
        }
        log.error("Giving up persisting run {} as {} after {} attempts", runId, status, attempts);
        return false;
    }

    private boolean backoff(int attempt) {
        long delay = retryBackoffMs * (1L << attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry status persistence");
            return false;
        }
    }

    // transcript 中每一项本身就是 JSON 对象
    static String toJsonArray(List<String> transcript) {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < transcript.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(transcript.get(i));
        }
        return builder.append(']').toString();
    }
}
