package world.willfrog.agentrun.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.coordinator.AgentRunCoordinator;
import world.willfrog.agentrun.coordinator.RunOutcome;
import world.willfrog.agentrun.model.RunInvocation;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 消费 run 调用消息并交给协调器执行。
 * <p>
 * 消息交给执行线程池后即确认；线程池满时 nack，由 Kafka 延迟重投。
 * 重复投递由协调器的锁与状态检查吸收。
 */
@Service
@Slf4j
public class AgentRunInvocationListener {

    public static final String AGENT_RUN_INVOCATION_TOPIC = "agent_run_invocation";

    private final AgentRunCoordinator coordinator;
    private final ObjectMapper objectMapper;
    private final ExecutorService agentRunExecutor;
    private final Duration redeliveryDelay;

    public AgentRunInvocationListener(AgentRunCoordinator coordinator,
                                      ObjectMapper objectMapper,
                                      @Qualifier("agentRunExecutor") ExecutorService agentRunExecutor,
                                      @Value("${agent.runtime.coordinator.redelivery-delay:5s}") Duration redeliveryDelay) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
        this.agentRunExecutor = agentRunExecutor;
        this.redeliveryDelay = redeliveryDelay;
    }

    @KafkaListener(topics = AGENT_RUN_INVOCATION_TOPIC, groupId = "${agent.runtime.coordinator.consumer-group:agent-run-service}")
    public void listenRunInvocation(String message, Acknowledgment acknowledgment) {
        boolean redeliver = false;
        try {
            RunInvocation invocation = objectMapper.readValue(message, RunInvocation.class);
            if (invocation.getRunId() == null || invocation.getRunId().isBlank()
                    || invocation.getThreadId() == null || invocation.getThreadId().isBlank()) {
                log.warn("Ignore run invocation without run_id/thread_id: {}", message);
                return;
            }
            agentRunExecutor.execute(() -> runSafely(invocation));
        } catch (RejectedExecutionException e) {
            // 线程池已满：不确认，稍后由 Kafka 重新投递
            log.warn("Run executor saturated, redeliver invocation in {}: {}", redeliveryDelay, message);
            redeliver = true;
        } catch (JsonProcessingException e) {
            log.warn("Ignore malformed run invocation: {}", message, e);
        } catch (Exception e) {
            log.error("Failed to dispatch run invocation: {}", message, e);
        } finally {
            if (acknowledgment != null) {
                if (redeliver) {
                    acknowledgment.nack(redeliveryDelay);
                } else {
                    acknowledgment.acknowledge();
                }
            }
        }
    }

    private void runSafely(RunInvocation invocation) {
        try {
            RunOutcome outcome = coordinator.execute(invocation);
            log.debug("Run invocation handled: runId={}, result={}, status={}",
                    outcome.runId(), outcome.result(), outcome.status());
        } catch (Exception e) {
            log.error("Run invocation failed: runId={}", invocation.getRunId(), e);
        }
    }
}
