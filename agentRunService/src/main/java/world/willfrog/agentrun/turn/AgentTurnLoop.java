package world.willfrog.agentrun.turn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentLlmProperties;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.coordinator.RunEventSource;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.MessageRole;
import world.willfrog.agentrun.model.ResponseEvent;
import world.willfrog.agentrun.model.RunInvocation;
import world.willfrog.agentrun.service.AgentPromptService;
import world.willfrog.agentrun.service.AgentThreadMessageService;
import world.willfrog.agentrun.service.ModelFamilyCatalog;
import world.willfrog.agentrun.tool.ToolRegistry;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 一次 run 内的多 turn 循环，作为协调器的事件来源。
 * <p>
 * 每个 turn 开始前检查线程最后一条对话消息，已经是 assistant 回复时结束；
 * 出现错误状态或终止型工具产出结果后，当前 turn 结束即停止。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentTurnLoop implements RunEventSource {

    private final AgentTurnOrchestrator orchestrator;
    private final AgentThreadMessageService messageService;
    private final AgentPromptService promptService;
    private final ModelFamilyCatalog familyCatalog;
    private final ToolRegistry toolRegistry;
    private final List<EphemeralMessageProvider> ephemeralProviders;
    private final AgentLlmProperties llmProperties;
    private final AgentRuntimeProperties runtimeProperties;

    @Override
    public ResponseEventStream open(RunInvocation invocation) {
        if (invocation == null || invocation.getThreadId() == null || invocation.getThreadId().isBlank()) {
            throw new IllegalArgumentException("threadId is required");
        }
        return new LoopStream(invocation);
    }

    private final class LoopStream implements ResponseEventStream {

        private final RunInvocation invocation;
        private final String threadId;
        private final String modelName;
        private final String systemPrompt;
        private final int maxIterations;

        private AgentTurnOrchestrator.TurnEventStream turn;
        private int iterations;
        private boolean stopAfterTurn;
        private boolean done;

        private LoopStream(RunInvocation invocation) {
            this.invocation = invocation;
            this.threadId = invocation.getThreadId();
            this.modelName = invocation.getModelName() == null || invocation.getModelName().isBlank()
                    ? llmProperties.getDefaultModel()
                    : invocation.getModelName();
            this.systemPrompt = promptService.agentRunSystemPrompt();
            this.maxIterations = Math.max(1, runtimeProperties.getTurn().getMaxIterations());
        }

        @Override
        public boolean hasNext() {
            while (!done) {
                if (turn != null) {
                    if (turn.hasNext()) {
                        return true;
                    }
                    turn.close();
                    turn = null;
                    if (stopAfterTurn) {
                        done = true;
                        break;
                    }
                }
                if (!startTurn()) {
                    done = true;
                }
            }
            return false;
        }

        @Override
        public ResponseEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ResponseEvent event = turn.next();
            if (event instanceof ResponseEvent.Status status && status.isError()) {
                stopAfterTurn = true;
            } else if (event instanceof ResponseEvent.ToolResult result && isTerminating(result)) {
                log.info("Terminating tool {} produced a result, run ends after this turn", result.toolName());
                stopAfterTurn = true;
            }
            return event;
        }

        @Override
        public void close() {
            done = true;
            if (turn != null) {
                turn.close();
                turn = null;
            }
        }

        private boolean startTurn() {
            if (iterations >= maxIterations) {
                log.info("Max iterations reached: threadId={}, iterations={}", threadId, iterations);
                return false;
            }
            if (lastConversationalRole() == MessageRole.ASSISTANT) {
                log.debug("Last message is from assistant, run loop ends: threadId={}", threadId);
                return false;
            }
            iterations++;
            ModelFamilyCatalog.FamilyProfile profile = familyCatalog.profileForModel(modelName);
            TurnOptions options = TurnOptions.builder()
                    .modelName(modelName)
                    .endpointName(invocation.getEndpointName())
                    .stream(invocation.getStream())
                    .maxAutoContinues(invocation.getMaxAutoContinues())
                    .enableContextManager(invocation.getEnableContextManager())
                    .ephemeralMessage(ephemeralMessage(profile))
                    .build();
            log.debug("Starting turn {}: threadId={}, model={}", iterations, threadId, modelName);
            turn = orchestrator.runTurn(threadId, systemPrompt, toolRegistry, options);
            return true;
        }

        private MessageRole lastConversationalRole() {
            List<AgentMessage> history = messageService.listLlmMessages(threadId);
            for (int i = history.size() - 1; i >= 0; i--) {
                MessageRole role = history.get(i).getRole();
                if (role == MessageRole.ASSISTANT || role == MessageRole.TOOL || role == MessageRole.USER) {
                    return role;
                }
            }
            return null;
        }

        private AgentMessage ephemeralMessage(ModelFamilyCatalog.FamilyProfile profile) {
            for (EphemeralMessageProvider provider : ephemeralProviders) {
                Optional<AgentMessage> message = provider.build(threadId, profile);
                if (message.isPresent()) {
                    return message.get();
                }
            }
            return null;
        }

        private boolean isTerminating(ResponseEvent.ToolResult result) {
            return result.terminating()
                    || runtimeProperties.getTurn().getTerminatingTools().contains(result.toolName());
        }
    }
}
