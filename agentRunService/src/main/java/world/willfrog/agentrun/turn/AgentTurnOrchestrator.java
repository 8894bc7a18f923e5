package world.willfrog.agentrun.turn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.llm.AgentLlmClient;
import world.willfrog.agentrun.llm.LlmRequest;
import world.willfrog.agentrun.llm.LlmResponse;
import world.willfrog.agentrun.llm.TransientProviderException;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContextBudget;
import world.willfrog.agentrun.model.FinishReason;
import world.willfrog.agentrun.model.MessageRole;
import world.willfrog.agentrun.model.ResponseEvent;
import world.willfrog.agentrun.service.AgentContextCompressor;
import world.willfrog.agentrun.service.AgentThreadMessageService;
import world.willfrog.agentrun.service.ModelFamilyCatalog;
import world.willfrog.agentrun.tool.ToolRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 单个 turn 的编排器。
 * <p>
 * 每次子迭代：读取线程历史 → 注入临时消息（仅第一次）→ 压缩上下文 → 调用模型 → 交给回复处理器产出事件。
 * <p>
 * 自动续写状态机 {@code RUNNING → CONTINUING / STOPPED / ERRORED}：
 * <ul>
 *   <li>Finish(tool-calls)：吞掉 Finish，计数 +1，计数未达预算时不带临时消息重新进入子迭代；</li>
 *   <li>Finish(tool-call-limit-reached)：转发并停止；</li>
 *   <li>供应商过载：切换到备用路由重试同一子迭代，不消耗续写预算，超过上限后以独立错误码结束；</li>
 *   <li>计数达到预算：发出一条提示内容后停止，预算 N 最多调用模型 N 次；</li>
 *   <li>其他异常：发出 error 状态事件并结束。</li>
 * </ul>
 * 续写预算为 0 时关闭自动续写，只执行一次子迭代并转发所有事件。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentTurnOrchestrator {

    public static final String OVERLOADED_ERROR_CODE = "provider_overloaded";

    private final AgentThreadMessageService messageService;
    private final AgentContextCompressor contextCompressor;
    private final ModelFamilyCatalog familyCatalog;
    private final AgentLlmClient llmClient;
    private final ResponseEventProcessor responseProcessor;
    private final AgentRuntimeProperties runtimeProperties;

    public TurnEventStream runTurn(String threadId, String systemPrompt, ToolRegistry tools, TurnOptions options) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is blank");
        }
        return new TurnEventStream(threadId, systemPrompt, tools, options == null ? TurnOptions.builder().build() : options);
    }

    static String limitReachedMessage(int maxAutoContinues) {
        return "\n[Agent reached maximum auto-continue limit of " + maxAutoContinues + "]";
    }

    public final class TurnEventStream implements ResponseEventStream {

        private final String threadId;
        private final String systemPrompt;
        private final ToolRegistry tools;
        private final TurnOptions options;
        private final int maxAutoContinues;
        private final int maxOverloadRetries;
        private final Deque<ResponseEvent> pending = new ArrayDeque<>();

        private TurnState state = TurnState.RUNNING;
        private Iterator<ResponseEvent> current;
        private String endpointName;
        private boolean ephemeralConsumed;
        private int continueCount;
        private int overloadRetries;
        private int llmCalls;
        private FinishReason lastFinish;
        private boolean errorSeen;

        private TurnEventStream(String threadId, String systemPrompt, ToolRegistry tools, TurnOptions options) {
            AgentRuntimeProperties.Turn turnConfig = runtimeProperties.getTurn();
            this.threadId = threadId;
            this.systemPrompt = systemPrompt;
            this.tools = tools;
            this.options = options;
            this.endpointName = options.getEndpointName();
            this.maxAutoContinues = Math.max(0, options.getMaxAutoContinues() == null
                    ? turnConfig.getMaxAutoContinues()
                    : options.getMaxAutoContinues());
            this.maxOverloadRetries = Math.max(0, turnConfig.getMaxOverloadRetries());
        }

        @Override
        public boolean hasNext() {
            while (true) {
                if (!pending.isEmpty()) {
                    return true;
                }
                if (state.isTerminal()) {
                    return false;
                }
                if (current == null) {
                    startSubIteration();
                    continue;
                }
                try {
                    if (current.hasNext()) {
                        accept(current.next());
                        continue;
                    }
                } catch (TransientProviderException e) {
                    onProviderError(e);
                    continue;
                } catch (RuntimeException e) {
                    fail(e);
                    continue;
                }
                current = null;
                finishSubIteration();
            }
        }

        @Override
        public ResponseEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        @Override
        public void close() {
            if (!state.isTerminal()) {
                log.debug("Turn stream closed early: threadId={}, state={}", threadId, state);
                state = TurnState.STOPPED;
            }
            current = null;
            pending.clear();
        }

        public TurnState getState() {
            return state;
        }

        public int getContinueCount() {
            return continueCount;
        }

        public int getLlmCalls() {
            return llmCalls;
        }

        private void startSubIteration() {
            try {
                String modelName = options.getModelName();
                ModelFamilyCatalog.FamilyProfile profile = familyCatalog.profileForModel(modelName);
                ContextBudget budget = familyCatalog.budgetForModel(modelName);

                List<AgentMessage> prompt = new ArrayList<>();
                if (systemPrompt != null && !systemPrompt.isBlank()) {
                    prompt.add(AgentMessage.system(systemPrompt));
                }
                List<AgentMessage> history = messageService.listLlmMessages(threadId);
                if (!ephemeralConsumed && options.getEphemeralMessage() != null) {
                    history = spliceEphemeral(history, options.getEphemeralMessage());
                }
                prompt.addAll(history);

                boolean contextManager = !Boolean.FALSE.equals(options.getEnableContextManager());
                List<AgentMessage> bounded = contextCompressor.compress(prompt, budget, contextManager);

                LlmRequest request = LlmRequest.builder()
                        .messages(bounded)
                        .tools(tools == null ? List.of() : tools.specifications())
                        .endpointName(endpointName)
                        .modelName(modelName)
                        .temperature(options.getTemperature() == null
                                ? runtimeProperties.getTurn().getTemperature()
                                : options.getTemperature())
                        .maxTokens(options.getMaxTokens() == null ? profile.maxOutputTokens() : options.getMaxTokens())
                        .stream(options.getStream() == null ? runtimeProperties.getTurn().isStream() : options.getStream())
                        .build();

                llmCalls++;
                LlmResponse response = llmClient.call(request);
                int maxToolCalls = options.getMaxToolCallsPerTurn() == null
                        ? runtimeProperties.getTurn().getMaxToolCallsPerTurn()
                        : options.getMaxToolCallsPerTurn();
                current = responseProcessor.process(response, new TurnContext(threadId, tools, maxToolCalls));
                lastFinish = null;
            } catch (TransientProviderException e) {
                onProviderError(e);
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        private void accept(ResponseEvent event) {
            if (event instanceof ResponseEvent.Finish finish) {
                lastFinish = finish.finishReason();
                if (lastFinish == FinishReason.TOOL_CALLS && maxAutoContinues > 0) {
                    // 是否续写在子迭代结束时决定，这里只吞掉事件
                    return;
                }
                pending.add(event);
                return;
            }
            if (event instanceof ResponseEvent.Status status && status.isError()) {
                errorSeen = true;
            }
            pending.add(event);
        }

        private void finishSubIteration() {
            ephemeralConsumed = true;
            overloadRetries = 0;
            if (errorSeen || lastFinish != FinishReason.TOOL_CALLS || maxAutoContinues == 0) {
                state = TurnState.STOPPED;
                return;
            }
            // 每个被吞掉的 tool-calls finish 都计入预算，计满后不再发起新的模型调用
            continueCount++;
            if (continueCount < maxAutoContinues) {
                state = TurnState.CONTINUING;
                log.debug("Auto-continue {}/{}: threadId={}", continueCount, maxAutoContinues, threadId);
                return;
            }
            log.info("Auto-continue limit reached: threadId={}, limit={}", threadId, maxAutoContinues);
            pending.add(new ResponseEvent.Content(limitReachedMessage(maxAutoContinues)));
            state = TurnState.STOPPED;
        }

        private void onProviderError(TransientProviderException e) {
            current = null;
            if (!e.isOverloaded()) {
                fail(e);
                return;
            }
            if (overloadRetries >= maxOverloadRetries) {
                log.error("Provider still overloaded after {} fallback retries: threadId={}", overloadRetries, threadId, e);
                pending.add(ResponseEvent.Status.error(
                        "Provider overloaded after " + overloadRetries + " fallback retries: " + e.getMessage(),
                        OVERLOADED_ERROR_CODE));
                state = TurnState.ERRORED;
                return;
            }
            overloadRetries++;
            String fallback = runtimeProperties.getTurn().getOverloadFallbackEndpoint();
            if (fallback != null && !fallback.isBlank()) {
                endpointName = fallback.trim();
            }
            log.warn("Provider overloaded, retry {}/{} via endpoint={}: threadId={}",
                    overloadRetries, maxOverloadRetries, endpointName, threadId);
        }

        private void fail(RuntimeException e) {
            log.error("Turn failed: threadId={}", threadId, e);
            current = null;
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            pending.add(ResponseEvent.Status.error(message));
            state = TurnState.ERRORED;
        }
    }

    /**
     * 临时消息插在最后一条 user 消息之前；没有 user 消息时追加到末尾。
     */
    static List<AgentMessage> spliceEphemeral(List<AgentMessage> history, AgentMessage ephemeral) {
        List<AgentMessage> result = new ArrayList<>(history);
        for (int i = result.size() - 1; i >= 0; i--) {
            if (result.get(i).getRole() == MessageRole.USER) {
                result.add(i, ephemeral);
                return result;
            }
        }
        result.add(ephemeral);
        return result;
    }
}
