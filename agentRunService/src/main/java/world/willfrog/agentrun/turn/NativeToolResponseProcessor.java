package world.willfrog.agentrun.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.entity.AgentThreadMessage;
import world.willfrog.agentrun.llm.LlmMessageConverter;
import world.willfrog.agentrun.llm.LlmResponse;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.FinishReason;
import world.willfrog.agentrun.model.MessageKind;
import world.willfrog.agentrun.model.MessageRole;
import world.willfrog.agentrun.model.ResponseEvent;
import world.willfrog.agentrun.service.AgentThreadMessageService;
import world.willfrog.agentrun.tool.ToolRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * 原生 tool calling 的回复处理器。
 * <p>
 * 处理流程：
 * 1. 流式文本增量逐条转为 Content 事件（非流式时整体一条）；
 * 2. 收到完整回复后落库 assistant 消息（tool_calls 写入元数据）；
 * 3. 逐个执行工具：先发 ToolCall，下一次拉取时再执行并发 ToolResult，工具结果落库为 tool 消息；
 * 4. 最后发 Finish：无工具调用为 stop，有工具调用为 tool-calls，超出单次上限为 tool-call-limit-reached。
 * <p>
 * 全程惰性执行，消费方在事件边界停止时不会继续执行剩余工具。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NativeToolResponseProcessor implements ResponseEventProcessor {

    private final AgentThreadMessageService messageService;
    private final ObjectMapper objectMapper;

    @Override
    public Iterator<ResponseEvent> process(LlmResponse response, TurnContext context) {
        return new ProcessingIterator(response, context);
    }

    private final class ProcessingIterator implements Iterator<ResponseEvent> {

        private final LlmResponse response;
        private final TurnContext context;
        private final Deque<ResponseEvent> pending = new ArrayDeque<>();

        private Iterator<LlmResponse.Delta> deltas;
        private List<ToolExecutionRequest> toolQueue = List.of();
        private int toolIndex;
        private boolean callAnnounced;
        private FinishReason finishReason = FinishReason.STOP;
        private boolean finished;

        private ProcessingIterator(LlmResponse response, TurnContext context) {
            this.response = response;
            this.context = context;
            this.deltas = response.deltas();
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public ResponseEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void advance() {
            if (deltas != null) {
                if (!deltas.hasNext()) {
                    throw new IllegalStateException("LLM response ended without a final message");
                }
                LlmResponse.Delta delta = deltas.next();
                if (delta.isFinal()) {
                    deltas = null;
                    onCompleted(delta.completed());
                } else if (delta.text() != null && !delta.text().isEmpty()) {
                    pending.add(new ResponseEvent.Content(delta.text()));
                }
                return;
            }
            if (toolIndex < toolQueue.size()) {
                ToolExecutionRequest request = toolQueue.get(toolIndex);
                if (!callAnnounced) {
                    callAnnounced = true;
                    pending.add(new ResponseEvent.ToolCall(request.id(), request.name(), request.arguments()));
                    return;
                }
                pending.add(executeTool(request));
                callAnnounced = false;
                toolIndex++;
                return;
            }
            pending.add(new ResponseEvent.Finish(finishReason));
            finished = true;
        }

        private void onCompleted(AiMessage aiMessage) {
            String text = aiMessage.text();
            if (!response.isStreaming() && text != null && !text.isEmpty()) {
                pending.add(new ResponseEvent.Content(text));
            }

            List<ToolExecutionRequest> requests = new ArrayList<>();
            if (aiMessage.hasToolExecutionRequests()) {
                for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                    requests.add(withId(request));
                }
            }
            int limit = context.maxToolCallsPerTurn();
            boolean limited = limit > 0 && requests.size() > limit;
            if (limited) {
                log.info("Tool call limit reached: requested={}, limit={}", requests.size(), limit);
                requests = new ArrayList<>(requests.subList(0, limit));
            }

            persistAssistant(text, requests);
            toolQueue = requests;
            if (limited) {
                finishReason = FinishReason.TOOL_CALL_LIMIT_REACHED;
            } else {
                finishReason = requests.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALLS;
            }
        }

        private ResponseEvent.ToolResult executeTool(ToolExecutionRequest request) {
            ToolRegistry.ToolInvocationResult result = context.tools().invoke(request.name(), request.arguments());
            log.debug("Tool executed: tool={}, success={}, durationMs={}",
                    request.name(), result.isSuccess(), result.getDurationMs());

            Map<String, Object> execution = new LinkedHashMap<>();
            execution.put("function_name", request.name());
            execution.put("arguments", parseArguments(request.arguments()));
            execution.put("result", result.getOutput());
            execution.put("success", result.isSuccess());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(LlmMessageConverter.META_TOOL_CALL_ID, request.id());
            metadata.put(LlmMessageConverter.META_TOOL_NAME, request.name());

            AgentMessage toolMessage = AgentMessage.builder()
                    .role(MessageRole.TOOL)
                    .kind(MessageKind.STRUCTURED)
                    .blocks(List.of(new ContentBlock(ContentBlock.TYPE_TOOL_EXECUTION, execution)))
                    .metadata(metadata)
                    .build();
            messageService.addMessage(context.threadId(), AgentThreadMessage.TYPE_TOOL, toolMessage, true);

            return new ResponseEvent.ToolResult(request.id(), request.name(), result.getOutput(),
                    result.isSuccess(), result.isTerminating());
        }

        private void persistAssistant(String text, List<ToolExecutionRequest> requests) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (!requests.isEmpty()) {
                List<Map<String, Object>> calls = new ArrayList<>();
                for (ToolExecutionRequest request : requests) {
                    Map<String, Object> call = new LinkedHashMap<>();
                    call.put("id", request.id());
                    call.put("name", request.name());
                    call.put("arguments", request.arguments());
                    calls.add(call);
                }
                metadata.put(LlmMessageConverter.META_TOOL_CALLS, calls);
            }
            AgentMessage assistant = AgentMessage.builder()
                    .role(MessageRole.ASSISTANT)
                    .text(text == null ? "" : text)
                    .originatedFromModel(true)
                    .metadata(metadata)
                    .build();
            messageService.addMessage(context.threadId(), AgentThreadMessage.TYPE_ASSISTANT, assistant, true);
        }

        private ToolExecutionRequest withId(ToolExecutionRequest request) {
            if (request.id() != null && !request.id().isBlank()) {
                return request;
            }
            return ToolExecutionRequest.builder()
                    .id("call_" + UUID.randomUUID().toString().replace("-", ""))
                    .name(request.name())
                    .arguments(request.arguments())
                    .build();
        }

        private Object parseArguments(String arguments) {
            if (arguments == null || arguments.isBlank()) {
                return Map.of();
            }
            try {
                return objectMapper.readValue(arguments, Object.class);
            } catch (JsonProcessingException e) {
                return arguments;
            }
        }
    }
}
