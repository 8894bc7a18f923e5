package world.willfrog.agentrun.llm;

import dev.ai4j.openai4j.OpenAiHttpException;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.StreamingResponseHandler;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 基于 langchain4j OpenAI 兼容接口的模型客户端，支持流式与非流式。
 * <p>
 * 供应商错误按状态码归类：529/503 或 "overloaded" 视为过载，429 视为限流。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jLlmClient implements AgentLlmClient {

    private final AgentChatModelFactory chatModelFactory;
    private final LlmMessageConverter messageConverter;

    @Value("${agent.llm.stream-idle-timeout-seconds:300}")
    private long streamIdleTimeoutSeconds;

    @Override
    public LlmResponse call(LlmRequest request) {
        List<ChatMessage> messages = messageConverter.toChatMessages(request.getMessages());
        List<ToolSpecification> tools = request.getTools();
        AgentLlmResolver.ResolvedLlm resolved = chatModelFactory.resolveLlm(request.getEndpointName(), request.getModelName());
        log.debug("LLM call: endpoint={}, model={}, messages={}, tools={}, stream={}",
                resolved.endpointName(), resolved.modelName(), messages.size(), tools.size(), request.isStream());
        try {
            if (request.isStream()) {
                StreamingChatLanguageModel model = chatModelFactory.buildStreamingChatModel(
                        resolved, request.getTemperature(), request.getMaxTokens());
                QueueingHandler handler = new QueueingHandler();
                if (tools.isEmpty()) {
                    model.generate(messages, handler);
                } else {
                    model.generate(messages, tools, handler);
                }
                return LlmResponse.streaming(handler);
            }
            ChatLanguageModel model = chatModelFactory.buildChatModel(resolved, request.getTemperature(), request.getMaxTokens());
            Response<AiMessage> response = tools.isEmpty() ? model.generate(messages) : model.generate(messages, tools);
            return LlmResponse.completed(response.content());
        } catch (RuntimeException e) {
            throw classify(e);
        }
    }

    static RuntimeException classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransientProviderException transientError) {
                return transientError;
            }
            if (current instanceof OpenAiHttpException httpError) {
                int code = httpError.code();
                if (code == 529 || code == 503) {
                    return new TransientProviderException(TransientProviderException.Kind.OVERLOADED,
                            "Provider overloaded: HTTP " + code, error);
                }
                if (code == 429) {
                    return new TransientProviderException(TransientProviderException.Kind.RATE_LIMITED,
                            "Provider rate limited: HTTP 429", error);
                }
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("overloaded")) {
                return new TransientProviderException(TransientProviderException.Kind.OVERLOADED,
                        "Provider overloaded: " + message, error);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("LLM call failed", error);
    }

    /**
     * 把回调式流转换为阻塞迭代器：文本增量、最终回复或错误依次入队。
     */
    private final class QueueingHandler implements StreamingResponseHandler<AiMessage>, Iterator<LlmResponse.Delta> {

        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private Object buffered;
        private boolean finished;

        @Override
        public void onNext(String token) {
            if (token != null && !token.isEmpty()) {
                queue.offer(LlmResponse.Delta.text(token));
            }
        }

        @Override
        public void onComplete(Response<AiMessage> response) {
            queue.offer(LlmResponse.Delta.complete(response.content()));
        }

        @Override
        public void onError(Throwable error) {
            queue.offer(classify(error));
        }

        @Override
        public boolean hasNext() {
            if (finished) {
                return false;
            }
            if (buffered == null) {
                buffered = take();
            }
            return true;
        }

        @Override
        public LlmResponse.Delta next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Object item = buffered;
            buffered = null;
            if (item instanceof RuntimeException error) {
                finished = true;
                throw error;
            }
            LlmResponse.Delta delta = (LlmResponse.Delta) item;
            if (delta.isFinal()) {
                finished = true;
            }
            return delta;
        }

        private Object take() {
            try {
                Object item = queue.poll(streamIdleTimeoutSeconds, TimeUnit.SECONDS);
                if (item == null) {
                    return new IllegalStateException("LLM stream idle for " + streamIdleTimeoutSeconds + "s");
                }
                return item;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new IllegalStateException("Interrupted while waiting for LLM stream", e);
            }
        }
    }
}
