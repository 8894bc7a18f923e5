package world.willfrog.agentrun.llm;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class AgentChatModelFactory {

    private final AgentLlmResolver llmResolver;

    @Value("${langchain4j.open-ai.api-key:}")
    private String openAiApiKey;

    @Value("${langchain4j.open-ai.timeout-seconds:600}")
    private long timeoutSeconds;

    @Value("${agent.llm.openrouter.http-referer:}")
    private String openRouterHttpReferer;

    @Value("${agent.llm.openrouter.title:}")
    private String openRouterTitle;

    public AgentLlmResolver.ResolvedLlm resolveLlm(String endpointName, String modelName) {
        return llmResolver.resolve(endpointName, modelName);
    }

    public ChatLanguageModel buildChatModel(AgentLlmResolver.ResolvedLlm resolved, Double temperature, Integer maxTokens) {
        boolean debugEnabled = log.isDebugEnabled();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(requireApiKey(resolved))
                .baseUrl(resolved.baseUrl())
                .modelName(resolved.modelName())
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                // 过载由编排层切换路由处理，这里不做隐式重试
                .maxRetries(1)
                .logRequests(debugEnabled)
                .logResponses(debugEnabled);

        Map<String, String> headers = buildCustomHeaders(resolved.baseUrl());
        if (!headers.isEmpty()) {
            builder.customHeaders(headers);
        }
        return builder.build();
    }

    public StreamingChatLanguageModel buildStreamingChatModel(AgentLlmResolver.ResolvedLlm resolved, Double temperature, Integer maxTokens) {
        boolean debugEnabled = log.isDebugEnabled();
        OpenAiStreamingChatModel.OpenAiStreamingChatModelBuilder builder = OpenAiStreamingChatModel.builder()
                .apiKey(requireApiKey(resolved))
                .baseUrl(resolved.baseUrl())
                .modelName(resolved.modelName())
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .logRequests(debugEnabled)
                .logResponses(debugEnabled);

        Map<String, String> headers = buildCustomHeaders(resolved.baseUrl());
        if (!headers.isEmpty()) {
            builder.customHeaders(headers);
        }
        return builder.build();
    }

    private String requireApiKey(AgentLlmResolver.ResolvedLlm resolved) {
        String apiKey = isBlank(resolved.apiKey()) ? openAiApiKey : resolved.apiKey();
        if (isBlank(apiKey)) {
            throw new IllegalArgumentException("LLM api key not configured: endpoint=" + resolved.endpointName());
        }
        return apiKey;
    }

    private Map<String, String> buildCustomHeaders(String baseUrl) {
        if (baseUrl == null || !baseUrl.contains("openrouter.ai")) {
            return Map.of();
        }
        Map<String, String> headers = new HashMap<>();
        if (openRouterHttpReferer != null && !openRouterHttpReferer.isBlank()) {
            headers.put("HTTP-Referer", openRouterHttpReferer);
        }
        if (openRouterTitle != null && !openRouterTitle.isBlank()) {
            headers.put("X-Title", openRouterTitle);
        }
        return headers;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
