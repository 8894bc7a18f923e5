package world.willfrog.agentrun.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.model.AgentMessage;
import world.willfrog.agentrun.model.ContentBlock;
import world.willfrog.agentrun.model.ContextBudget;
import world.willfrog.agentrun.model.MessageKind;
import world.willfrog.agentrun.model.MessageRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Agent 上下文压缩服务。
 * <p>
 * 职责：
 * 1. 始终剥离工具调用参数等大字段，替换为轻量引用
 * 2. 超出预算时按角色（tool → user → assistant）压缩：每个角色最新的一条只做首尾安全截断，
 *    更早的超阈值消息替换为截断摘要 + message_id，可通过 expand_message 工具取回原文
 * 3. 单条阈值逐轮减半，最多 {@code maxRounds} 轮
 * 4. 仍超预算时分批省略中间消息，保留 system 消息与最少消息数
 * 5. 最后按条数做 middle-out 截断
 * <p>
 * 纯函数：不做 I/O，不修改入参，结果对同一输入稳定；对压缩结果再次压缩不会产生变化。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentContextCompressor {

    static final String MIDDLE_TRUNCATED_MARKER = "\n\n... (middle truncated) ...\n\n";
    static final String TOO_LONG_NOTICE =
            "\n\nThis message is too long, repeat relevant information in your response to remember it";
    static final String TRUNCATED_SUFFIX = "... (truncated)";
    static final String META_COMPRESSED = "compressed";
    static final String ARGUMENTS_FIELD = "arguments";
    static final String ARGUMENTS_REF_FIELD = "arguments_ref";

    /** 安全截断时为标记文本预留的字符数。 */
    private static final int TRUNCATION_RESERVE_CHARS = 150;

    private final ObjectMapper objectMapper;
    private final AgentRuntimeProperties runtimeProperties;

    /**
     * 压缩统计。
     *
     * @param tokensBefore   剥离参数后的估算 token
     * @param tokensAfter    压缩后的估算 token
     * @param messagesBefore 输入消息数
     * @param messagesAfter  输出消息数
     * @param rounds         执行的阈值轮数
     * @param omitted        被省略的消息数（含 middle-out）
     */
    public record CompressionStats(int tokensBefore,
                                   int tokensAfter,
                                   int messagesBefore,
                                   int messagesAfter,
                                   int rounds,
                                   int omitted) {
    }

    public record CompressionResult(List<AgentMessage> messages, CompressionStats stats) {
    }

    public List<AgentMessage> compress(List<AgentMessage> messages, ContextBudget budget) {
        return compressWithStats(messages, budget, true).messages();
    }

    /**
     * @param roleCompression 为 false 时只剥离参数并按条数截断，不做角色压缩和省略
     */
    public List<AgentMessage> compress(List<AgentMessage> messages, ContextBudget budget, boolean roleCompression) {
        return compressWithStats(messages, budget, roleCompression).messages();
    }

    public CompressionResult compressWithStats(List<AgentMessage> messages, ContextBudget budget) {
        return compressWithStats(messages, budget, true);
    }

    public CompressionResult compressWithStats(List<AgentMessage> messages, ContextBudget budget, boolean roleCompression) {
        if (messages == null || messages.isEmpty()) {
            return new CompressionResult(List.of(), new CompressionStats(0, 0, 0, 0, 0, 0));
        }
        Objects.requireNonNull(budget, "budget");
        AgentRuntimeProperties.Context config = runtimeProperties.getContext();
        TokenCounter counter = new TokenCounter(budget);

        List<AgentMessage> stripped = stripMetadata(messages);
        int tokensBefore = counter.total(stripped);
        List<AgentMessage> result = stripped;
        int total = tokensBefore;
        int rounds = 0;

        if (roleCompression && config.isEnabled()) {
            int threshold = Math.max(1, config.getInitialMessageThreshold());
            int maxRounds = Math.max(1, config.getMaxRounds());
            while (rounds < maxRounds) {
                rounds++;
                // 每一轮都从剥离后的输入重新开始，只是阈值更小
                result = compressByRole(stripped, budget, threshold, counter);
                total = counter.total(result);
                if (total <= budget.maxTokens()) {
                    break;
                }
                log.debug("Context over budget after round {}: {} > {}, threshold={}",
                        rounds, total, budget.maxTokens(), threshold);
                threshold = Math.max(1, threshold / 2);
            }
            if (total > budget.maxTokens()) {
                log.warn("Context still over budget after {} rounds ({} > {}), omitting messages",
                        rounds, total, budget.maxTokens());
                result = omitMessages(result, budget, counter);
                total = counter.total(result);
            }
        }

        result = middleOut(result, config.getMaxMessages());
        total = counter.total(result);

        CompressionStats stats = new CompressionStats(tokensBefore, total, messages.size(), result.size(),
                rounds, messages.size() - result.size());
        if (tokensBefore != total || messages.size() != result.size()) {
            log.info("Context compressed: tokens {} -> {}, messages {} -> {}, rounds={}, family={}",
                    tokensBefore, total, messages.size(), result.size(), rounds, budget.family());
        }
        return new CompressionResult(Collections.unmodifiableList(result), stats);
    }

    /**
     * 去掉 tool_execution 块里的原始参数，换成指向消息本身的引用。总是执行。
     */
    public List<AgentMessage> stripMetadata(List<AgentMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<AgentMessage> result = new ArrayList<>(messages.size());
        for (AgentMessage message : messages) {
            result.add(stripMessage(message));
        }
        return result;
    }

    public int estimateTokens(List<AgentMessage> messages, ContextBudget budget) {
        return new TokenCounter(budget).total(messages == null ? List.of() : messages);
    }

    private AgentMessage stripMessage(AgentMessage message) {
        if (!message.isStructured() || message.getBlocks() == null) {
            return message;
        }
        boolean changed = false;
        List<ContentBlock> blocks = new ArrayList<>(message.getBlocks().size());
        for (ContentBlock block : message.getBlocks()) {
            if (block.isType(ContentBlock.TYPE_TOOL_EXECUTION) && block.getFields().containsKey(ARGUMENTS_FIELD)) {
                String ref = message.getId() == null ? "omitted" : message.getId();
                blocks.add(block.replaceField(ARGUMENTS_FIELD, ARGUMENTS_REF_FIELD, ref));
                changed = true;
            } else {
                blocks.add(block);
            }
        }
        return changed ? message.toBuilder().blocks(Collections.unmodifiableList(blocks)).build() : message;
    }

    private List<AgentMessage> compressByRole(List<AgentMessage> messages,
                                              ContextBudget budget,
                                              int threshold,
                                              TokenCounter counter) {
        List<AgentMessage> working = new ArrayList<>(messages);
        compressRole(working, budget, threshold, counter, this::isToolResult);
        compressRole(working, budget, threshold, counter,
                m -> m.getRole() == MessageRole.USER && !isToolResult(m));
        compressRole(working, budget, threshold, counter,
                m -> m.getRole() == MessageRole.ASSISTANT && !isToolResult(m));
        return working;
    }

    private void compressRole(List<AgentMessage> working,
                              ContextBudget budget,
                              int threshold,
                              TokenCounter counter,
                              Predicate<AgentMessage> selector) {
        if (counter.total(working) <= budget.maxTokens()) {
            return;
        }
        int ceiling = safeTruncateCeiling(budget);
        boolean newestSeen = false;
        for (int i = working.size() - 1; i >= 0; i--) {
            AgentMessage message = working.get(i);
            if (!selector.test(message)) {
                continue;
            }
            if (!newestSeen) {
                newestSeen = true;
                working.set(i, safeTruncate(message, ceiling));
                continue;
            }
            if (isCompressed(message) || counter.tokens(message) <= threshold) {
                continue;
            }
            if (message.getId() == null || message.getId().isBlank()) {
                log.warn("Message has no id, cannot be summarized: role={}", message.getRole());
                continue;
            }
            working.set(i, summarize(message, threshold * 3));
        }
    }

    int safeTruncateCeiling(ContextBudget budget) {
        long doubled = (long) budget.maxTokens() * 2;
        return (int) Math.min(doubled, runtimeProperties.getContext().getSafeTruncateMaxChars());
    }

    /**
     * 超过 ceiling 字符时保留首尾、中间插入标记；结果长度不超过 ceiling。
     * ceiling 放不下标记文本时直接截取前 ceiling 个字符。
     */
    private AgentMessage safeTruncate(AgentMessage message, int ceiling) {
        String text = render(message);
        if (text.length() <= ceiling) {
            return message;
        }
        int keep = Math.max(0, ceiling - TRUNCATION_RESERVE_CHARS);
        int head = keep / 2;
        int tail = keep - head;
        String truncated = text.substring(0, head)
                + MIDDLE_TRUNCATED_MARKER
                + text.substring(text.length() - tail)
                + TOO_LONG_NOTICE;
        if (truncated.length() > ceiling) {
            truncated = text.substring(0, Math.max(0, ceiling));
        }
        return message.toBuilder()
                .kind(MessageKind.TEXT)
                .text(truncated)
                .blocks(Collections.emptyList())
                .build();
    }

    private AgentMessage summarize(AgentMessage message, int maxChars) {
        String text = render(message);
        if (text.length() <= maxChars) {
            return message;
        }
        String summary = text.substring(0, maxChars)
                + TRUNCATED_SUFFIX
                + "\n\nmessage_id \"" + message.getId() + "\"\nUse expand_message tool to see contents";
        Map<String, Object> metadata = new LinkedHashMap<>(message.getMetadata() == null ? Map.of() : message.getMetadata());
        metadata.put(META_COMPRESSED, Boolean.TRUE);
        return message.toBuilder()
                .kind(MessageKind.TEXT)
                .text(summary)
                .blocks(Collections.emptyList())
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }

    private List<AgentMessage> omitMessages(List<AgentMessage> messages, ContextBudget budget, TokenCounter counter) {
        AgentRuntimeProperties.Context config = runtimeProperties.getContext();
        int batchSize = Math.max(1, config.getOmissionBatchSize());
        int floor = Math.max(0, config.getMinMessagesToKeep());
        int safetyLimit = config.getOmissionSafetyLimit();

        AgentMessage system = messages.get(0).getRole() == MessageRole.SYSTEM ? messages.get(0) : null;
        List<AgentMessage> conversation = new ArrayList<>(system == null ? messages : messages.subList(1, messages.size()));

        int total = counter.total(messages);
        while (total > budget.maxTokens() && safetyLimit-- > 0) {
            if (conversation.size() <= floor) {
                log.warn("Cannot omit further: {} messages remain (min {})", conversation.size(), floor);
                break;
            }
            int removable = conversation.size() - floor;
            if (conversation.size() > batchSize * 2) {
                int count = Math.min(batchSize, removable);
                int start = conversation.size() / 2 - batchSize / 2;
                conversation.subList(start, start + count).clear();
            } else {
                int count = Math.min(Math.min(batchSize, conversation.size() / 2), removable);
                if (count <= 0) {
                    break;
                }
                conversation.subList(0, count).clear();
            }
            total = counter.total(assemble(system, conversation));
        }
        return assemble(system, conversation);
    }

    private List<AgentMessage> middleOut(List<AgentMessage> messages, int maxMessages) {
        if (maxMessages <= 0 || messages.size() <= maxMessages) {
            return messages;
        }
        int head = maxMessages / 2;
        int tail = maxMessages - head;
        List<AgentMessage> result = new ArrayList<>(maxMessages);
        result.addAll(messages.subList(0, head));
        result.addAll(messages.subList(messages.size() - tail, messages.size()));
        return result;
    }

    private List<AgentMessage> assemble(AgentMessage system, List<AgentMessage> conversation) {
        List<AgentMessage> result = new ArrayList<>(conversation.size() + 1);
        if (system != null) {
            result.add(system);
        }
        result.addAll(conversation);
        return result;
    }

    boolean isToolResult(AgentMessage message) {
        return message.getRole() == MessageRole.TOOL || message.hasBlockOfType(ContentBlock.TYPE_TOOL_EXECUTION);
    }

    private boolean isCompressed(AgentMessage message) {
        return Boolean.TRUE.equals(message.metadataValue(META_COMPRESSED));
    }

    /**
     * 估算和截断共用的文本形态：纯文本直接使用，结构化内容序列化为 JSON 数组。
     */
    String render(AgentMessage message) {
        if (!message.isStructured()) {
            return message.getText() == null ? "" : message.getText();
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (ContentBlock block : message.getBlocks()) {
            blocks.add(block.asMap());
        }
        try {
            return objectMapper.writeValueAsString(blocks);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render message content: id=" + message.getId(), e);
        }
    }

    /**
     * 单次压缩内的 token 计数缓存，按消息实例记忆。
     */
    private final class TokenCounter {
        private final ContextBudget budget;
        private final Map<AgentMessage, Integer> cache = new IdentityHashMap<>();

        private TokenCounter(ContextBudget budget) {
            this.budget = budget;
        }

        int tokens(AgentMessage message) {
            Integer cached = cache.get(message);
            if (cached != null) {
                return cached;
            }
            int chars = render(message).length();
            int perToken = budget.charsPerToken();
            int value = (chars + perToken - 1) / perToken + runtimeProperties.getContext().getPerMessageOverheadTokens();
            cache.put(message, value);
            return value;
        }

        int total(List<AgentMessage> messages) {
            int sum = 0;
            for (AgentMessage message : messages) {
                sum += tokens(message);
            }
            return sum;
        }
    }
}
