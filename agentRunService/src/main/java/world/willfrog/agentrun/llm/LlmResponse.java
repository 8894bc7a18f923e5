package world.willfrog.agentrun.llm;

import dev.langchain4j.data.message.AiMessage;

import java.util.Iterator;
import java.util.List;

/**
 * 模型回复。非流式时只有一个最终片段；流式时先是若干文本增量，最后一个片段携带完整的 {@link AiMessage}。
 * <p>
 * 流式错误在迭代时抛出。
 */
public final class LlmResponse {

    private final boolean streaming;
    private final Iterator<Delta> deltas;

    private LlmResponse(boolean streaming, Iterator<Delta> deltas) {
        this.streaming = streaming;
        this.deltas = deltas;
    }

    public static LlmResponse completed(AiMessage message) {
        return new LlmResponse(false, List.of(Delta.complete(message)).iterator());
    }

    public static LlmResponse streaming(Iterator<Delta> deltas) {
        return new LlmResponse(true, deltas);
    }

    public boolean isStreaming() {
        return streaming;
    }

    public Iterator<Delta> deltas() {
        return deltas;
    }

    /**
     * @param text      文本增量，最终片段为 null
     * @param completed 完整回复，仅最终片段非空
     */
    public record Delta(String text, AiMessage completed) {

        public static Delta text(String text) {
            return new Delta(text, null);
        }

        public static Delta complete(AiMessage message) {
            return new Delta(null, message);
        }

        public boolean isFinal() {
            return completed != null;
        }
    }
}
