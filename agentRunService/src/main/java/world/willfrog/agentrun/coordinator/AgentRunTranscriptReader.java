package world.willfrog.agentrun.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.ResponseEvent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 晚到的订阅方：先从 transcript 回放，再等待 new 通知增量读取，直到 run 结束。
 * <p>
 * 通知可能丢失，因此每个轮询间隔也会主动补读一次。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentRunTranscriptReader {

    private final RunCoordinationStore coordinationStore;
    private final RunSignalBus signalBus;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeProperties runtimeProperties;

    /**
     * @param fromIndex 起始下标（含）
     * @param consumer  事件回调，在调用线程上执行
     * @param maxWait   最长跟随时间
     * @return 下一次应从哪个下标继续读
     */
    public long follow(String runId, long fromIndex, Consumer<ResponseEvent> consumer, Duration maxWait) {
        BlockingQueue<String> wakeups = new LinkedBlockingQueue<>();
        long deadline = System.currentTimeMillis() + maxWait.toMillis();
        long pollMs = Math.max(1L, runtimeProperties.getCoordinator().getPollInterval().toMillis());
        try (RunSubscription ignored = signalBus.subscribe(
                List.of(RunKeys.newResponseChannel(runId), RunKeys.globalControlChannel(runId)), wakeups::add)) {
            Cursor cursor = new Cursor(fromIndex);
            read(runId, cursor, consumer);
            while (!cursor.ended) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    log.info("Stop following run {} after {}, next index {}", runId, maxWait, cursor.index);
                    break;
                }
                String token = wakeups.poll(Math.min(remaining, pollMs), TimeUnit.MILLISECONDS);
                read(runId, cursor, consumer);
                ControlSignal signal = ControlSignal.parse(token);
                if (signal != null) {
                    log.debug("Run {} signalled {}, stop following", runId, signal);
                    break;
                }
            }
            return cursor.index;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while following run {}", runId);
            return fromIndex;
        }
    }

    private void read(String runId, Cursor cursor, Consumer<ResponseEvent> consumer) {
        List<String> events = coordinationStore.readEvents(runId, cursor.index);
        for (String json : events) {
            cursor.index++;
            ResponseEvent event;
            try {
                event = objectMapper.readValue(json, ResponseEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Skip unreadable transcript entry {} of run {}", cursor.index - 1, runId, e);
                continue;
            }
            consumer.accept(event);
            if (event instanceof ResponseEvent.Status status && status.isTerminal()) {
                cursor.ended = true;
            }
        }
    }

    private static final class Cursor {
        private long index;
        private boolean ended;

        private Cursor(long index) {
            this.index = Math.max(0L, index);
        }
    }
}
