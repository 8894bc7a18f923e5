package world.willfrog.agentrun.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.config.AgentRuntimeProperties;
import world.willfrog.agentrun.context.AgentContext;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.ResponseEvent;
import world.willfrog.agentrun.model.RunInvocation;
import world.willfrog.agentrun.service.AgentRunStatusService;
import world.willfrog.agentrun.turn.ResponseEventStream;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 在 worker 上执行一次 run 调用。
 * <p>
 * 流程：
 * 1. 获取分布式锁（SETNX），被其他实例持有则直接返回；
 * 2. 标记 RUNNING，run 已是终态时视为重复投递；
 * 3. 订阅控制频道并启动轮询，事件逐条追加到 transcript 并发布 new 通知；
 * 4. 遇到终态 status 事件、流耗尽或收到 STOP 后落库终态，并在全局控制频道发布结束信号；
 * 5. 无论成功失败都执行清理，最后释放锁。
 * <p>
 * 停止是协作式的，只在事件边界生效。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunCoordinator {

    private static final long APPEND_RETRY_BACKOFF_MS = 100L;

    private final RunCoordinationStore coordinationStore;
    private final RunSignalBus signalBus;
    private final RunEventSource eventSource;
    private final AgentRunStatusService statusService;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeProperties runtimeProperties;
    private final ScheduledExecutorService runControlScheduler;

    public RunOutcome execute(RunInvocation invocation) {
        if (invocation == null || invocation.getRunId() == null || invocation.getRunId().isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        String runId = invocation.getRunId();
        String instanceId = runtimeProperties.getCoordinator().getInstanceId();
        AgentContext.bind(runId, invocation.getThreadId(), instanceId);
        try {
            if (!acquireLock(runId, instanceId)) {
                return RunOutcome.skipped(runId, RunOutcome.Result.ALREADY_RUNNING);
            }
            try {
                if (!statusService.markRunning(runId)) {
                    return RunOutcome.skipped(runId, RunOutcome.Result.ALREADY_FINISHED);
                }
                log.info("Run started: runId={}, threadId={}, model={}",
                        runId, invocation.getThreadId(), invocation.getModelName());
                return new RunExecution(invocation, instanceId).run();
            } finally {
                releaseLock(runId, instanceId);
            }
        } finally {
            AgentContext.clear();
        }
    }

    private boolean acquireLock(String runId, String instanceId) {
        Duration ttl = runtimeProperties.getCoordinator().getLockTtl();
        if (coordinationStore.tryAcquireLock(runId, instanceId, ttl)) {
            return true;
        }
        String owner = coordinationStore.lockOwner(runId);
        if (owner != null) {
            log.info("Run {} is already being executed by instance {}, skip", runId, owner);
            return false;
        }
        // 锁在两次调用之间过期，只再尝试一次
        if (coordinationStore.tryAcquireLock(runId, instanceId, ttl)) {
            return true;
        }
        log.info("Run {} lock contended, skip", runId);
        return false;
    }

    private void releaseLock(String runId, String instanceId) {
        try {
            coordinationStore.releaseLock(runId, instanceId);
        } catch (RuntimeException e) {
            log.error("Failed to release run lock: runId={}", runId, e);
        }
    }

    static AgentRunStatus toRunStatus(ResponseEvent.Status status) {
        return switch (status.status()) {
            case ResponseEvent.Status.COMPLETED -> AgentRunStatus.COMPLETED;
            case ResponseEvent.Status.STOPPED -> AgentRunStatus.STOPPED;
            default -> AgentRunStatus.FAILED;
        };
    }

    static ControlSignal toControlSignal(AgentRunStatus status) {
        return switch (status) {
            case COMPLETED -> ControlSignal.END_STREAM;
            case STOPPED -> ControlSignal.STOP;
            default -> ControlSignal.ERROR;
        };
    }

    /**
     * 单次 run 的执行状态。只在持有锁期间存在。
     */
    private final class RunExecution {

        private final RunInvocation invocation;
        private final String runId;
        private final String instanceId;
        private final AgentRuntimeProperties.Coordinator config;
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);
        private final Queue<String> controlInbox = new ConcurrentLinkedQueue<>();
        private final AtomicReference<RuntimeException> writeFailure = new AtomicReference<>();
        private final AtomicInteger appended = new AtomicInteger();
        private final ExecutorService writer;
        private int ticks;

        private RunExecution(RunInvocation invocation, String instanceId) {
            this.invocation = invocation;
            this.runId = invocation.getRunId();
            this.instanceId = instanceId;
            this.config = runtimeProperties.getCoordinator();
            String threadId = invocation.getThreadId();
            this.writer = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(() -> {
                    AgentContext.bind(runId, threadId, instanceId);
                    try {
                        runnable.run();
                    } finally {
                        AgentContext.clear();
                    }
                }, "run-writer-" + runId);
                thread.setDaemon(true);
                return thread;
            });
        }

        private RunOutcome run() {
            ScheduledFuture<?> poller = null;
            RunSubscription subscription = null;
            ResponseEventStream stream = null;
            try {
                subscription = signalBus.subscribe(
                        List.of(RunKeys.instanceControlChannel(runId, instanceId), RunKeys.globalControlChannel(runId)),
                        controlInbox::add);
                coordinationStore.markAlive(instanceId, runId, config.getLivenessTtl());
                long intervalMs = Math.max(1L, config.getPollInterval().toMillis());
                poller = runControlScheduler.scheduleWithFixedDelay(this::pollTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

                stream = eventSource.open(invocation);
                return consume(stream);
            } catch (Exception e) {
                return fail(e);
            } finally {
                cleanup(poller, subscription, stream);
            }
        }

        private RunOutcome consume(ResponseEventStream stream) {
            ResponseEvent.Status terminal = null;
            while (!stopSeen() && stream.hasNext()) {
                ResponseEvent event = stream.next();
                if (stopSeen()) {
                    break;
                }
                append(event);
                if (event instanceof ResponseEvent.Status status && status.isTerminal()) {
                    terminal = status;
                    break;
                }
            }

            AgentRunStatus status;
            String error = null;
            if (terminal != null) {
                status = toRunStatus(terminal);
                if (status == AgentRunStatus.FAILED) {
                    error = terminal.message();
                }
            } else if (stopRequested.get()) {
                log.info("Run stopped on request: runId={}", runId);
                append(ResponseEvent.Status.stopped("Run stopped by user"));
                status = AgentRunStatus.STOPPED;
            } else {
                append(ResponseEvent.Status.completed("Run completed"));
                status = AgentRunStatus.COMPLETED;
            }

            flushWriter();
            List<String> transcript = coordinationStore.readEvents(runId, 0L);
            statusService.persistTerminal(runId, status, error, transcript);
            publishControl(toControlSignal(status));
            log.info("Run finished: runId={}, status={}, events={}", runId, status, appended.get());
            return RunOutcome.executed(runId, status, appended.get());
        }

        private RunOutcome fail(Exception e) {
            log.error("Run failed: runId={}", runId, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            String errorJson = serialize(ResponseEvent.Status.error(message));
            List<String> transcript;
            try {
                flushWriter();
                appendWithRetry(errorJson);
                transcript = coordinationStore.readEvents(runId, 0L);
            } catch (RuntimeException appendError) {
                log.warn("Failed to append error event to transcript: runId={}", runId, appendError);
                transcript = List.of(errorJson);
            }
            try {
                statusService.persistTerminal(runId, AgentRunStatus.FAILED, message + "\n" + stackTrace(e), transcript);
            } catch (RuntimeException persistError) {
                log.error("Failed to persist failed run: runId={}", runId, persistError);
            }
            publishControl(ControlSignal.ERROR);
            return RunOutcome.executed(runId, AgentRunStatus.FAILED, appended.get());
        }

        private boolean stopSeen() {
            RuntimeException failure = writeFailure.get();
            if (failure != null) {
                throw failure;
            }
            drainControlInbox();
            return stopRequested.get();
        }

        private void drainControlInbox() {
            String token;
            while ((token = controlInbox.poll()) != null) {
                ControlSignal signal = ControlSignal.parse(token);
                if (signal == ControlSignal.STOP) {
                    if (stopRequested.compareAndSet(false, true)) {
                        log.info("Stop requested: runId={}", runId);
                    }
                } else {
                    log.debug("Ignore control token {} for runId={}", token, runId);
                }
            }
        }

        private void pollTick() {
            try {
                drainControlInbox();
                ticks++;
                int refreshTicks = Math.max(1, config.getLivenessRefreshTicks());
                if (ticks % refreshTicks == 0) {
                    coordinationStore.markAlive(instanceId, runId, config.getLivenessTtl());
                }
            } catch (RuntimeException e) {
                log.error("Control poller failed, requesting stop: runId={}", runId, e);
                stopRequested.set(true);
            }
        }

        private void append(ResponseEvent event) {
            String json = serialize(event);
            writer.execute(() -> {
                if (writeFailure.get() != null) {
                    return;
                }
                try {
                    appendWithRetry(json);
                } catch (RuntimeException e) {
                    log.error("Transcript append failed: runId={}", runId, e);
                    writeFailure.compareAndSet(null, e);
                    return;
                }
                try {
                    signalBus.publish(RunKeys.newResponseChannel(runId), RunKeys.NEW_RESPONSE_TOKEN);
                } catch (RuntimeException e) {
                    log.warn("Failed to publish new response notification: runId={}", runId, e);
                }
            });
        }

        private void appendWithRetry(String json) {
            int attempts = Math.max(1, config.getAppendRetryAttempts());
            RuntimeException last = null;
            for (int attempt = 0; attempt < attempts; attempt++) {
                try {
                    coordinationStore.appendEvent(runId, json);
                    appended.incrementAndGet();
                    return;
                } catch (RuntimeException e) {
                    last = e;
                    log.warn("Transcript append failed (attempt {}/{}): runId={}", attempt + 1, attempts, runId, e);
                    if (attempt + 1 < attempts) {
                        sleepQuietly(APPEND_RETRY_BACKOFF_MS * (1L << attempt));
                    }
                }
            }
            throw new DurableWriteException("Failed to append event for run " + runId + " after " + attempts + " attempts", last);
        }

        private void flushWriter() {
            Future<?> barrier = writer.submit(() -> { });
            try {
                barrier.get(config.getWriterAwaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DurableWriteException("Interrupted while flushing transcript for run " + runId, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new DurableWriteException("Failed to flush transcript for run " + runId, e);
            }
            RuntimeException failure = writeFailure.get();
            if (failure != null) {
                throw failure;
            }
        }

        private void publishControl(ControlSignal signal) {
            try {
                signalBus.publish(RunKeys.globalControlChannel(runId), signal.name());
            } catch (RuntimeException e) {
                log.warn("Failed to publish {} for runId={}", signal, runId, e);
            }
        }

        private void cleanup(ScheduledFuture<?> poller, RunSubscription subscription, ResponseEventStream stream) {
            if (poller != null) {
                poller.cancel(false);
            }
            if (subscription != null) {
                try {
                    subscription.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close control subscription: runId={}", runId, e);
                }
            }
            if (stream != null) {
                try {
                    stream.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close event stream: runId={}", runId, e);
                }
            }
            try {
                coordinationStore.expireTranscript(runId, config.getTranscriptRetention());
            } catch (RuntimeException e) {
                log.warn("Failed to set transcript retention: runId={}", runId, e);
            }
            try {
                coordinationStore.clearAlive(instanceId, runId);
            } catch (RuntimeException e) {
                log.warn("Failed to clear liveness key: runId={}", runId, e);
            }
            writer.shutdown();
            try {
                if (!writer.awaitTermination(config.getWriterAwaitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Transcript writer did not finish within {}: runId={}", config.getWriterAwaitTimeout(), runId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for transcript writer: runId={}", runId);
            }
        }

        private String serialize(ResponseEvent event) {
            try {
                return objectMapper.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize event " + event.getClass().getSimpleName(), e);
            }
        }

        private void sleepQuietly(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DurableWriteException("Interrupted while retrying transcript append for run " + runId, e);
            }
        }

        private String stackTrace(Throwable e) {
            StringWriter buffer = new StringWriter();
            e.printStackTrace(new PrintWriter(buffer));
            return buffer.toString();
        }
    }
}
