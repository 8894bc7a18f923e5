package world.willfrog.agentrun.context;

import org.slf4j.MDC;

/**
 * 当前执行线程的 run 上下文。
 * <p>
 * 同时写入 SLF4J MDC，日志 pattern 中的 runId/threadId/instanceId 由此而来。
 * 一个 run 只在一个执行线程上运行；transcript 写入线程需要单独设置。
 */
public class AgentContext {
    private static final String MDC_RUN_ID = "runId";
    private static final String MDC_THREAD_ID = "threadId";
    private static final String MDC_INSTANCE_ID = "instanceId";

    private static final ThreadLocal<String> RUN_ID_HOLDER = new ThreadLocal<>();
    private static final ThreadLocal<String> THREAD_ID_HOLDER = new ThreadLocal<>();
    private static final ThreadLocal<String> INSTANCE_ID_HOLDER = new ThreadLocal<>();

    public static void bind(String runId, String threadId, String instanceId) {
        setRunId(runId);
        setThreadId(threadId);
        setInstanceId(instanceId);
    }

    public static void setRunId(String runId) {
        RUN_ID_HOLDER.set(runId);
        putMdc(MDC_RUN_ID, runId);
    }

    public static String getRunId() {
        return RUN_ID_HOLDER.get();
    }

    public static void setThreadId(String threadId) {
        THREAD_ID_HOLDER.set(threadId);
        putMdc(MDC_THREAD_ID, threadId);
    }

    public static String getThreadId() {
        return THREAD_ID_HOLDER.get();
    }

    public static void setInstanceId(String instanceId) {
        INSTANCE_ID_HOLDER.set(instanceId);
        putMdc(MDC_INSTANCE_ID, instanceId);
    }

    public static String getInstanceId() {
        return INSTANCE_ID_HOLDER.get();
    }

    public static void clear() {
        RUN_ID_HOLDER.remove();
        THREAD_ID_HOLDER.remove();
        INSTANCE_ID_HOLDER.remove();
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_THREAD_ID);
        MDC.remove(MDC_INSTANCE_ID);
    }

    private static void putMdc(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
