package world.willfrog.agentrun.coordinator;

/**
 * run 协调用到的 Redis key 与频道名。
 */
public final class RunKeys {

    public static final String NEW_RESPONSE_TOKEN = "new";

    private static final String LOCK_PREFIX = "agent_run_lock:";
    private static final String ACTIVE_PREFIX = "active_run:";
    private static final String RUN_PREFIX = "agent_run:";

    private RunKeys() {
    }

    public static String lock(String runId) {
        return LOCK_PREFIX + runId;
    }

    public static String liveness(String instanceId, String runId) {
        return ACTIVE_PREFIX + instanceId + ":" + runId;
    }

    /**
     * 匹配某个 run 在所有实例上的存活 key。
     */
    public static String livenessPattern(String runId) {
        return ACTIVE_PREFIX + "*:" + runId;
    }

    /**
     * 从存活 key 中取出实例 ID，格式不符时返回 null。
     */
    public static String instanceOf(String livenessKey, String runId) {
        String suffix = ":" + runId;
        if (livenessKey == null || !livenessKey.startsWith(ACTIVE_PREFIX) || !livenessKey.endsWith(suffix)) {
            return null;
        }
        String instanceId = livenessKey.substring(ACTIVE_PREFIX.length(), livenessKey.length() - suffix.length());
        return instanceId.isEmpty() ? null : instanceId;
    }

    public static String transcript(String runId) {
        return RUN_PREFIX + runId + ":responses";
    }

    public static String newResponseChannel(String runId) {
        return RUN_PREFIX + runId + ":new_response";
    }

    public static String instanceControlChannel(String runId, String instanceId) {
        return RUN_PREFIX + runId + ":control:" + instanceId;
    }

    public static String globalControlChannel(String runId) {
        return RUN_PREFIX + runId + ":control";
    }
}
