package world.willfrog.agentrun.coordinator;

import world.willfrog.agentrun.model.AgentRunStatus;

/**
 * 一次 execute 调用的结果。
 *
 * @param runId      run ID
 * @param result     是否真正执行
 * @param status     执行后的终态，未执行时为 null
 * @param eventCount 写入 transcript 的事件数
 */
public record RunOutcome(String runId, Result result, AgentRunStatus status, int eventCount) {

    public enum Result {
        EXECUTED,
        /** 锁被其他实例持有 */
        ALREADY_RUNNING,
        /** run 已是终态或不存在 */
        ALREADY_FINISHED
    }

    public static RunOutcome executed(String runId, AgentRunStatus status, int eventCount) {
        return new RunOutcome(runId, Result.EXECUTED, status, eventCount);
    }

    public static RunOutcome skipped(String runId, Result result) {
        return new RunOutcome(runId, result, null, 0);
    }

    public boolean isExecuted() {
        return result == Result.EXECUTED;
    }
}
