package world.willfrog.agentrun.turn;

import world.willfrog.agentrun.tool.ToolRegistry;

/**
 * 交给 {@link ResponseEventProcessor} 的子迭代上下文。
 *
 * @param threadId            线程 ID
 * @param tools               本次 run 的工具注册表
 * @param maxToolCallsPerTurn 单次回复最多执行的工具调用数，0 表示不限制
 */
public record TurnContext(String threadId, ToolRegistry tools, int maxToolCallsPerTurn) {
}
