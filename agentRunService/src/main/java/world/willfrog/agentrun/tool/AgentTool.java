package world.willfrog.agentrun.tool;

import dev.langchain4j.agent.tool.ToolSpecification;

import java.util.Map;

/**
 * 可被模型调用的工具。具体工具实现由调用方提供，通过 {@link ToolRegistry} 注册。
 */
public interface AgentTool {

    ToolSpecification specification();

    /**
     * 执行工具，返回发给模型的文本结果。抛出的异常由注册表转换为失败结果。
     */
    String execute(Map<String, Object> params);

    /**
     * 为 true 时，工具产出结果后 run 的 turn 循环结束（如 ask / complete）。
     */
    default boolean terminating() {
        return false;
    }

    default String name() {
        return specification().name();
    }
}
